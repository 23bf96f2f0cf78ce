package ru.oparin.tutor.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.query")
public class QueryProperties {

    /**
     * Общий дедлайн на поиск фрагментов и генерацию ответа.
     */
    private Duration deadline = Duration.ofSeconds(8);

    /**
     * Короткий дедлайн на загрузку профиля. При превышении ответ строится без персонализации.
     */
    private Duration profileTimeout = Duration.ofMillis(500);

    private boolean recordEnabled = true;

    /**
     * Срок хранения истории вопросов в днях. 0 - хранить бессрочно.
     */
    private int retentionDays = 0;

    /**
     * Отклонять запрос с невалидным токеном (401) вместо анонимного ответа.
     */
    private boolean rejectInvalidToken = true;

    private int maxQuestionLength = 5000;
}
