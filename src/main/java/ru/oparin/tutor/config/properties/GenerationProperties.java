package ru.oparin.tutor.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Настройки OpenAI-совместимого API генерации ответов.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {

    private Api api = new Api();

    private String model = "gpt-4o-mini";

    private Integer maxTokens = 500;

    private Double temperature = 0.3;

    /** Таймаут HTTP-вызова в миллисекундах */
    private Integer timeout = 7000;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        private String url;
        private String key;
    }
}
