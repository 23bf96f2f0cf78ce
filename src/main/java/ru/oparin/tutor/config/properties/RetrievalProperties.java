package ru.oparin.tutor.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

    private Api embedding = new Api();

    private Api vectorStore = new Api();

    private String embeddingModel = "text-embedding-3-small";

    private String collection = "textbook_chunks";

    private Integer topK = 5;

    private Double scoreThreshold = 0.5;

    /** Таймаут одного HTTP-вызова в миллисекундах */
    private Integer timeout = 5000;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        private String url;
        private String key;
    }
}
