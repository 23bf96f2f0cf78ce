package ru.oparin.tutor.model.dto.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO для ответа эндпоинта /embeddings (OpenAI-совместимый формат).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingResponseDTO {

    private String object;
    private String model;
    private List<EmbeddingData> data;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EmbeddingData {
        private Integer index;
        private List<Double> embedding;
    }
}
