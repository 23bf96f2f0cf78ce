package ru.oparin.tutor.model.dto.retrieval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO для ответа поиска точек в векторном хранилище (формат Qdrant REST API).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorSearchResponseDTO {

    private String status;
    private Double time;
    private List<ScoredPoint> result;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScoredPoint {
        private Object id;
        private Integer version;
        private Double score;
        private Map<String, Object> payload;
    }
}
