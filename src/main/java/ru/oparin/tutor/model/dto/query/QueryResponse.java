package ru.oparin.tutor.model.dto.query;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String answer;

    private List<CitationDTO> citations;

    @Schema(description = "true, если инструкция была построена по профилю пользователя")
    private boolean personalizationApplied;

    @Schema(description = "ID записи в истории вопросов, если запись сохранена")
    private Long queryId;

    @Schema(description = "Время поиска фрагментов, мс")
    private Long retrievalTimeMs;

    @Schema(description = "Время генерации ответа, мс")
    private Long answerTimeMs;

    @Schema(description = "Полное время обработки вопроса, мс")
    private Long totalTimeMs;
}
