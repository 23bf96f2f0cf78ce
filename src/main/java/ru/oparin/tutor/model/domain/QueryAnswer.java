package ru.oparin.tutor.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Результат обработки вопроса.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryAnswer {

    private String answer;

    private List<RetrievedPassage> citations;

    private boolean personalizationApplied;

    /** Инструкция, переданная модели генерации */
    private String instruction;

    /** Идентификатор записи в истории, если запись включена и удалась */
    private Long queryId;

    /** Время поиска фрагментов, мс */
    private Long retrievalTimeMs;

    /** Время генерации ответа, мс */
    private Long answerTimeMs;

    /** Полное время обработки вопроса, включая загрузку профиля, мс */
    private Long totalTimeMs;
}
