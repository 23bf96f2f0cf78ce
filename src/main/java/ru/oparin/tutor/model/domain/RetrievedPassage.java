package ru.oparin.tutor.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Фрагмент учебника, найденный векторным поиском, с метаданными для цитирования.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedPassage {

    private String passageText;

    private String sourceChapter;

    private String sourceSection;

    private String sourceUrl;

    private double relevanceScore;
}
