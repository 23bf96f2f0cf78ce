package ru.oparin.tutor.model.dto.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitationDTO {

    private String chapter;

    private String section;

    private String url;

    /** Начало фрагмента, не длиннее 300 символов */
    private String preview;

    private double score;
}
