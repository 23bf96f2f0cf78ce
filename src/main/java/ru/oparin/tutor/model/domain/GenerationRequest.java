package ru.oparin.tutor.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    private String question;

    private List<RetrievedPassage> passages;

    /** Системная инструкция: персонализированная или инструкция по умолчанию */
    private String instruction;
}
