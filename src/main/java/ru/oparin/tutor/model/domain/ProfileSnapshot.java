package ru.oparin.tutor.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;

import java.util.List;

/**
 * Неизменяемый снимок профиля, по которому строится инструкция и который сохраняется в истории вопросов.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSnapshot {

    private SoftwareExperience softwareExperience;

    private HardwareExperience hardwareExperience;

    @Builder.Default
    private List<String> interests = List.of();
}
