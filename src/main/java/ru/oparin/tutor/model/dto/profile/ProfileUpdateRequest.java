package ru.oparin.tutor.model.dto.profile;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Частичное обновление профиля: null означает "не менять".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @Schema(description = "Опыт в разработке ПО", example = "Intermediate")
    private String softwareExperience;

    @Schema(description = "Опыт работы с железом", example = "Basic")
    private String hardwareExperience;

    @Schema(description = "Новый список интересов (заменяет прежний)")
    private List<String> interests;
}
