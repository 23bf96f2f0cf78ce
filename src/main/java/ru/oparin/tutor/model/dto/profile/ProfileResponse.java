package ru.oparin.tutor.model.dto.profile;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    @Schema(description = "ID аккаунта", example = "42")
    private Long accountId;

    private String email;

    @Schema(example = "BEGINNER")
    private String softwareExperience;

    @Schema(example = "NONE")
    private String hardwareExperience;

    private List<String> interests;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime lastLoginAt;
}
