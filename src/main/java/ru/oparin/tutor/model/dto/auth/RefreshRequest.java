package ru.oparin.tutor.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@ToString
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshRequest {

    @ToString.Exclude
    @NotBlank(message = "Refresh token is required")
    @Schema(description = "Действующий refresh-токен")
    private String refreshToken;
}
