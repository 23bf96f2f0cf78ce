package ru.oparin.tutor.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AuthResponse {

    @Schema(description = "ID аккаунта", example = "42")
    private Long accountId;

    @Schema(description = "Email адрес", example = "student@example.com")
    private String email;

    @Schema(description = "Выданные токены")
    private TokenResponse tokens;
}
