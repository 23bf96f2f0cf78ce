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
public class SigninRequest {

    @NotBlank(message = "Email is required")
    @Schema(description = "Email адрес", example = "student@example.com")
    private String email;

    @ToString.Exclude
    @NotBlank(message = "Password is required")
    @Schema(description = "Пароль", example = "Aa1!aaaa")
    private String password;
}
