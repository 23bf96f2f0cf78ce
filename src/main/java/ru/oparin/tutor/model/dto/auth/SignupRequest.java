package ru.oparin.tutor.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import ru.oparin.tutor.validation.StrongPassword;

import java.util.ArrayList;
import java.util.List;

@ToString
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignupRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    @Size(max = 255)
    @Schema(description = "Email адрес", example = "student@example.com")
    private String email;

    /**
     * Та же политика повторно проверяется в AuthService для вызовов в обход контроллера.
     */
    @ToString.Exclude
    @NotBlank(message = "Password is required")
    @StrongPassword
    @Schema(description = "Пароль (минимум 8 символов: заглавные и строчные буквы, цифра и символ)", example = "Aa1!aaaa")
    private String password;

    @Schema(description = "Опыт в разработке ПО", example = "Beginner", allowableValues = {"Beginner", "Intermediate", "Advanced"})
    private String softwareExperience;

    @Schema(description = "Опыт работы с железом", example = "None", allowableValues = {"None", "Basic", "Advanced"})
    private String hardwareExperience;

    @Builder.Default
    @Schema(description = "Интересы (не более 10)", example = "[\"ROS 2\", \"computer vision\"]")
    private List<String> interests = new ArrayList<>();
}
