package ru.oparin.tutor.model.dto.query;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "Question must not be blank")
    @Schema(description = "Вопрос по учебнику", example = "What is inverse kinematics?")
    private String question;
}
