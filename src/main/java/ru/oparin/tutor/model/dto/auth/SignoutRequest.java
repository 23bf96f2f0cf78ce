package ru.oparin.tutor.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Тело запроса выхода. Без refreshToken завершаются все сессии аккаунта.
 */
@ToString
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignoutRequest {

    @ToString.Exclude
    @Schema(description = "Refresh-токен завершаемой сессии; если не указан, завершаются все сессии")
    private String refreshToken;
}
