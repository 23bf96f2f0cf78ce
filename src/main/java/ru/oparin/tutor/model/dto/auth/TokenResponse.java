package ru.oparin.tutor.model.dto.auth;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import ru.oparin.tutor.model.domain.IssuedTokens;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    @ToString.Exclude
    @Schema(description = "JWT access-токен", example = "eyJhbGciOiJIUzI1NiJ9...")
    private String accessToken;

    @ToString.Exclude
    @Schema(description = "Refresh-токен, одноразовый")
    private String refreshToken;

    @Builder.Default
    @Schema(description = "Тип токена", example = "bearer")
    private String tokenType = "bearer";

    @Schema(description = "Время жизни access-токена в секундах", example = "900")
    private long expiresIn;

    public static TokenResponse fromIssued(IssuedTokens tokens) {
        return TokenResponse.builder()
                .accessToken(tokens.getAccessToken())
                .refreshToken(tokens.getRefreshToken())
                .expiresIn(tokens.getExpiresIn())
                .build();
    }
}
