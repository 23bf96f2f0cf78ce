package ru.oparin.tutor.model.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Пара токенов, выданная при создании или ротации сессии.
 */
@Value
@Builder
public class IssuedTokens {

    Long accountId;

    @ToString.Exclude
    String accessToken;

    @ToString.Exclude
    String refreshToken;

    /** Время жизни access-токена в секундах */
    long expiresIn;
}
