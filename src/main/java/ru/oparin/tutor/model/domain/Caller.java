package ru.oparin.tutor.model.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Optional;

/**
 * Автор вопроса: анонимный пользователь или пользователь с проверенным access-токеном.
 * Определяется один раз в начале обработки вопроса.
 */
@EqualsAndHashCode
@ToString
public final class Caller {

    private static final Caller ANONYMOUS = new Caller(null);

    private final Long accountId;

    private Caller(Long accountId) {
        this.accountId = accountId;
    }

    public static Caller anonymous() {
        return ANONYMOUS;
    }

    public static Caller identified(Long accountId) {
        if (accountId == null) {
            throw new IllegalArgumentException("accountId is required for identified caller");
        }
        return new Caller(accountId);
    }

    public boolean isIdentified() {
        return accountId != null;
    }

    public Optional<Long> getAccountId() {
        return Optional.ofNullable(accountId);
    }
}
