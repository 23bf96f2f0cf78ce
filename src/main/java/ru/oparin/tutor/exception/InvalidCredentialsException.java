package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

/**
 * Единая ошибка входа: не различает "нет такого аккаунта", "неверный пароль" и "аккаунт отключен".
 */
public class InvalidCredentialsException extends AuthException {

    public static final String MESSAGE = "Invalid email or password";

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
    }
}
