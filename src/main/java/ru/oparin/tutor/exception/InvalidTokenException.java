package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

/**
 * Access-токен не прошел проверку: подпись, срок действия или тип.
 * Все причины сведены к одному исключению.
 */
public class InvalidTokenException extends AuthException {

    public static final String MESSAGE = "Invalid or expired access token";

    public InvalidTokenException() {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
    }
}
