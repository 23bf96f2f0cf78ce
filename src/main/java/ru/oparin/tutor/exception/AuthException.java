package ru.oparin.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Базовое исключение аутентификации. Сообщение уходит клиенту как есть,
 * поэтому подробности причины должны оставаться только в логах.
 */
public class AuthException extends RuntimeException {
    @Getter
    private final HttpStatus status;


    public AuthException(HttpStatus status, String message) {
        super(message);
        this.status = status;

    }
}
