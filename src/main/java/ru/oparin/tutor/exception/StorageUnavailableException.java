package ru.oparin.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Хранилище аккаунтов, профилей или сессий недоступно либо не ответило за отведенное время.
 */
@Getter
public class StorageUnavailableException extends RuntimeException {
    private final HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
