package ru.oparin.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Ошибка валидации данных профиля: неизвестный уровень опыта, слишком много интересов и т.п.
 * Выбрасывается до обращения к хранилищу.
 */
@Getter
public class ProfileValidationException extends RuntimeException {
    private final HttpStatus status = HttpStatus.BAD_REQUEST;

    public ProfileValidationException(String message) {
        super(message);
    }
}
