package ru.oparin.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Ошибка поиска фрагментов или генерации ответа.
 * В отличие от ошибок персонализации никогда не подавляется и всегда доходит до клиента.
 */
@Getter
public class AnswerGenerationFailedException extends RuntimeException {
    private final HttpStatus status;

    public AnswerGenerationFailedException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public AnswerGenerationFailedException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
