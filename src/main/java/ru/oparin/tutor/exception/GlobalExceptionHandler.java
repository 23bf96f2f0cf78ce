package ru.oparin.tutor.exception;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);

        return Mono.just(ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Internal server error",
                        "status", 500
                )));
    }

    @ExceptionHandler(AuthException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAuthException(AuthException ex) {
        log.warn("Ошибка аутентификации: {}", ex.getMessage());
        return errorResponse(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(ProfileValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleProfileValidationException(ProfileValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Validation failed",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleProfileNotFoundException(ProfileNotFoundException ex) {
        return errorResponse(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleStorageUnavailableException(StorageUnavailableException ex) {
        log.error("Хранилище недоступно: {}", ex.getMessage());
        return errorResponse(ex.getStatus(), "Service temporarily unavailable, please retry");
    }

    @ExceptionHandler(AnswerGenerationFailedException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAnswerGenerationFailedException(AnswerGenerationFailedException ex) {
        log.error("Ошибка построения ответа: {}", ex.getMessage());

        if (ex.getCause() != null) {
            log.error("Cause: {}", ex.getCause().getMessage());
        }

        return errorResponse(ex.getStatus(), "We could not produce an answer right now, please try again");
    }

    @ExceptionHandler(ValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(ValidationException ex) {
        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Validation failed",
                        "status", 400,
                        "details", ex.getMessage()
                )));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Map<String, String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ?
                                fieldError.getDefaultMessage() : "Invalid value",
                        (first, second) -> first
                ));

        return Mono.just(ResponseEntity.badRequest()
                .body(Map.of(
                        "error", "Validation failed",
                        "status", 400,
                        "details", errors
                )));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleServerWebInputException(ServerWebInputException ex) {
        log.warn("Некорректное тело запроса: {}", ex.getReason());
        return errorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    private Mono<ResponseEntity<Map<String, Object>>> errorResponse(HttpStatus status, String message) {
        return Mono.just(ResponseEntity.status(status)
                .body(Map.of(
                        "error", message,
                        "status", status.value()
                )));
    }
}
