package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

public class InvalidOrExpiredSessionException extends AuthException {

    public static final String MESSAGE = "Invalid or expired session";

    public InvalidOrExpiredSessionException() {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
    }
}
