package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

public class WeakPasswordException extends AuthException {

    public WeakPasswordException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
