package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

public class DuplicateEmailException extends AuthException {

    public DuplicateEmailException() {
        super(HttpStatus.BAD_REQUEST, "An account with this email already exists");
    }
}
