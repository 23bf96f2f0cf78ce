package ru.oparin.tutor.exception;

import org.springframework.http.HttpStatus;

public class RateLimitExceededException extends AuthException {

    public RateLimitExceededException() {
        super(HttpStatus.TOO_MANY_REQUESTS, "Too many attempts, please try again later");
    }
}
