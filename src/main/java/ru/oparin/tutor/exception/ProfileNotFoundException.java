package ru.oparin.tutor.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ProfileNotFoundException extends RuntimeException {
    private final HttpStatus status;

    public ProfileNotFoundException(String message) {
        super(message);
        this.status = HttpStatus.NOT_FOUND;
    }
}
