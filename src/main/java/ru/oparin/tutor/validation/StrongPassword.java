package ru.oparin.tutor.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

@Documented
@Constraint(validatedBy = StrongPasswordValidator.class)
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface StrongPassword {
    String message() default "Password must be at least 8 characters long and contain upper and lower case letters, a digit and a symbol";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
