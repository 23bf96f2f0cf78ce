package ru.oparin.tutor.validation;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StrongPasswordValidatorTest {

    @Test
    void passwordMatchingPolicyShouldPass() {
        assertEquals(Optional.empty(), StrongPasswordValidator.findViolation("Aa1!aaaa"));
        assertEquals(Optional.empty(), StrongPasswordValidator.findViolation("Correct-Horse-7"));
    }

    @Test
    void shortPasswordShouldBeRejected() {
        assertEquals(Optional.of("Password must be at least 8 characters long"),
                StrongPasswordValidator.findViolation("Aa1!aaa"));
    }

    @Test
    void eachMissingCharacterClassShouldBeReported() {
        assertEquals(Optional.of("Password must contain a lowercase letter"), StrongPasswordValidator.findViolation("AA1!AAAA"));
        assertEquals(Optional.of("Password must contain an uppercase letter"), StrongPasswordValidator.findViolation("aa1!aaaa"));
        assertEquals(Optional.of("Password must contain a digit"), StrongPasswordValidator.findViolation("Aab!aaaa"));
        assertEquals(Optional.of("Password must contain a symbol"), StrongPasswordValidator.findViolation("Aa1aaaaa"));
    }

    @Test
    void whitespaceShouldNotCountAsSymbol() {
        assertEquals(Optional.of("Password must contain a symbol"), StrongPasswordValidator.findViolation("Aa1 aaaa"));
    }

    @Test
    void passwordLongerThanBcryptLimitShouldBeRejected() {
        String tooLong = "Aa1!" + "a".repeat(StrongPasswordValidator.MAX_BYTES);

        assertEquals(Optional.of("Password must not exceed 72 bytes"), StrongPasswordValidator.findViolation(tooLong));
    }

    @Test
    void nullShouldBeLeftToNotBlank() {
        assertTrue(new StrongPasswordValidator().isValid(null, null));
    }
}
