package ru.oparin.tutor.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Минимальная политика паролей: не короче 8 символов, есть заглавная и строчная буква,
 * цифра и символ (любой знак, не являющийся буквой или цифрой).
 */
public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    public static final int MIN_LENGTH = 8;

    /** Ограничение BCrypt: учитываются только первые 72 байта */
    public static final int MAX_BYTES = 72;

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        if (password == null) {
            // @NotBlank на поле сообщит об отсутствии пароля
            return true;
        }
        Optional<String> violation = findViolation(password);
        if (violation.isPresent()) {
            context.disableDefaultConstraintViolation();
            context.buildConstraintViolationWithTemplate(violation.get())
                    .addConstraintViolation();
            return false;
        }
        return true;
    }

    /**
     * Проверяет пароль и возвращает описание первого нарушенного правила.
     *
     * @param password пароль в открытом виде
     * @return пустой Optional, если пароль соответствует политике
     */
    public static Optional<String> findViolation(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            return Optional.of("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            return Optional.of("Password must not exceed " + MAX_BYTES + " bytes");
        }

        boolean hasLower = false;
        boolean hasUpper = false;
        boolean hasDigit = false;
        boolean hasSymbol = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isLowerCase(c)) {
                hasLower = true;
            } else if (Character.isUpperCase(c)) {
                hasUpper = true;
            } else if (Character.isDigit(c)) {
                hasDigit = true;
            } else if (!Character.isLetter(c) && !Character.isWhitespace(c)) {
                hasSymbol = true;
            }
        }

        if (!hasLower) {
            return Optional.of("Password must contain a lowercase letter");
        }
        if (!hasUpper) {
            return Optional.of("Password must contain an uppercase letter");
        }
        if (!hasDigit) {
            return Optional.of("Password must contain a digit");
        }
        if (!hasSymbol) {
            return Optional.of("Password must contain a symbol");
        }
        return Optional.empty();
    }
}
