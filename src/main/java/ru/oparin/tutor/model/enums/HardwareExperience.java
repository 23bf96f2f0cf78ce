package ru.oparin.tutor.model.enums;

import ru.oparin.tutor.exception.ProfileValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Уровень опыта работы с железом и робототехникой.
 */
public enum HardwareExperience {
    NONE,
    BASIC,
    ADVANCED;

    public static HardwareExperience parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ProfileValidationException("hardwareExperience is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProfileValidationException("hardwareExperience must be one of "
                    + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
        }
    }
}
