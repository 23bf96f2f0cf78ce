package ru.oparin.tutor.model.enums;

import ru.oparin.tutor.exception.ProfileValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Уровень опыта в разработке ПО.
 */
public enum SoftwareExperience {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    /**
     * Разобрать значение без учета регистра.
     *
     * @throws ProfileValidationException если значение не входит в перечисление
     */
    public static SoftwareExperience parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ProfileValidationException("softwareExperience is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProfileValidationException("softwareExperience must be one of " + allowed());
        }
    }

    private static String allowed() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
