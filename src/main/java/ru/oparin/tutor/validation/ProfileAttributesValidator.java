package ru.oparin.tutor.validation;

import lombok.experimental.UtilityClass;
import ru.oparin.tutor.exception.ProfileValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Проверка и нормализация интересов профиля.
 */
@UtilityClass
public class ProfileAttributesValidator {

    public static final int MAX_INTERESTS = 10;
    public static final int MAX_INTEREST_LENGTH = 50;

    /**
     * Обрезает пробелы, убирает повторы (сохраняя первое вхождение) и проверяет ограничения.
     *
     * @param interests интересы из запроса; null равносилен пустому списку
     * @return нормализованный список
     * @throws ProfileValidationException если есть пустой или слишком длинный интерес либо их больше 10
     */
    public static List<String> normalizeInterests(List<String> interests) {
        if (interests == null || interests.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String interest : interests) {
            if (interest == null || interest.isBlank()) {
                throw new ProfileValidationException("interests must not contain blank values");
            }
            String trimmed = interest.trim();
            if (trimmed.length() > MAX_INTEREST_LENGTH) {
                throw new ProfileValidationException("each interest must be at most " + MAX_INTEREST_LENGTH + " characters");
            }
            unique.add(trimmed);
        }
        if (unique.size() > MAX_INTERESTS) {
            throw new ProfileValidationException("at most " + MAX_INTERESTS + " interests are allowed");
        }
        return new ArrayList<>(unique);
    }
}
