package ru.oparin.tutor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Утилитный класс для работы с JSON-колонками (интересы профиля, снимок персонализации).
 */
@UtilityClass
@Slf4j
public class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    /**
     * Преобразовать список строк в JSON строку.
     *
     * @return JSON строка вида ["item1", "item2"]; для null или пустого списка "[]"
     */
    public static String convertListToJson(List<String> list) {
        if (list == null || list.isEmpty()) {
            return "[]";
        }
        return toJson(list);
    }

    /**
     * Преобразовать JSON строку в список строк.
     *
     * @return список строк или пустой список, если JSON пустой или некорректный
     */
    public static List<String> parseJsonToList(String json) {
        if (json == null || json.isBlank() || "null".equals(json)) {
            return List.of();
        }
        try {
            List<String> parsed = MAPPER.readValue(json, STRING_LIST);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Некорректный JSON массив строк в хранилище: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    /**
     * Сериализовать объект в JSON строку.
     *
     * @throws IllegalStateException если объект не сериализуется
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать значение в JSON", e);
        }
    }
}
