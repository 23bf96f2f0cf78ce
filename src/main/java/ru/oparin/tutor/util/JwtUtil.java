package ru.oparin.tutor.util;

import lombok.experimental.UtilityClass;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Утилита для работы с JWT токенами в WebFlux.
 */
@UtilityClass
public class JwtUtil {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Извлекает JWT токен из заголовка Authorization.
     *
     * @param exchange ServerWebExchange для получения заголовков
     * @return токен или пустой Optional, если заголовка нет
     */
    public static Optional<String> extractToken(ServerWebExchange exchange) {
        return extractToken(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
    }

    /**
     * Извлекает токен из значения заголовка Authorization вида "Bearer &lt;token&gt;".
     * Пустое значение после префикса считается присутствующим, но пустым токеном.
     */
    public static Optional<String> extractToken(String authHeader) {
        if (authHeader != null && authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.of(authHeader.substring(BEARER_PREFIX.length()).trim());
        }
        return Optional.empty();
    }
}
