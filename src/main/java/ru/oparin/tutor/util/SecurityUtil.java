package ru.oparin.tutor.util;

import lombok.experimental.UtilityClass;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.exception.InvalidTokenException;

/**
 * Утилитный класс для работы с Spring Security.
 * Предоставляет методы для получения информации о текущем пользователе.
 */
@UtilityClass
public class SecurityUtil {

    /**
     * Получить ID текущего аккаунта из контекста безопасности.
     * Principal выставляется фильтром JwtAuthenticationFilter после проверки access-токена.
     *
     * @return Mono с ID аккаунта или ошибка InvalidTokenException, если аутентификации нет
     */
    public static Mono<Long> getCurrentAccountId() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(Authentication::getPrincipal)
                .filter(Long.class::isInstance)
                .map(Long.class::cast)
                .switchIfEmpty(Mono.error(new InvalidTokenException()));
    }
}
