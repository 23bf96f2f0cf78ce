package ru.oparin.tutor.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.RateLimitExceededException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Сервис для ограничения частоты запросов (rate limiting) к регистрации, входу и обновлению сессии.
 * Счетчики ведутся отдельно по IP адресу и по аккаунту (email при входе, ID при обновлении сессии).
 */
@Slf4j
@Service
public class RateLimitingService {

    public enum Action {
        SIGNUP,
        SIGNIN,
        REFRESH
    }

    private final AuthProperties.RateLimit settings;

    // Ключ: действие + IP или действие + email, значение: количество попыток в текущем окне
    private final Cache<String, AtomicInteger> attempts;

    public RateLimitingService(AuthProperties authProperties) {
        this.settings = authProperties.getRateLimit();
        this.attempts = Caffeine.newBuilder()
                .expireAfterWrite(settings.getWindow())
                .maximumSize(100_000)
                .build();
    }

    /**
     * Учитывает попытку и проверяет лимит.
     * Исключение для loopback-адресов касается только счетчика по IP:
     * попытки по одному аккаунту считаются всегда, с какого бы адреса они ни пришли.
     *
     * @param action     защищаемое действие
     * @param ipAddress  IP адрес клиента, может быть null
     * @param accountKey нормализованный email или ID аккаунта, может быть null
     * @return пустой Mono, если попытка разрешена, иначе ошибка RateLimitExceededException
     */
    public Mono<Void> checkAndRecord(Action action, String ipAddress, String accountKey) {
        return Mono.fromRunnable(() -> {
            if (!settings.isEnabled()) {
                return;
            }

            int limit = limitFor(action);
            if (ipAddress != null) {
                if (settings.isExemptLoopback() && isLocalhost(ipAddress)) {
                    log.debug("Пропуск счетчика по IP для localhost: {}", ipAddress);
                } else {
                    increment(action + ":ip:" + ipAddress, limit, action, "IP " + ipAddress);
                }
            }
            if (accountKey != null) {
                increment(action + ":account:" + accountKey, limit, action, "аккаунта " + accountKey);
            }
        });
    }

    private void increment(String key, int limit, Action action, String subject) {
        int count = attempts.get(key, k -> new AtomicInteger(0)).incrementAndGet();
        if (count > limit) {
            log.warn("Превышен лимит попыток {} для {}: {}/{}", action, subject, count, limit);
            throw new RateLimitExceededException();
        }
    }

    private int limitFor(Action action) {
        return switch (action) {
            case SIGNUP -> settings.getSignupAttempts();
            case SIGNIN -> settings.getSigninAttempts();
            case REFRESH -> settings.getRefreshAttempts();
        };
    }

    /**
     * Проверяет, является ли IP адрес localhost (для пропуска rate limiting при локальной разработке).
     */
    private boolean isLocalhost(String ipAddress) {
        return "127.0.0.1".equals(ipAddress)
                || "0:0:0:0:0:0:0:1".equals(ipAddress)
                || "::1".equals(ipAddress)
                || "localhost".equalsIgnoreCase(ipAddress);
    }
}
