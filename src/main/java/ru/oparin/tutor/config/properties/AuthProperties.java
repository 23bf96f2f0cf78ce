package ru.oparin.tutor.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Настройки аутентификации: подпись access-токенов, время жизни сессий и ограничения частоты запросов.
 * Передаются в конструкторы TokenService и SessionLedger, чтобы в тестах можно было подставить короткие TTL.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    private Jwt jwt = new Jwt();

    private SessionSettings session = new SessionSettings();

    private RateLimit rateLimit = new RateLimit();

    /**
     * Максимальное время ожидания одной операции с хранилищем аккаунтов, профилей и сессий.
     */
    private Duration storageTimeout = Duration.ofSeconds(3);

    /**
     * Стоимость BCrypt для хэширования паролей.
     */
    private int passwordHashStrength = 12;

    /**
     * Адреса обратных прокси, которым разрешено передавать адрес клиента
     * в X-Forwarded-For и X-Real-IP. От остальных источников эти заголовки игнорируются.
     */
    private List<String> trustedProxies = new ArrayList<>();

    @Getter
    @Setter
    public static class Jwt {
        /** Секрет HS256, не короче 32 байт */
        private String secret;
        private Duration accessTokenTtl = Duration.ofMinutes(15);
        private String issuer = "tutor-back";
    }

    @Getter
    @Setter
    public static class SessionSettings {
        private Duration ttl = Duration.ofDays(7);

        /**
         * Лимит одновременных сессий на аккаунт. 0 - без ограничений.
         * При превышении удаляются самые старые сессии.
         */
        private int maxPerAccount = 0;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        /** Не считать попытки по IP для loopback-адресов. Счетчик по аккаунту ведется всегда */
        private boolean exemptLoopback = false;
        private Duration window = Duration.ofMinutes(1);
        private int signupAttempts = 5;
        private int signinAttempts = 5;
        private int refreshAttempts = 10;
    }
}
