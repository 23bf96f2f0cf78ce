package ru.oparin.tutor.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.InvalidTokenException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Выпуск и проверка access-токенов (JWT, HS256).
 * Проверка не обращается к хранилищу: достаточно подписи, срока действия и типа токена.
 */
@Slf4j
@Service
public class TokenService {

    public static final String TYPE_CLAIM = "type";
    public static final String ACCESS_TYPE = "access";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration accessTokenTtl;
    private final String issuer;
    private final Clock clock;

    public TokenService(AuthProperties authProperties, Clock clock) {
        AuthProperties.Jwt jwt = authProperties.getJwt();
        if (jwt.getSecret() == null || jwt.getSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.auth.jwt.secret должен быть не короче " + MIN_SECRET_BYTES + " байт");
        }
        this.key = Keys.hmacShaKeyFor(jwt.getSecret().getBytes(StandardCharsets.UTF_8));
        this.accessTokenTtl = jwt.getAccessTokenTtl();
        this.issuer = jwt.getIssuer();
        this.clock = clock;
    }

    /**
     * Выпустить access-токен для аккаунта.
     *
     * @param accountId ID аккаунта (subject токена)
     * @return подписанный JWT
     */
    public String issue(Long accountId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(String.valueOf(accountId))
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenTtl)))
                .id(UUID.randomUUID().toString())
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Проверить access-токен и вернуть ID аккаунта.
     * Неверный формат, подпись, истекший срок, чужой тип или нечисловой subject
     * приводят к одному и тому же InvalidTokenException.
     */
    public Long verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException();
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Access-токен отклонен: {}", e.getMessage());
            throw new InvalidTokenException();
        }

        Object type = claims.get(TYPE_CLAIM);
        if (!ACCESS_TYPE.equals(type)) {
            log.debug("Access-токен отклонен: неверный тип {}", type);
            throw new InvalidTokenException();
        }
        try {
            return Long.valueOf(claims.getSubject());
        } catch (NumberFormatException e) {
            log.debug("Access-токен отклонен: нечисловой subject");
            throw new InvalidTokenException();
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }
}
