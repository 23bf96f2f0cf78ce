package ru.oparin.tutor.service;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.InvalidTokenException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenService.
 *
 * The clock is fixed so expiry can be checked without sleeping.
 */
class TokenServiceTest {

    private static final String SECRET = "unit-test-secret-key-that-is-long-enough";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private AuthProperties authProperties;
    private TokenService tokenService;

    @BeforeEach
    void setup() {
        authProperties = new AuthProperties();
        authProperties.getJwt().setSecret(SECRET);
        authProperties.getJwt().setAccessTokenTtl(Duration.ofMinutes(15));
        tokenService = new TokenService(authProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ── Helper ────────────────────────────────────────────────────────────────

    private String signedToken(String subject, Object type) {
        return Jwts.builder()
                .subject(subject)
                .issuer(authProperties.getJwt().getIssuer())
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plus(Duration.ofMinutes(15))))
                .claim(TokenService.TYPE_CLAIM, type)
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();
    }

    private TokenService serviceAt(Instant instant) {
        return new TokenService(authProperties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void issuedTokenShouldVerifyToSameAccount() {
        String token = tokenService.issue(42L);

        assertEquals(42L, tokenService.verify(token));
        assertEquals(900, tokenService.getAccessTokenTtl().toSeconds());
    }

    @Test
    void tokenShouldStayValidUntilExpiry() {
        String token = tokenService.issue(7L);

        assertEquals(7L, serviceAt(NOW.plus(Duration.ofMinutes(14))).verify(token));
        assertThrows(InvalidTokenException.class,
                () -> serviceAt(NOW.plus(Duration.ofMinutes(16))).verify(token));
    }

    @Test
    void tokenOfAnotherTypeShouldBeRejected() {
        String refreshLike = signedToken("42", "refresh");
        String withoutType = signedToken("42", null);

        assertThrows(InvalidTokenException.class, () -> tokenService.verify(refreshLike));
        assertThrows(InvalidTokenException.class, () -> tokenService.verify(withoutType));
    }

    @Test
    void tamperedPayloadShouldBeRejected() {
        String token = tokenService.issue(42L);
        String[] parts = token.split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
                .replace("\"sub\":\"42\"", "\"sub\":\"43\"");
        String forged = parts[0] + "."
                + Base64.getUrlEncoder().withoutPadding().encodeToString(payload.getBytes(StandardCharsets.UTF_8))
                + "." + parts[2];

        assertThrows(InvalidTokenException.class, () -> tokenService.verify(forged));
    }

    @Test
    void tokenSignedWithAnotherKeyShouldBeRejected() {
        AuthProperties other = new AuthProperties();
        other.getJwt().setSecret("another-secret-key-that-is-also-long-enough");
        String foreign = new TokenService(other, Clock.fixed(NOW, ZoneOffset.UTC)).issue(42L);

        assertThrows(InvalidTokenException.class, () -> tokenService.verify(foreign));
    }

    @Test
    void nonNumericSubjectShouldBeRejected() {
        String token = signedToken("not-a-number", TokenService.ACCESS_TYPE);

        assertThrows(InvalidTokenException.class, () -> tokenService.verify(token));
    }

    @Test
    void garbageAndBlankTokensShouldBeRejectedWithSameMessage() {
        InvalidTokenException garbage = assertThrows(InvalidTokenException.class, () -> tokenService.verify("abc.def.ghi"));
        InvalidTokenException blank = assertThrows(InvalidTokenException.class, () -> tokenService.verify("  "));
        InvalidTokenException nullToken = assertThrows(InvalidTokenException.class, () -> tokenService.verify(null));

        assertEquals(InvalidTokenException.MESSAGE, garbage.getMessage());
        assertEquals(garbage.getMessage(), blank.getMessage());
        assertEquals(garbage.getMessage(), nullToken.getMessage());
    }

    @Test
    void shortSecretShouldFailAtStartup() {
        AuthProperties weak = new AuthProperties();
        weak.getJwt().setSecret("too-short");

        assertThrows(IllegalStateException.class, () -> new TokenService(weak, Clock.systemUTC()));
    }
}
