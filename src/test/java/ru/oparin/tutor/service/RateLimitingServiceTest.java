package ru.oparin.tutor.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.RateLimitExceededException;
import ru.oparin.tutor.service.RateLimitingService.Action;

import static org.junit.jupiter.api.Assertions.assertFalse;

class RateLimitingServiceTest {

    private AuthProperties authProperties;

    @BeforeEach
    void setup() {
        authProperties = new AuthProperties();
        authProperties.getRateLimit().setSigninAttempts(2);
        authProperties.getRateLimit().setRefreshAttempts(3);
    }

    @Test
    void attemptsBeyondLimitShouldBeRejectedPerIp() {
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", "a@b.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", "c@d.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", "e@f.com"))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void attemptsBeyondLimitShouldBeRejectedPerAccount() {
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", "a@b.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.2", "a@b.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.3", "a@b.com"))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void actionsShouldBeCountedSeparately() {
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", null)).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", null)).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.REFRESH, "10.0.0.1", null)).verifyComplete();
    }

    @Test
    void loopbackShouldBeExemptFromIpCounterWhenConfigured() {
        authProperties.getRateLimit().setExemptLoopback(true);
        RateLimitingService service = new RateLimitingService(authProperties);

        for (int i = 0; i < 5; i++) {
            StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", null)).verifyComplete();
        }
    }

    @Test
    void loopbackExemptionShouldStillCountAccountAttempts() {
        authProperties.getRateLimit().setExemptLoopback(true);
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", "victim@b.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", "victim@b.com")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", "victim@b.com"))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void loopbackShouldNotBeExemptByDefault() {
        assertFalse(new AuthProperties().getRateLimit().isExemptLoopback());
    }

    @Test
    void refreshShouldBeLimitedPerAccountAcrossAddresses() {
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.REFRESH, null, "id:7")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.REFRESH, null, "id:7")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.REFRESH, null, "id:7")).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.REFRESH, null, "id:7"))
                .expectError(RateLimitExceededException.class)
                .verify();
        StepVerifier.create(service.checkAndRecord(Action.REFRESH, null, "id:8")).verifyComplete();
    }

    @Test
    void loopbackShouldBeCountedWhenExemptionDisabled() {
        authProperties.getRateLimit().setExemptLoopback(false);
        RateLimitingService service = new RateLimitingService(authProperties);

        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", null)).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", null)).verifyComplete();
        StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "127.0.0.1", null))
                .expectError(RateLimitExceededException.class)
                .verify();
    }

    @Test
    void disabledLimiterShouldAllowEverything() {
        authProperties.getRateLimit().setEnabled(false);
        RateLimitingService service = new RateLimitingService(authProperties);

        for (int i = 0; i < 5; i++) {
            StepVerifier.create(service.checkAndRecord(Action.SIGNIN, "10.0.0.1", "a@b.com")).verifyComplete();
        }
    }
}
