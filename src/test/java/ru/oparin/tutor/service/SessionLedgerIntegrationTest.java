package ru.oparin.tutor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.util.function.Tuple2;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.InvalidOrExpiredSessionException;
import ru.oparin.tutor.model.domain.ClientMetadata;
import ru.oparin.tutor.model.domain.IssuedTokens;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.entity.Session;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;
import ru.oparin.tutor.repository.AccountRepository;
import ru.oparin.tutor.repository.SessionRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SessionLedger against the in-memory database.
 *
 * Each test registers its own account, so tests stay independent even though
 * the database outlives a single Spring context.
 */
@SpringBootTest
class SessionLedgerIntegrationTest {

    private static final ClientMetadata CLIENT = ClientMetadata.of("JUnit", "10.1.1.1");

    @Autowired
    private SessionLedger sessionLedger;

    @Autowired
    private AccountService accountService;

    @Autowired
    private TokenService tokenService;

    @Autowired
    private SessionRepository sessionRepository;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private AuthProperties authProperties;

    @AfterEach
    void resetSessionLimit() {
        authProperties.getSession().setMaxPerAccount(0);
    }

    // ── Helper ────────────────────────────────────────────────────────────────

    private Account newAccount() {
        String email = "ledger-" + UUID.randomUUID() + "@test.local";
        ProfileSnapshot profile = ProfileSnapshot.builder()
                .softwareExperience(SoftwareExperience.BEGINNER)
                .hardwareExperience(HardwareExperience.NONE)
                .interests(List.of())
                .build();
        return accountService.createWithProfile(email, "not-a-real-hash", profile).block();
    }

    private long sessionCount(Long accountId) {
        Long count = sessionRepository.countByAccountId(accountId).block();
        return count == null ? 0 : count;
    }

    // ── create / rotate ───────────────────────────────────────────────────────

    @Test
    void createdSessionShouldStoreOnlyTokenHash() {
        Account account = newAccount();

        IssuedTokens tokens = sessionLedger.create(account.getId(), CLIENT).block();

        assertNotNull(tokens);
        assertEquals(account.getId(), tokenService.verify(tokens.getAccessToken()));
        Session stored = sessionRepository.findByTokenHash(SessionLedger.hash(tokens.getRefreshToken())).block();
        assertNotNull(stored);
        assertNotEquals(tokens.getRefreshToken(), stored.getTokenHash());
        assertEquals("JUnit", stored.getUserAgent());
        assertEquals("10.1.1.1", stored.getIpAddress());
        assertTrue(stored.getExpiresAt().isAfter(LocalDateTime.now()));
    }

    @Test
    void rotationShouldInvalidateOldCredential() {
        Account account = newAccount();
        IssuedTokens first = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(first);

        IssuedTokens second = sessionLedger.rotate(first.getRefreshToken(), ClientMetadata.empty()).block();

        assertNotNull(second);
        assertNotEquals(first.getRefreshToken(), second.getRefreshToken());
        assertEquals(account.getId(), second.getAccountId());
        assertEquals(1, sessionCount(account.getId()));

        StepVerifier.create(sessionLedger.rotate(first.getRefreshToken(), CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();

        Session rotated = sessionRepository.findByTokenHash(SessionLedger.hash(second.getRefreshToken())).block();
        assertNotNull(rotated);
        assertEquals("JUnit", rotated.getUserAgent());
    }

    @Test
    void concurrentRotationShouldHaveExactlyOneWinner() {
        Account account = newAccount();
        IssuedTokens tokens = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(tokens);

        Mono<Signal<IssuedTokens>> first = sessionLedger.rotate(tokens.getRefreshToken(), CLIENT)
                .subscribeOn(Schedulers.parallel())
                .materialize();
        Mono<Signal<IssuedTokens>> second = sessionLedger.rotate(tokens.getRefreshToken(), CLIENT)
                .subscribeOn(Schedulers.parallel())
                .materialize();

        Tuple2<Signal<IssuedTokens>, Signal<IssuedTokens>> outcomes = Mono.zip(first, second).block();

        assertNotNull(outcomes);
        long winners = List.of(outcomes.getT1(), outcomes.getT2()).stream().filter(Signal::isOnNext).count();
        assertEquals(1, winners);
        Signal<IssuedTokens> loser = outcomes.getT1().isOnError() ? outcomes.getT1() : outcomes.getT2();
        assertTrue(loser.isOnError());
        assertEquals(1, sessionCount(account.getId()));
    }

    @Test
    void expiredSessionShouldBeRejectedAndRemoved() {
        Account account = newAccount();
        IssuedTokens tokens = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(tokens);
        String tokenHash = SessionLedger.hash(tokens.getRefreshToken());
        Session stored = sessionRepository.findByTokenHash(tokenHash).block();
        assertNotNull(stored);
        stored.setExpiresAt(LocalDateTime.now().minusMinutes(1));
        sessionRepository.save(stored).block();

        StepVerifier.create(sessionLedger.rotate(tokens.getRefreshToken(), CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();

        assertNull(sessionRepository.findByTokenHash(tokenHash).block());
    }

    @Test
    void disabledAccountShouldNotRotate() {
        Account account = newAccount();
        IssuedTokens tokens = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(tokens);
        account.setActive(false);
        accountRepository.save(account).block();

        StepVerifier.create(sessionLedger.rotate(tokens.getRefreshToken(), CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();

        assertEquals(0, sessionCount(account.getId()));
    }

    @Test
    void unknownOrBlankCredentialShouldBeRejected() {
        StepVerifier.create(sessionLedger.rotate("never-issued", CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();
        StepVerifier.create(sessionLedger.rotate(" ", CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();
    }

    // ── revoke ────────────────────────────────────────────────────────────────

    @Test
    void ownerLookupShouldResolveOnlyKnownCredentials() {
        Account account = newAccount();
        IssuedTokens tokens = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(tokens);

        StepVerifier.create(sessionLedger.findOwner(tokens.getRefreshToken()))
                .expectNext(account.getId())
                .verifyComplete();
        StepVerifier.create(sessionLedger.findOwner("never-issued"))
                .verifyComplete();
        StepVerifier.create(sessionLedger.findOwner(" "))
                .verifyComplete();
    }

    @Test
    void revokeShouldBeIdempotentAndTouchOnlyOwnerSessions() {
        Account owner = newAccount();
        Account stranger = newAccount();
        IssuedTokens ownerTokens = sessionLedger.create(owner.getId(), CLIENT).block();
        assertNotNull(ownerTokens);

        // Чужой аккаунт не может завершить сессию владельца
        sessionLedger.revoke(stranger.getId(), ownerTokens.getRefreshToken()).block();
        assertEquals(1, sessionCount(owner.getId()));

        sessionLedger.revoke(owner.getId(), ownerTokens.getRefreshToken()).block();
        assertEquals(0, sessionCount(owner.getId()));

        StepVerifier.create(sessionLedger.revoke(owner.getId(), ownerTokens.getRefreshToken()))
                .verifyComplete();
        StepVerifier.create(sessionLedger.rotate(ownerTokens.getRefreshToken(), CLIENT))
                .expectError(InvalidOrExpiredSessionException.class)
                .verify();
    }

    @Test
    void revokeWithoutCredentialShouldEndAllSessions() {
        Account account = newAccount();
        sessionLedger.create(account.getId(), CLIENT).block();
        sessionLedger.create(account.getId(), CLIENT).block();
        assertEquals(2, sessionCount(account.getId()));

        sessionLedger.revoke(account.getId(), null).block();

        assertEquals(0, sessionCount(account.getId()));
    }

    // ── limits and cleanup ────────────────────────────────────────────────────

    @Test
    void sessionLimitShouldDropOldestSessions() {
        authProperties.getSession().setMaxPerAccount(2);
        Account account = newAccount();

        IssuedTokens oldest = sessionLedger.create(account.getId(), CLIENT).block();
        sessionLedger.create(account.getId(), CLIENT).block();
        IssuedTokens newest = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(oldest);
        assertNotNull(newest);

        assertEquals(2, sessionCount(account.getId()));
        assertNull(sessionRepository.findByTokenHash(SessionLedger.hash(oldest.getRefreshToken())).block());
        assertNotNull(sessionRepository.findByTokenHash(SessionLedger.hash(newest.getRefreshToken())).block());
    }

    @Test
    void purgeShouldRemoveOnlyExpiredSessions() {
        Account account = newAccount();
        IssuedTokens live = sessionLedger.create(account.getId(), CLIENT).block();
        IssuedTokens stale = sessionLedger.create(account.getId(), CLIENT).block();
        assertNotNull(live);
        assertNotNull(stale);
        Session staleSession = sessionRepository.findByTokenHash(SessionLedger.hash(stale.getRefreshToken())).block();
        assertNotNull(staleSession);
        staleSession.setExpiresAt(LocalDateTime.now().minusDays(1));
        sessionRepository.save(staleSession).block();

        Long purged = sessionLedger.purgeExpired(LocalDateTime.now()).block();

        assertNotNull(purged);
        assertTrue(purged >= 1);
        assertEquals(1, sessionCount(account.getId()));
        assertNotNull(sessionRepository.findByTokenHash(SessionLedger.hash(live.getRefreshToken())).block());
    }
}
