package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.DatabaseConfig;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.InvalidOrExpiredSessionException;
import ru.oparin.tutor.model.domain.ClientMetadata;
import ru.oparin.tutor.model.domain.IssuedTokens;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.entity.Session;
import ru.oparin.tutor.repository.AccountRepository;
import ru.oparin.tutor.repository.SessionRepository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Учет сессий (refresh-токенов): создание, ротация и отзыв.
 * <p>
 * Refresh-токен одноразовый. При обновлении старая запись удаляется условным DELETE,
 * и только если удалена ровно одна строка, в той же транзакции вставляется новая.
 * Из двух параллельных обновлений одного токена успешно только одно.
 */
@Slf4j
@Service
public class SessionLedger {

    private static final int CREDENTIAL_BYTES = 32;

    private final SessionRepository sessionRepository;
    private final AccountRepository accountRepository;
    private final TokenService tokenService;
    private final AuthProperties authProperties;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public SessionLedger(SessionRepository sessionRepository,
                         AccountRepository accountRepository,
                         TokenService tokenService,
                         AuthProperties authProperties,
                         TransactionalOperator transactionalOperator,
                         Clock clock) {
        this.sessionRepository = sessionRepository;
        this.accountRepository = accountRepository;
        this.tokenService = tokenService;
        this.authProperties = authProperties;
        this.transactionalOperator = transactionalOperator;
        this.clock = clock;
    }

    /**
     * Создать новую сессию для аккаунта и выдать пару токенов.
     *
     * @param accountId ID аккаунта
     * @param client    User-Agent и IP клиента
     * @return access-токен и новый refresh-токен
     */
    public Mono<IssuedTokens> create(Long accountId, ClientMetadata client) {
        String credential = generateCredential();
        Mono<IssuedTokens> pipeline = Mono.defer(() -> sessionRepository.save(newSession(accountId, credential, client)))
                .flatMap(saved -> enforceSessionLimit(accountId).thenReturn(saved))
                .map(saved -> issueTokens(accountId, credential));

        return guard(transactionalOperator.transactional(pipeline))
                .doOnSuccess(tokens -> log.info("Создана сессия для аккаунта {}", accountId));
    }

    /**
     * Обменять refresh-токен на новую пару токенов.
     * Старый токен после успешного обмена больше не принимается.
     *
     * @throws InvalidOrExpiredSessionException если токен неизвестен, истек, уже использован
     *                                          или аккаунт владельца отключен
     */
    public Mono<IssuedTokens> rotate(String credential, ClientMetadata client) {
        if (credential == null || credential.isBlank()) {
            return Mono.error(new InvalidOrExpiredSessionException());
        }
        String tokenHash = hash(credential);

        Mono<RotationOutcome> pipeline = Mono.defer(() -> sessionRepository.findByTokenHash(tokenHash))
                .flatMap(session -> rotateSession(session, client))
                .defaultIfEmpty(RotationOutcome.rejected("сессия не найдена"));

        return guard(transactionalOperator.transactional(pipeline))
                .onErrorMap(ConcurrencyFailureException.class, e -> {
                    log.warn("Конфликт параллельного обновления сессии: {}", e.getMessage());
                    return new InvalidOrExpiredSessionException();
                })
                .flatMap(outcome -> {
                    if (outcome.tokens() == null) {
                        log.warn("Обновление сессии отклонено: {}", outcome.reason());
                        return Mono.error(new InvalidOrExpiredSessionException());
                    }
                    log.info("Сессия аккаунта {} обновлена", outcome.tokens().getAccountId());
                    return Mono.just(outcome.tokens());
                });
    }

    /**
     * Владелец сессии по refresh-токену. Пустой результат, если токен неизвестен.
     * Срок действия не проверяется: это делает rotate.
     */
    public Mono<Long> findOwner(String credential) {
        if (credential == null || credential.isBlank()) {
            return Mono.empty();
        }
        return guard(Mono.defer(() -> sessionRepository.findByTokenHash(hash(credential))))
                .map(Session::getAccountId);
    }

    /**
     * Завершить сессию. Удаляется только сессия, принадлежащая этому аккаунту.
     * Без credential удаляются все сессии аккаунта. Повторный вызов не является ошибкой.
     */
    public Mono<Void> revoke(Long accountId, String credential) {
        Mono<Integer> deletion = credential == null || credential.isBlank()
                ? Mono.defer(() -> sessionRepository.deleteAllByAccountId(accountId))
                : Mono.defer(() -> sessionRepository.deleteByAccountIdAndTokenHash(accountId, hash(credential)));

        return guard(deletion)
                .doOnNext(deleted -> log.info("Для аккаунта {} завершено сессий: {}", accountId, deleted))
                .then();
    }

    /**
     * Удалить все истекшие сессии.
     *
     * @return количество удаленных записей
     */
    public Mono<Long> purgeExpired(LocalDateTime now) {
        return guard(Mono.defer(() -> sessionRepository.deleteExpired(now)))
                .map(Integer::longValue);
    }

    private Mono<RotationOutcome> rotateSession(Session session, ClientMetadata client) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!session.getExpiresAt().isAfter(now)) {
            return sessionRepository.deleteByIdAndTokenHash(session.getId(), session.getTokenHash())
                    .thenReturn(RotationOutcome.rejected("срок действия сессии " + session.getId() + " истек"));
        }

        return accountRepository.findById(session.getAccountId())
                .filter(account -> Boolean.TRUE.equals(account.getActive()))
                .flatMap(account -> replaceSession(session, account, client))
                .switchIfEmpty(Mono.defer(() ->
                        sessionRepository.deleteByIdAndTokenHash(session.getId(), session.getTokenHash())
                                .thenReturn(RotationOutcome.rejected("аккаунт " + session.getAccountId() + " отключен или удален"))));
    }

    private Mono<RotationOutcome> replaceSession(Session session, Account account, ClientMetadata client) {
        return sessionRepository.deleteByIdAndTokenHash(session.getId(), session.getTokenHash())
                .flatMap(deleted -> {
                    if (deleted == 0) {
                        return Mono.just(RotationOutcome.rejected("сессия " + session.getId() + " уже обновлена другим запросом"));
                    }
                    ClientMetadata effective = ClientMetadata.of(
                            client.getUserAgent() != null ? client.getUserAgent() : session.getUserAgent(),
                            client.getIpAddress() != null ? client.getIpAddress() : session.getIpAddress());
                    String credential = generateCredential();
                    return sessionRepository.save(newSession(account.getId(), credential, effective))
                            .map(saved -> RotationOutcome.rotated(issueTokens(account.getId(), credential)));
                });
    }

    private Mono<Void> enforceSessionLimit(Long accountId) {
        int limit = authProperties.getSession().getMaxPerAccount();
        if (limit <= 0) {
            return Mono.empty();
        }
        return sessionRepository.deleteOldestBeyond(accountId, limit)
                .doOnNext(deleted -> {
                    if (deleted > 0) {
                        log.info("Превышен лимит сессий аккаунта {}: удалено старых сессий {}", accountId, deleted);
                    }
                })
                .then();
    }

    private Session newSession(Long accountId, String credential, ClientMetadata client) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Session.builder()
                .accountId(accountId)
                .tokenHash(hash(credential))
                .expiresAt(now.plus(authProperties.getSession().getTtl()))
                .userAgent(client.getUserAgent())
                .ipAddress(client.getIpAddress())
                .createdAt(now)
                .build();
    }

    private IssuedTokens issueTokens(Long accountId, String credential) {
        return IssuedTokens.builder()
                .accountId(accountId)
                .accessToken(tokenService.issue(accountId))
                .refreshToken(credential)
                .expiresIn(tokenService.getAccessTokenTtl().toSeconds())
                .build();
    }

    private <T> Mono<T> guard(Mono<T> mono) {
        return DatabaseConfig.withStorageGuard(mono, authProperties.getStorageTimeout());
    }

    private String generateCredential() {
        byte[] bytes = new byte[CREDENTIAL_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * SHA-256 (hex) от refresh-токена. В хранилище попадает только хэш.
     */
    public static String hash(String credential) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(credential.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }

    private record RotationOutcome(IssuedTokens tokens, String reason) {

        static RotationOutcome rotated(IssuedTokens tokens) {
            return new RotationOutcome(tokens, null);
        }

        static RotationOutcome rejected(String reason) {
            return new RotationOutcome(null, reason);
        }
    }
}
