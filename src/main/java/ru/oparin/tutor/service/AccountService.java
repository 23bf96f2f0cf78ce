package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.DuplicateEmailException;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.entity.Profile;
import ru.oparin.tutor.repository.AccountRepository;
import ru.oparin.tutor.repository.ProfileRepository;
import ru.oparin.tutor.util.JsonUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

import static ru.oparin.tutor.config.DatabaseConfig.withStorageGuard;

/**
 * Хранилище учетных записей. Аккаунт всегда создается вместе с профилем в одной транзакции.
 */
@Slf4j
@Service
public class AccountService {

    private final AccountRepository accountRepository;
    private final ProfileRepository profileRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    public AccountService(AccountRepository accountRepository,
                          ProfileRepository profileRepository,
                          AuthProperties authProperties,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.profileRepository = profileRepository;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * Email хранится без пробелов по краям и в нижнем регистре.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Создать аккаунт и профиль атомарно. Если профиль не сохранился, аккаунт тоже не сохраняется.
     *
     * @param email        нормализованный email
     * @param passwordHash bcrypt-хэш пароля
     * @param profile      начальные данные профиля
     * @return сохраненный аккаунт
     * @throws DuplicateEmailException если email уже занят
     */
    @Transactional
    public Mono<Account> createWithProfile(String email, String passwordHash, ProfileSnapshot profile) {
        Mono<Account> creation = Mono.defer(() -> accountRepository.save(Account.builder()
                        .email(email)
                        .passwordHash(passwordHash)
                        .active(true)
                        .build()))
                .flatMap(account -> profileRepository.save(Profile.builder()
                                .accountId(account.getId())
                                .softwareExperience(profile.getSoftwareExperience())
                                .hardwareExperience(profile.getHardwareExperience())
                                .interests(JsonUtils.convertListToJson(profile.getInterests()))
                                .updatedAt(LocalDateTime.now(clock))
                                .build())
                        .thenReturn(account));

        return withStorageGuard(creation, authProperties.getStorageTimeout())
                .onErrorMap(DataIntegrityViolationException.class, e -> {
                    log.warn("Попытка регистрации с занятым email: {}", email);
                    return new DuplicateEmailException();
                })
                .doOnSuccess(account -> log.info("Создан аккаунт {} с профилем", account.getId()));
    }

    public Mono<Boolean> existsByEmail(String email) {
        return withStorageGuard(accountRepository.existsByEmail(email), authProperties.getStorageTimeout());
    }

    public Mono<Account> findByEmail(String email) {
        return withStorageGuard(accountRepository.findByEmail(email), authProperties.getStorageTimeout());
    }

    public Mono<Account> findById(Long id) {
        return withStorageGuard(accountRepository.findById(id), authProperties.getStorageTimeout());
    }

    /**
     * Отметить успешный вход.
     */
    public Mono<Void> touchLastLogin(Long id) {
        return withStorageGuard(accountRepository.updateLastLoginAt(id, LocalDateTime.now(clock)), authProperties.getStorageTimeout())
                .then();
    }
}
