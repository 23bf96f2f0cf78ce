package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.exception.DuplicateEmailException;
import ru.oparin.tutor.exception.InvalidCredentialsException;
import ru.oparin.tutor.exception.WeakPasswordException;
import ru.oparin.tutor.model.domain.ClientMetadata;
import ru.oparin.tutor.model.domain.IssuedTokens;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.dto.auth.AuthResponse;
import ru.oparin.tutor.model.dto.auth.MessageResponse;
import ru.oparin.tutor.model.dto.auth.SigninRequest;
import ru.oparin.tutor.model.dto.auth.SignupRequest;
import ru.oparin.tutor.model.dto.auth.TokenResponse;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;
import ru.oparin.tutor.validation.ProfileAttributesValidator;
import ru.oparin.tutor.validation.StrongPasswordValidator;

import java.util.Optional;

/**
 * Регистрация, вход, выход и обновление сессии.
 * <p>
 * Клиент получает только обобщенные ошибки: "нет такого email", "неверный пароль"
 * и "аккаунт отключен" неразличимы снаружи и различаются лишь в логах.
 */
@Slf4j
@Service
public class AuthService {

    private final AccountService accountService;
    private final SessionLedger sessionLedger;
    private final PasswordEncoder passwordEncoder;
    private final RateLimitingService rateLimitingService;

    /**
     * Хэш для сравнения при неизвестном email, чтобы время ответа не выдавало наличие аккаунта.
     */
    private final String dummyPasswordHash;

    public AuthService(AccountService accountService,
                       SessionLedger sessionLedger,
                       PasswordEncoder passwordEncoder,
                       RateLimitingService rateLimitingService) {
        this.accountService = accountService;
        this.sessionLedger = sessionLedger;
        this.passwordEncoder = passwordEncoder;
        this.rateLimitingService = rateLimitingService;
        this.dummyPasswordHash = passwordEncoder.encode("timing-equalizer-password");
    }

    public Mono<AuthResponse> signup(SignupRequest request, ClientMetadata client) {
        String email = AccountService.normalizeEmail(request.getEmail());

        return rateLimitingService.checkAndRecord(RateLimitingService.Action.SIGNUP, client.getIpAddress(), email)
                .then(Mono.fromCallable(() -> validateSignup(request)))
                .flatMap(profile -> accountService.existsByEmail(email)
                        .flatMap(exists -> {
                            if (exists) {
                                log.warn("Регистрация отклонена: email {} уже занят", email);
                                return Mono.error(new DuplicateEmailException());
                            }
                            String passwordHash = passwordEncoder.encode(request.getPassword());
                            return accountService.createWithProfile(email, passwordHash, profile);
                        }))
                .flatMap(account -> sessionLedger.create(account.getId(), client)
                        .map(tokens -> toAuthResponse(account, tokens)))
                .doOnSuccess(response -> log.info("Пользователь {} зарегистрирован", response.getAccountId()));
    }

    public Mono<AuthResponse> signin(SigninRequest request, ClientMetadata client) {
        String email = AccountService.normalizeEmail(request.getEmail());

        return rateLimitingService.checkAndRecord(RateLimitingService.Action.SIGNIN, client.getIpAddress(), email)
                .then(accountService.findByEmail(email))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        passwordEncoder.matches(request.getPassword(), dummyPasswordHash);
                        log.warn("Вход отклонен: аккаунт с email {} не найден", email);
                        return Mono.error(new InvalidCredentialsException());
                    }
                    Account account = found.get();
                    if (!passwordEncoder.matches(request.getPassword(), account.getPasswordHash())) {
                        log.warn("Вход отклонен: неверный пароль для аккаунта {}", account.getId());
                        return Mono.error(new InvalidCredentialsException());
                    }
                    if (!Boolean.TRUE.equals(account.getActive())) {
                        log.warn("Вход отклонен: аккаунт {} отключен", account.getId());
                        return Mono.error(new InvalidCredentialsException());
                    }
                    return accountService.touchLastLogin(account.getId())
                            .then(sessionLedger.create(account.getId(), client))
                            .map(tokens -> toAuthResponse(account, tokens));
                })
                .doOnSuccess(response -> log.info("Пользователь {} вошел в систему", response.getAccountId()));
    }

    /**
     * Выход. Без refresh-токена завершаются все сессии аккаунта.
     */
    public Mono<MessageResponse> signout(Long accountId, String refreshToken) {
        return sessionLedger.revoke(accountId, refreshToken)
                .thenReturn(new MessageResponse("Successfully signed out"));
    }

    /**
     * Обновление сессии. Лимит считается по IP и по аккаунту-владельцу токена.
     */
    public Mono<TokenResponse> refresh(String refreshToken, ClientMetadata client) {
        return rateLimitingService.checkAndRecord(RateLimitingService.Action.REFRESH, client.getIpAddress(), null)
                .then(Mono.defer(() -> sessionLedger.findOwner(refreshToken)))
                .flatMap(accountId -> rateLimitingService.checkAndRecord(
                        RateLimitingService.Action.REFRESH, null, accountKey(accountId)))
                .then(Mono.defer(() -> sessionLedger.rotate(refreshToken, client)))
                .map(TokenResponse::fromIssued);
    }

    static String accountKey(Long accountId) {
        return "id:" + accountId;
    }

    /**
     * Проверки, не требующие хранилища: политика пароля и данные профиля.
     */
    private ProfileSnapshot validateSignup(SignupRequest request) {
        StrongPasswordValidator.findViolation(request.getPassword())
                .ifPresent(violation -> {
                    throw new WeakPasswordException(violation);
                });

        return ProfileSnapshot.builder()
                .softwareExperience(SoftwareExperience.parse(request.getSoftwareExperience()))
                .hardwareExperience(HardwareExperience.parse(request.getHardwareExperience()))
                .interests(ProfileAttributesValidator.normalizeInterests(request.getInterests()))
                .build();
    }

    private AuthResponse toAuthResponse(Account account, IssuedTokens tokens) {
        return new AuthResponse(account.getId(), account.getEmail(), TokenResponse.fromIssued(tokens));
    }
}
