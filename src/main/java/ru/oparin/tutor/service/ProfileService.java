package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.exception.AuthException;
import ru.oparin.tutor.exception.ProfileNotFoundException;
import ru.oparin.tutor.mapper.ProfileMapper;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.dto.profile.ProfileResponse;
import ru.oparin.tutor.model.dto.profile.ProfileUpdateRequest;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.entity.Profile;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;
import ru.oparin.tutor.repository.ProfileRepository;
import ru.oparin.tutor.util.JsonUtils;
import ru.oparin.tutor.validation.ProfileAttributesValidator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import static ru.oparin.tutor.config.DatabaseConfig.withStorageGuard;

/**
 * Хранилище профилей: просмотр и частичное обновление, а также загрузка снимка для персонализации.
 */
@Slf4j
@Service
public class ProfileService {

    private final ProfileRepository profileRepository;
    private final AccountService accountService;
    private final ProfileMapper profileMapper;
    private final AuthProperties authProperties;
    private final Clock clock;

    public ProfileService(ProfileRepository profileRepository,
                          AccountService accountService,
                          ProfileMapper profileMapper,
                          AuthProperties authProperties,
                          Clock clock) {
        this.profileRepository = profileRepository;
        this.accountService = accountService;
        this.profileMapper = profileMapper;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * Профиль текущего пользователя вместе с email и временем последнего входа.
     */
    public Mono<ProfileResponse> getProfile(Long accountId) {
        return findActiveAccount(accountId)
                .flatMap(account -> findProfileEntity(accountId)
                        .map(profile -> profileMapper.toProfileResponse(account, profile)));
    }

    /**
     * Частичное обновление: меняются только переданные поля, updated_at обновляется всегда.
     * Все значения проверяются до обращения к хранилищу.
     */
    @Transactional
    public Mono<ProfileResponse> updateProfile(Long accountId, ProfileUpdateRequest request) {
        SoftwareExperience software;
        HardwareExperience hardware;
        List<String> interests;
        try {
            software = request.getSoftwareExperience() != null ? SoftwareExperience.parse(request.getSoftwareExperience()) : null;
            hardware = request.getHardwareExperience() != null ? HardwareExperience.parse(request.getHardwareExperience()) : null;
            interests = request.getInterests() != null ? ProfileAttributesValidator.normalizeInterests(request.getInterests()) : null;
        } catch (RuntimeException e) {
            return Mono.error(e);
        }

        return findActiveAccount(accountId)
                .flatMap(account -> findProfileEntity(accountId)
                        .flatMap(profile -> {
                            if (software != null) {
                                profile.setSoftwareExperience(software);
                            }
                            if (hardware != null) {
                                profile.setHardwareExperience(hardware);
                            }
                            if (interests != null) {
                                profile.setInterests(JsonUtils.convertListToJson(interests));
                            }
                            profile.setUpdatedAt(LocalDateTime.now(clock));
                            return withStorageGuard(profileRepository.save(profile), authProperties.getStorageTimeout());
                        })
                        .doOnNext(saved -> log.info("Профиль аккаунта {} обновлен", accountId))
                        .map(saved -> profileMapper.toProfileResponse(account, saved)));
    }

    /**
     * Снимок профиля для построения инструкции. Пустой результат, если профиля нет.
     */
    public Mono<ProfileSnapshot> findProfile(Long accountId) {
        return withStorageGuard(profileRepository.findByAccountId(accountId), authProperties.getStorageTimeout())
                .map(profileMapper::toSnapshot);
    }

    private Mono<Account> findActiveAccount(Long accountId) {
        return accountService.findById(accountId)
                .switchIfEmpty(Mono.error(new ProfileNotFoundException("Profile not found")))
                .flatMap(account -> {
                    if (!Boolean.TRUE.equals(account.getActive())) {
                        log.warn("Обращение к профилю отключенного аккаунта {}", accountId);
                        return Mono.error(new AuthException(HttpStatus.FORBIDDEN, "Account is disabled"));
                    }
                    return Mono.just(account);
                });
    }

    private Mono<Profile> findProfileEntity(Long accountId) {
        return withStorageGuard(profileRepository.findByAccountId(accountId), authProperties.getStorageTimeout())
                .switchIfEmpty(Mono.error(new ProfileNotFoundException("Profile not found")));
    }
}
