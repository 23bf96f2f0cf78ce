package ru.oparin.tutor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.dto.profile.ProfileResponse;
import ru.oparin.tutor.model.dto.profile.ProfileUpdateRequest;
import ru.oparin.tutor.service.ProfileService;
import ru.oparin.tutor.util.SecurityUtil;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/profile")
@SecurityRequirement(name = "bearerAuth")
@Tag(name = "Профиль", description = "API для просмотра и изменения профиля пользователя")
public class ProfileController {

    private final ProfileService profileService;

    @Operation(summary = "Получение профиля",
            description = "Возвращает уровни опыта и интересы текущего пользователя")
    @GetMapping
    public Mono<ResponseEntity<ProfileResponse>> getProfile() {
        return SecurityUtil.getCurrentAccountId()
                .doOnNext(accountId -> log.info("Получен запрос профиля аккаунта {}", accountId))
                .flatMap(profileService::getProfile)
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Изменение профиля",
            description = "Частичное обновление: меняются только переданные поля")
    @PutMapping
    public Mono<ResponseEntity<ProfileResponse>> updateProfile(@RequestBody ProfileUpdateRequest request) {
        return SecurityUtil.getCurrentAccountId()
                .doOnNext(accountId -> log.info("Получен запрос на изменение профиля аккаунта {}: {}", accountId, request))
                .flatMap(accountId -> profileService.updateProfile(accountId, request))
                .map(ResponseEntity::ok);
    }
}
