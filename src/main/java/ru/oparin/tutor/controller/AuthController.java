package ru.oparin.tutor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.model.dto.auth.*;
import ru.oparin.tutor.service.AuthService;
import ru.oparin.tutor.util.IpUtil;
import ru.oparin.tutor.util.SecurityUtil;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/auth")
@Tag(name = "Аутентификация", description = "API для регистрации, входа, выхода и обновления сессии")
public class AuthController {

    private final AuthService authService;
    private final AuthProperties authProperties;

    @Operation(summary = "Регистрация нового пользователя",
            description = "Создает аккаунт с профилем и возвращает access- и refresh-токены")
    @PostMapping("/signup")
    public Mono<ResponseEntity<AuthResponse>> signup(@Valid @RequestBody SignupRequest request, ServerWebExchange exchange) {
        log.info("Получен запрос на регистрацию нового пользователя: {}", request);
        return authService.signup(request, IpUtil.extractClientMetadata(exchange, authProperties.getTrustedProxies()))
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @Operation(summary = "Вход в систему",
            description = "Аутентификация по email и паролю, создает новую сессию")
    @PostMapping("/signin")
    public Mono<ResponseEntity<AuthResponse>> signin(@Valid @RequestBody SigninRequest request, ServerWebExchange exchange) {
        log.info("Получен запрос на вход пользователя: {}", request.getEmail());
        return authService.signin(request, IpUtil.extractClientMetadata(exchange, authProperties.getTrustedProxies()))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Выход из системы",
            description = "Завершает сессию по refresh-токену, без него завершает все сессии пользователя")
    @SecurityRequirement(name = "bearerAuth")
    @PostMapping("/signout")
    public Mono<ResponseEntity<MessageResponse>> signout(@RequestBody(required = false) SignoutRequest request) {
        String refreshToken = request != null ? request.getRefreshToken() : null;
        return SecurityUtil.getCurrentAccountId()
                .doOnNext(accountId -> log.info("Получен запрос на выход от аккаунта {}", accountId))
                .flatMap(accountId -> authService.signout(accountId, refreshToken))
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Обновление сессии",
            description = "Обменивает refresh-токен на новую пару токенов. Старый refresh-токен становится недействительным")
    @PostMapping("/refresh")
    public Mono<ResponseEntity<TokenResponse>> refresh(@Valid @RequestBody RefreshRequest request, ServerWebExchange exchange) {
        log.info("Получен запрос на обновление сессии");
        return authService.refresh(request.getRefreshToken(), IpUtil.extractClientMetadata(exchange, authProperties.getTrustedProxies()))
                .map(ResponseEntity::ok);
    }
}
