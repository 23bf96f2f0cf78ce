package ru.oparin.tutor.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.exception.InvalidTokenException;
import ru.oparin.tutor.service.TokenService;
import ru.oparin.tutor.util.JwtUtil;

import java.util.List;
import java.util.Optional;

/**
 * Аутентификация по access-токену из заголовка Authorization.
 * Principal - ID аккаунта (Long). Невалидный токен не прерывает цепочку:
 * решение о 401 принимают правила доступа или сам обработчик.
 */
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    private final TokenService tokenService;

    public JwtAuthenticationFilter(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        Optional<String> token = JwtUtil.extractToken(exchange);
        if (token.isEmpty() || token.get().isEmpty()) {
            return chain.filter(exchange);
        }

        Long accountId;
        try {
            accountId = tokenService.verify(token.get());
        } catch (InvalidTokenException e) {
            log.debug("Запрос {} с невалидным access-токеном", exchange.getRequest().getPath());
            return chain.filter(exchange);
        }

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(accountId, null, List.of());

        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(authentication);

        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withSecurityContext(Mono.just(securityContext)));
    }
}
