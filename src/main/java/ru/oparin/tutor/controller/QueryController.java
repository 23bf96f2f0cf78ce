package ru.oparin.tutor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.QueryProperties;
import ru.oparin.tutor.mapper.QueryMapper;
import ru.oparin.tutor.model.domain.Caller;
import ru.oparin.tutor.model.domain.QueryAnswer;
import ru.oparin.tutor.model.dto.query.QueryRequest;
import ru.oparin.tutor.model.dto.query.QueryResponse;
import ru.oparin.tutor.service.QueryOrchestrator;
import ru.oparin.tutor.service.TokenService;
import ru.oparin.tutor.util.JwtUtil;

import java.util.Optional;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Вопросы", description = "API вопросов к учебнику")
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;
    private final TokenService tokenService;
    private final QueryMapper queryMapper;
    private final QueryProperties queryProperties;

    @Operation(summary = "Вопрос к учебнику",
            description = "Отвечает по фрагментам учебника. С access-токеном ответ подстраивается под профиль пользователя")
    @PostMapping("/query")
    public Mono<ResponseEntity<QueryResponse>> query(@Valid @RequestBody QueryRequest request, ServerWebExchange exchange) {
        Optional<String> token = JwtUtil.extractToken(exchange);
        log.info("Получен вопрос длиной {} символов, токен {}", request.getQuestion().length(),
                token.isPresent() ? "передан" : "не передан");

        Mono<QueryAnswer> answer;
        if (token.isPresent() && queryProperties.isRejectInvalidToken()) {
            answer = Mono.fromCallable(() -> tokenService.verify(token.get()))
                    .flatMap(accountId -> queryOrchestrator.answer(request.getQuestion(), Caller.identified(accountId)));
        } else {
            answer = queryOrchestrator.answer(request.getQuestion(), token);
        }

        return answer
                .map(queryMapper::toQueryResponse)
                .map(ResponseEntity::ok);
    }
}
