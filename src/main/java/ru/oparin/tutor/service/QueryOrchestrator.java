package ru.oparin.tutor.service;

import jakarta.validation.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.QueryProperties;
import ru.oparin.tutor.exception.AnswerGenerationFailedException;
import ru.oparin.tutor.exception.InvalidTokenException;
import ru.oparin.tutor.model.domain.Caller;
import ru.oparin.tutor.model.domain.GenerationRequest;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.domain.QueryAnswer;
import ru.oparin.tutor.service.generation.AnswerGenerationClient;
import ru.oparin.tutor.service.retrieval.ContentRetrievalClient;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ответ на вопрос по учебнику: персонализация, поиск фрагментов, генерация и запись в историю.
 * <p>
 * Ошибки обрабатываются несимметрично. Любой сбой при загрузке профиля или построении
 * инструкции дает ответ без персонализации. Сбой поиска или генерации всегда возвращается клиенту.
 */
@Slf4j
@Service
public class QueryOrchestrator {

    private final TokenService tokenService;
    private final ProfileService profileService;
    private final PersonalizationComposer personalizationComposer;
    private final ContentRetrievalClient contentRetrievalClient;
    private final AnswerGenerationClient answerGenerationClient;
    private final QueryRecordService queryRecordService;
    private final QueryProperties properties;

    public QueryOrchestrator(TokenService tokenService,
                             ProfileService profileService,
                             PersonalizationComposer personalizationComposer,
                             ContentRetrievalClient contentRetrievalClient,
                             AnswerGenerationClient answerGenerationClient,
                             QueryRecordService queryRecordService,
                             QueryProperties queryProperties) {
        this.tokenService = tokenService;
        this.profileService = profileService;
        this.personalizationComposer = personalizationComposer;
        this.contentRetrievalClient = contentRetrievalClient;
        this.answerGenerationClient = answerGenerationClient;
        this.queryRecordService = queryRecordService;
        this.properties = queryProperties;
    }

    /**
     * Ответить на вопрос. Невалидный токен не является ошибкой: вопрос обрабатывается как анонимный.
     */
    public Mono<QueryAnswer> answer(String question, Optional<String> accessToken) {
        return Mono.defer(() -> answer(question, resolveCaller(accessToken)));
    }

    public Mono<QueryAnswer> answer(String question, Caller caller) {
        String normalized = question == null ? "" : question.trim();
        if (normalized.isEmpty()) {
            return Mono.error(new ValidationException("Question must not be blank"));
        }
        if (normalized.length() > properties.getMaxQuestionLength()) {
            return Mono.error(new ValidationException("Question must be at most " + properties.getMaxQuestionLength() + " characters"));
        }

        return Mono.defer(() -> {
                    long startedAt = System.nanoTime();
                    return personalize(caller)
                            .flatMap(personalization -> retrieveAndGenerate(normalized, personalization)
                                    .map(answer -> {
                                        answer.setTotalTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
                                        return answer;
                                    })
                                    .flatMap(answer -> recordQuery(caller, normalized, answer, personalization)));
                })
                .doOnSuccess(answer -> log.info("Ответ построен за {} мс (поиск {} мс, генерация {} мс): caller = {}, персонализация = {}, фрагментов = {}",
                        answer.getTotalTimeMs(), answer.getRetrievalTimeMs(), answer.getAnswerTimeMs(),
                        caller, answer.isPersonalizationApplied(), answer.getCitations().size()));
    }

    /**
     * Определить автора вопроса. Проверка токена не обращается к хранилищу.
     */
    Caller resolveCaller(Optional<String> accessToken) {
        if (accessToken == null || accessToken.isEmpty() || accessToken.get().isBlank()) {
            return Caller.anonymous();
        }
        try {
            return Caller.identified(tokenService.verify(accessToken.get()));
        } catch (InvalidTokenException e) {
            log.warn("Вопрос с невалидным access-токеном обрабатывается как анонимный");
            return Caller.anonymous();
        }
    }

    /**
     * Единственная защищенная область: загрузка профиля и построение инструкции.
     * Поиск и генерация сюда не входят.
     */
    private Mono<Personalization> personalize(Caller caller) {
        if (!caller.isIdentified()) {
            return Mono.just(Personalization.none(personalizationComposer.defaultInstruction()));
        }
        Long accountId = caller.getAccountId().orElseThrow();

        return Mono.defer(() -> profileService.findProfile(accountId))
                .timeout(properties.getProfileTimeout())
                .map(profile -> Personalization.applied(profile, personalizationComposer.compose(profile)))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Профиль аккаунта {} не найден, ответ без персонализации", accountId);
                    return Personalization.none(personalizationComposer.defaultInstruction());
                }))
                .onErrorResume(e -> {
                    log.warn("Не удалось получить профиль аккаунта {}, ответ без персонализации: {}", accountId, e.toString());
                    return Mono.just(Personalization.none(personalizationComposer.defaultInstruction()));
                });
    }

    private Mono<QueryAnswer> retrieveAndGenerate(String question, Personalization personalization) {
        return Mono.defer(() -> contentRetrievalClient.retrieve(question))
                .elapsed()
                .flatMap(retrieved -> Mono.defer(() -> answerGenerationClient.generate(GenerationRequest.builder()
                                .question(question)
                                .passages(retrieved.getT2())
                                .instruction(personalization.instruction())
                                .build()))
                        .elapsed()
                        .map(generated -> QueryAnswer.builder()
                                .answer(generated.getT2())
                                .citations(retrieved.getT2())
                                .personalizationApplied(personalization.applied())
                                .instruction(personalization.instruction())
                                .retrievalTimeMs(retrieved.getT1())
                                .answerTimeMs(generated.getT1())
                                .build()))
                .timeout(properties.getDeadline())
                .onErrorMap(this::mapToAnswerGenerationFailed);
    }

    /**
     * Запись в историю. Ошибка записи логируется и не влияет на ответ.
     */
    private Mono<QueryAnswer> recordQuery(Caller caller, String question, QueryAnswer answer, Personalization personalization) {
        if (!properties.isRecordEnabled()) {
            return Mono.just(answer);
        }
        return queryRecordService.record(caller.getAccountId().orElse(null), question, answer.getAnswer(),
                        personalization.profile(), answer.getTotalTimeMs())
                .map(record -> {
                    answer.setQueryId(record.getId());
                    return answer;
                })
                .onErrorResume(e -> {
                    log.error("Не удалось сохранить вопрос в историю", e);
                    return Mono.just(answer);
                })
                .defaultIfEmpty(answer);
    }

    private Throwable mapToAnswerGenerationFailed(Throwable e) {
        if (e instanceof AnswerGenerationFailedException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new AnswerGenerationFailedException("Ответ не построен за " + properties.getDeadline(), HttpStatus.GATEWAY_TIMEOUT, e);
        }
        log.error("Непредвиденная ошибка при построении ответа", e);
        return new AnswerGenerationFailedException("Ошибка построения ответа: " + e.getMessage(), HttpStatus.BAD_GATEWAY, e);
    }

    private record Personalization(ProfileSnapshot profile, String instruction, boolean applied) {

        static Personalization applied(ProfileSnapshot profile, String instruction) {
            return new Personalization(profile, instruction, true);
        }

        static Personalization none(String instruction) {
            return new Personalization(null, instruction, false);
        }
    }
}
