package ru.oparin.tutor.service.generation;

import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.domain.GenerationRequest;

/**
 * Генерация ответа языковой моделью по вопросу, найденным фрагментам и системной инструкции.
 */
public interface AnswerGenerationClient {

    Mono<String> generate(GenerationRequest request);

    /**
     * @return true, если сервис генерации отвечает
     */
    Mono<Boolean> checkAvailability();
}
