package ru.oparin.tutor.service.retrieval;

import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.domain.RetrievedPassage;

import java.util.List;

/**
 * Поиск фрагментов учебника, релевантных вопросу.
 * Результат не зависит от профиля пользователя.
 */
public interface ContentRetrievalClient {

    /**
     * @param question текст вопроса
     * @return фрагменты по убыванию релевантности; пустой список, если ничего не найдено
     */
    Mono<List<RetrievedPassage>> retrieve(String question);

    /**
     * @return true, если все сервисы, нужные для поиска, отвечают
     */
    Mono<Boolean> checkAvailability();
}
