package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.AuthProperties;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.entity.QueryRecord;
import ru.oparin.tutor.repository.QueryRecordRepository;
import ru.oparin.tutor.util.JsonUtils;

import java.time.Clock;
import java.time.LocalDateTime;

import static ru.oparin.tutor.config.DatabaseConfig.withStorageGuard;

/**
 * История вопросов для аналитики.
 */
@Slf4j
@Service
public class QueryRecordService {

    private final QueryRecordRepository queryRecordRepository;
    private final AuthProperties authProperties;
    private final Clock clock;

    public QueryRecordService(QueryRecordRepository queryRecordRepository,
                              AuthProperties authProperties,
                              Clock clock) {
        this.queryRecordRepository = queryRecordRepository;
        this.authProperties = authProperties;
        this.clock = clock;
    }

    /**
     * Сохранить вопрос и ответ.
     *
     * @param accountId      ID аккаунта или null для анонимного вопроса
     * @param profile        снимок профиля, по которому строилась инструкция, или null
     * @param responseTimeMs полное время обработки вопроса, мс
     */
    public Mono<QueryRecord> record(Long accountId, String question, String answer, ProfileSnapshot profile, Long responseTimeMs) {
        QueryRecord record = QueryRecord.builder()
                .accountId(accountId)
                .question(question)
                .answer(answer)
                .personalizationContext(profile != null ? JsonUtils.toJson(profile) : null)
                .responseTimeMs(responseTimeMs)
                .createdAt(LocalDateTime.now(clock))
                .build();
        return withStorageGuard(Mono.defer(() -> queryRecordRepository.save(record)), authProperties.getStorageTimeout());
    }

    /**
     * Удалить записи старше порога.
     *
     * @return количество удаленных записей
     */
    public Mono<Long> purgeOlderThan(LocalDateTime threshold) {
        return withStorageGuard(queryRecordRepository.deleteOlderThan(threshold), authProperties.getStorageTimeout())
                .map(Integer::longValue);
    }
}
