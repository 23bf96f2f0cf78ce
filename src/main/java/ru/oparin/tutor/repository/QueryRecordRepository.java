package ru.oparin.tutor.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.entity.QueryRecord;

import java.time.LocalDateTime;

public interface QueryRecordRepository extends ReactiveCrudRepository<QueryRecord, Long> {

    Flux<QueryRecord> findByAccountIdOrderByCreatedAtDesc(Long accountId);

    @Modifying
    @Query("DELETE FROM query_records WHERE created_at < :threshold")
    Mono<Integer> deleteOlderThan(LocalDateTime threshold);
}
