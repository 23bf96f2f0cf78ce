package ru.oparin.tutor.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.entity.Account;

import java.time.LocalDateTime;

public interface AccountRepository extends ReactiveCrudRepository<Account, Long> {

    Mono<Account> findByEmail(String email);
    Mono<Boolean> existsByEmail(String email);

    @Modifying
    @Query("UPDATE accounts SET last_login_at = :loginAt WHERE id = :id")
    Mono<Integer> updateLastLoginAt(Long id, LocalDateTime loginAt);
}
