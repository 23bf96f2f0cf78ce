package ru.oparin.tutor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.tutor.exception.StorageUnavailableException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Configuration
@EnableR2dbcAuditing
public class DatabaseConfig {

    /**
     * Обертка для Mono с retry при кратковременной потере связи с БД.
     * Повторяются только транзиентные ошибки: нарушение уникальности и прочие ошибки данных пробрасываются сразу.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(2, Duration.ofMillis(200))
                .maxBackoff(Duration.ofSeconds(1))
                .jitter(0.1)
                .filter(error -> error instanceof TransientDataAccessResourceException)
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    /**
     * Ограничивает операцию с хранилищем по времени и переводит недоступность БД в StorageUnavailableException.
     */
    public static <T> Mono<T> withStorageGuard(Mono<T> mono, Duration timeout) {
        return withRetry(mono)
                .timeout(timeout)
                .onErrorMap(DatabaseConfig::isStorageUnavailable,
                        error -> new StorageUnavailableException("Хранилище недоступно: " + error.getMessage(), error));
    }

    public static boolean isStorageUnavailable(Throwable error) {
        return error instanceof TimeoutException
                || error instanceof DataAccessResourceFailureException
                || error instanceof TransientDataAccessResourceException
                || error instanceof QueryTimeoutException
                || error instanceof CannotCreateTransactionException;
    }
}
