package ru.oparin.tutor.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.entity.Session;

import java.time.LocalDateTime;

/**
 * Repository для записей сессий (refresh-токенов).
 * Все удаления возвращают число затронутых строк: по нему определяется исход ротации.
 */
@Repository
public interface SessionRepository extends ReactiveCrudRepository<Session, Long> {

    /**
     * Найти сессию по хэшу refresh-токена.
     *
     * @param tokenHash SHA-256 (hex) от предъявленного токена
     * @return сессия или пустой результат
     */
    Mono<Session> findByTokenHash(String tokenHash);

    Mono<Long> countByAccountId(Long accountId);

    /**
     * Условное удаление при ротации. Если запись уже удалена параллельным обновлением,
     * вернется 0 и ротация считается проигранной.
     *
     * @param id        идентификатор сессии
     * @param tokenHash хэш токена, по которому сессия была найдена
     * @return количество удаленных записей (0 или 1)
     */
    @Modifying
    @Query("DELETE FROM sessions WHERE id = :id AND token_hash = :tokenHash")
    Mono<Integer> deleteByIdAndTokenHash(Long id, String tokenHash);

    /**
     * Удалить сессию владельца по хэшу токена. Чужие сессии не затрагиваются.
     */
    @Modifying
    @Query("DELETE FROM sessions WHERE account_id = :accountId AND token_hash = :tokenHash")
    Mono<Integer> deleteByAccountIdAndTokenHash(Long accountId, String tokenHash);

    @Modifying
    @Query("DELETE FROM sessions WHERE account_id = :accountId")
    Mono<Integer> deleteAllByAccountId(Long accountId);

    /**
     * Удалить истекшие сессии. Используется периодической очисткой.
     */
    @Modifying
    @Query("DELETE FROM sessions WHERE expires_at <= :now")
    Mono<Integer> deleteExpired(LocalDateTime now);

    /**
     * Оставить у аккаунта только keep самых новых сессий.
     *
     * @return количество удаленных (самых старых) сессий
     */
    @Modifying
    @Query("DELETE FROM sessions WHERE account_id = :accountId AND id NOT IN " +
            "(SELECT s.id FROM sessions s WHERE s.account_id = :accountId ORDER BY s.created_at DESC, s.id DESC LIMIT :keep)")
    Mono<Integer> deleteOldestBeyond(Long accountId, int keep);
}
