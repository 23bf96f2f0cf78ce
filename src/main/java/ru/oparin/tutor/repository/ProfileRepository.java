package ru.oparin.tutor.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.model.entity.Profile;

public interface ProfileRepository extends ReactiveCrudRepository<Profile, Long> {

    Mono<Profile> findByAccountId(Long accountId);
}
