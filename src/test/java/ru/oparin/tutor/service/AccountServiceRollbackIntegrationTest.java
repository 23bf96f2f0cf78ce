package ru.oparin.tutor.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.tutor.exception.StorageUnavailableException;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.entity.Profile;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;
import ru.oparin.tutor.repository.ProfileRepository;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Integration test: a failed profile insert must roll back the account insert.
 */
@SpringBootTest
class AccountServiceRollbackIntegrationTest {

    @Autowired
    private AccountService accountService;

    @MockitoBean
    private ProfileRepository profileRepository;

    @Test
    void profileFailureShouldLeaveNoAccountBehind() {
        String email = "rollback-" + UUID.randomUUID() + "@test.local";
        when(profileRepository.save(any(Profile.class)))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("profiles table unavailable")));

        ProfileSnapshot draft = ProfileSnapshot.builder()
                .softwareExperience(SoftwareExperience.BEGINNER)
                .hardwareExperience(HardwareExperience.NONE)
                .interests(List.of())
                .build();

        StepVerifier.create(accountService.createWithProfile(email, "hash", draft))
                .expectError(StorageUnavailableException.class)
                .verify();

        StepVerifier.create(accountService.findByEmail(email))
                .verifyComplete();
    }
}
