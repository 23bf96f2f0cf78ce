package ru.oparin.tutor.mapper;

import org.springframework.stereotype.Component;
import ru.oparin.tutor.model.domain.ProfileSnapshot;
import ru.oparin.tutor.model.dto.profile.ProfileResponse;
import ru.oparin.tutor.model.entity.Account;
import ru.oparin.tutor.model.entity.Profile;
import ru.oparin.tutor.util.JsonUtils;

/**
 * Преобразование профиля в DTO ответа и в снимок для персонализации.
 */
@Component
public class ProfileMapper {

    public ProfileResponse toProfileResponse(Account account, Profile profile) {
        if (profile == null) {
            return null;
        }

        return ProfileResponse.builder()
                .accountId(profile.getAccountId())
                .email(account != null ? account.getEmail() : null)
                .softwareExperience(profile.getSoftwareExperience() != null ? profile.getSoftwareExperience().name() : null)
                .hardwareExperience(profile.getHardwareExperience() != null ? profile.getHardwareExperience().name() : null)
                .interests(JsonUtils.parseJsonToList(profile.getInterests()))
                .createdAt(account != null ? account.getCreatedAt() : profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .lastLoginAt(account != null ? account.getLastLoginAt() : null)
                .build();
    }

    public ProfileSnapshot toSnapshot(Profile profile) {
        return ProfileSnapshot.builder()
                .softwareExperience(profile.getSoftwareExperience())
                .hardwareExperience(profile.getHardwareExperience())
                .interests(JsonUtils.parseJsonToList(profile.getInterests()))
                .build();
    }
}
