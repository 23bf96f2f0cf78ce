package ru.oparin.tutor.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.tutor.model.enums.HardwareExperience;
import ru.oparin.tutor.model.enums.SoftwareExperience;

import java.time.LocalDateTime;

/**
 * Профиль пользователя для персонализации ответов. Ровно один на аккаунт,
 * удаляется каскадно вместе с аккаунтом.
 */
@Table("profiles")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    @Id
    private Long id;

    @Column("account_id")
    private Long accountId;

    @Builder.Default
    @Column("software_experience")
    private SoftwareExperience softwareExperience = SoftwareExperience.BEGINNER;

    @Builder.Default
    @Column("hardware_experience")
    private HardwareExperience hardwareExperience = HardwareExperience.NONE;

    /**
     * Интересы пользователя в виде JSON-массива строк.
     */
    private String interests;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
