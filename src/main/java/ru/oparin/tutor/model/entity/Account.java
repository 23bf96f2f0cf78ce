package ru.oparin.tutor.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Учетная запись пользователя.
 * Email хранится в нормализованном виде (trim + lower case) и уникален среди всех аккаунтов.
 * Аккаунты не удаляются этим сервисом, а отключаются флагом active.
 */
@Table("accounts")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    @Id
    private Long id;

    private String email;

    /**
     * Хэш пароля (bcrypt). Пароль в открытом виде нигде не хранится и не логируется.
     */
    @ToString.Exclude
    @Column("password_hash")
    private String passwordHash;

    /**
     * false - аккаунт отключен администратором, вход и обновление сессий запрещены.
     */
    @Builder.Default
    private Boolean active = true;

    @CreatedDate
    @Column("created_at")
    private LocalDateTime createdAt;

    /**
     * Время последней успешной аутентификации.
     */
    @Column("last_login_at")
    private LocalDateTime lastLoginAt;
}
