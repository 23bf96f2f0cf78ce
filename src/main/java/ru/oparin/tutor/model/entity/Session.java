package ru.oparin.tutor.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Entity для таблицы sessions.
 * Одна запись - один выданный refresh-токен. Сам токен не хранится, только его SHA-256.
 * При обновлении запись удаляется и создается новая, при выходе - удаляется.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("sessions")
public class Session {

    @Id
    private Long id;

    @Column("account_id")
    private Long accountId;

    /** SHA-256 (hex) от refresh-токена */
    @ToString.Exclude
    @Column("token_hash")
    private String tokenHash;

    @Column("expires_at")
    private LocalDateTime expiresAt;

    @Column("user_agent")
    private String userAgent;

    @Column("ip_address")
    private String ipAddress;

    @Column("created_at")
    private LocalDateTime createdAt;
}
