package ru.oparin.tutor.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * История заданных вопросов для аналитики.
 * account_id может быть null: анонимные вопросы тоже записываются,
 * а при удалении аккаунта ссылка обнуляется и запись сохраняется.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("query_records")
public class QueryRecord {

    @Id
    private Long id;

    @Column("account_id")
    private Long accountId;

    private String question;

    private String answer;

    /** Снимок профиля, примененного к ответу (JSON), либо null */
    @Column("personalization_context")
    private String personalizationContext;

    /** Полное время обработки вопроса, мс */
    @Column("response_time_ms")
    private Long responseTimeMs;

    @Column("created_at")
    private LocalDateTime createdAt;
}
