package ru.oparin.tutor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.service.generation.AnswerGenerationClient;
import ru.oparin.tutor.service.retrieval.ContentRetrievalClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
public class HealthService {

    private static final Duration DATABASE_CHECK_TIMEOUT = Duration.ofSeconds(3);

    private final DatabaseClient databaseClient;
    private final ContentRetrievalClient contentRetrievalClient;
    private final AnswerGenerationClient answerGenerationClient;

    public HealthService(DatabaseClient databaseClient,
                         ContentRetrievalClient contentRetrievalClient,
                         AnswerGenerationClient answerGenerationClient) {
        this.databaseClient = databaseClient;
        this.contentRetrievalClient = contentRetrievalClient;
        this.answerGenerationClient = answerGenerationClient;
    }

    public Map<String, Object> getBasicHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "tutor-back");
        health.put("version", "1.0.0");
        return health;
    }

    public Mono<Map<String, Object>> getDatabaseHealth() {
        Map<String, Object> health = new HashMap<>();

        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .timeout(DATABASE_CHECK_TIMEOUT)
                .map(result -> {
                    health.put("status", "CONNECTED");
                    health.put("isValid", true);
                    return health;
                })
                .onErrorResume(e -> {
                    log.error("Проверка подключения к БД не прошла", e);
                    health.put("status", "ERROR");
                    health.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                    return Mono.just(health);
                });
    }

    /**
     * Состояние всех зависимостей: БД, сервиса поиска и сервиса генерации.
     * Общий статус UP, только если доступны все три.
     */
    public Mono<Map<String, Object>> getDependenciesHealth() {
        return Mono.zip(getDatabaseHealth(),
                        contentRetrievalClient.checkAvailability(),
                        answerGenerationClient.checkAvailability())
                .map(results -> {
                    boolean database = "CONNECTED".equals(results.getT1().get("status"));
                    boolean retrieval = results.getT2();
                    boolean generation = results.getT3();

                    Map<String, Object> checks = new LinkedHashMap<>();
                    checks.put("database", database ? "ok" : "error");
                    checks.put("retrieval", retrieval ? "ok" : "error");
                    checks.put("generation", generation ? "ok" : "error");

                    Map<String, Object> health = new HashMap<>();
                    health.put("status", database && retrieval && generation ? "UP" : "DEGRADED");
                    health.put("checks", checks);
                    health.put("timestamp", LocalDateTime.now());
                    if (!retrieval || !generation) {
                        log.warn("Внешние сервисы недоступны: поиск = {}, генерация = {}", retrieval, generation);
                    }
                    return health;
                });
    }
}
