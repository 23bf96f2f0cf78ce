package ru.oparin.tutor.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.service.HealthService;

import java.util.Map;

@RestController
@RequestMapping("/api/health")
@Tag(name = "Health", description = "Проверка состояния сервиса")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @Operation(summary = "Базовая проверка")
    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> healthCheck() {
        return Mono.just(ResponseEntity.ok(healthService.getBasicHealth()));
    }

    @Operation(summary = "Проверка подключения к базе данных")
    @GetMapping("/database")
    public Mono<ResponseEntity<Map<String, Object>>> databaseHealth() {
        return healthService.getDatabaseHealth()
                .map(dbHealth -> {
                    if ("ERROR".equals(dbHealth.get("status"))) {
                        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(dbHealth);
                    }
                    return ResponseEntity.ok(dbHealth);
                });
    }

    @Operation(summary = "Проверка БД, сервиса поиска и сервиса генерации")
    @GetMapping("/dependencies")
    public Mono<ResponseEntity<Map<String, Object>>> dependenciesHealth() {
        return healthService.getDependenciesHealth()
                .map(health -> "UP".equals(health.get("status"))
                        ? ResponseEntity.ok(health)
                        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health));
    }
}
