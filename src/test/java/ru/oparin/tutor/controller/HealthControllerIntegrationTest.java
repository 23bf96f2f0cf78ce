package ru.oparin.tutor.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class HealthControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void basicHealth_shouldBeUpWithoutToken() {
        webTestClient.get()
                .uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.service").isEqualTo("tutor-back");
    }

    @Test
    void databaseHealth_shouldReportConnected() {
        webTestClient.get()
                .uri("/api/health/database")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("CONNECTED")
                .jsonPath("$.isValid").isEqualTo(true);
    }

    @Test
    void dependenciesHealth_unreachableServices_shouldReturn503WithDetails() {
        // в тестовой конфигурации поиск и генерация указывают на закрытый порт
        webTestClient.get()
                .uri("/api/health/dependencies")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("DEGRADED")
                .jsonPath("$.checks.database").isEqualTo("ok")
                .jsonPath("$.checks.retrieval").isEqualTo("error")
                .jsonPath("$.checks.generation").isEqualTo("error")
                .jsonPath("$.timestamp").exists();
    }
}
