package ru.oparin.tutor.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Проверка доступности внешнего HTTP сервиса.
 */
@Slf4j
@UtilityClass
public class ServiceAvailabilityUtil {

    /**
     * Однократный HEAD запрос к базовому URL клиента.
     * Ответ 4xx тоже означает, что сервис доступен: он принял соединение и ответил.
     *
     * @param webClient клиент с настроенным базовым URL и заголовками
     * @param timeout   максимальное время ожидания ответа
     * @param service   название сервиса для логов
     * @return true, если сервис доступен
     */
    public static Mono<Boolean> check(WebClient webClient, Duration timeout, String service) {
        return webClient.head()
                .uri("/")
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .map(response -> true)
                .onErrorResume(WebClientRequestException.class, e -> {
                    log.debug("Ошибка подключения к сервису {}: {}", service, e.getMessage());
                    return Mono.just(false);
                })
                .onErrorResume(WebClientResponseException.class, e ->
                        Mono.just(e.getStatusCode().is4xxClientError()))
                .onErrorResume(Exception.class, e -> {
                    log.debug("Неожиданная ошибка при проверке сервиса {}: {}", service, e.toString());
                    return Mono.just(false);
                });
    }
}
