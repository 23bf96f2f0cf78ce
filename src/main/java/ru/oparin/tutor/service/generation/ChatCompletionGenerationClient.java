package ru.oparin.tutor.service.generation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import ru.oparin.tutor.config.properties.GenerationProperties;
import ru.oparin.tutor.exception.AnswerGenerationFailedException;
import ru.oparin.tutor.model.domain.GenerationRequest;
import ru.oparin.tutor.model.domain.RetrievedPassage;
import ru.oparin.tutor.model.dto.generation.ChatCompletionResponseDTO;
import ru.oparin.tutor.util.ServiceAvailabilityUtil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Генерация ответа через OpenAI-совместимый эндпоинт /chat/completions.
 * Системное сообщение - инструкция, пользовательское - пронумерованные фрагменты и вопрос.
 */
@Slf4j
@Service
public class ChatCompletionGenerationClient implements AnswerGenerationClient {

    private static final String ENDPOINT = "/chat/completions";
    private static final String EMPTY_CONTEXT = "No relevant textbook passages were found for this question.";

    private final WebClient webClient;
    private final GenerationProperties properties;

    public ChatCompletionGenerationClient(WebClient.Builder webClientBuilder,
                                          GenerationProperties generationProperties) {
        this.properties = generationProperties;
        WebClient.Builder builder = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (generationProperties.getApi().getUrl() != null) {
            builder.baseUrl(generationProperties.getApi().getUrl());
        }
        if (StringUtils.hasText(generationProperties.getApi().getKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + generationProperties.getApi().getKey());
        }
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> generate(GenerationRequest request) {
        Map<String, Object> requestBody = buildRequestBody(request);
        log.debug("Отправляем запрос на генерацию ответа в model = {}, фрагментов: {}",
                properties.getModel(), request.getPassages() != null ? request.getPassages().size() : 0);

        return webClient.post()
                .uri(ENDPOINT)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(ChatCompletionResponseDTO.class)
                .timeout(Duration.ofMillis(properties.getTimeout()))
                .map(this::extractAnswer)
                .onErrorMap(this::mapToAnswerGenerationFailed);
    }

    @Override
    public Mono<Boolean> checkAvailability() {
        return ServiceAvailabilityUtil.check(webClient, Duration.ofMillis(properties.getTimeout()), "генерации");
    }

    /**
     * Построить тело запроса в формате OpenAI.
     */
    Map<String, Object> buildRequestBody(GenerationRequest request) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", properties.getModel());
        requestBody.put("max_tokens", properties.getMaxTokens());
        requestBody.put("temperature", properties.getTemperature());

        List<Map<String, Object>> messages = new ArrayList<>();
        messages.add(Map.of("role", "system", "content", request.getInstruction()));
        messages.add(Map.of("role", "user", "content", buildUserMessage(request)));
        requestBody.put("messages", messages);

        return requestBody;
    }

    private String buildUserMessage(GenerationRequest request) {
        StringBuilder message = new StringBuilder("Context from the textbook:\n\n");
        List<RetrievedPassage> passages = request.getPassages();
        if (passages == null || passages.isEmpty()) {
            message.append(EMPTY_CONTEXT).append("\n\n");
        } else {
            for (int i = 0; i < passages.size(); i++) {
                RetrievedPassage passage = passages.get(i);
                message.append('[').append(i + 1).append("] ");
                if (passage.getSourceChapter() != null) {
                    message.append("Chapter: ").append(passage.getSourceChapter());
                }
                if (passage.getSourceSection() != null) {
                    message.append(passage.getSourceChapter() != null ? ", " : "")
                            .append("Section: ").append(passage.getSourceSection());
                }
                message.append('\n').append(passage.getPassageText()).append("\n\n");
            }
        }
        return message.append("Question: ").append(request.getQuestion()).toString();
    }

    private String extractAnswer(ChatCompletionResponseDTO response) {
        if (response.getChoices() == null || response.getChoices().isEmpty()) {
            log.error("Ответ модели не содержит choices");
            throw new AnswerGenerationFailedException("Ответ модели не содержит choices", HttpStatus.BAD_GATEWAY);
        }
        ChatCompletionResponseDTO.Message message = response.getChoices().get(0).getMessage();
        if (message == null || !StringUtils.hasText(message.getContent())) {
            log.error("Ответ модели пуст, finish_reason = {}", response.getChoices().get(0).getFinishReason());
            throw new AnswerGenerationFailedException("Модель вернула пустой ответ", HttpStatus.BAD_GATEWAY);
        }
        return message.getContent().trim();
    }

    /**
     * Преобразование ошибок WebClient в AnswerGenerationFailedException.
     */
    private Throwable mapToAnswerGenerationFailed(Throwable e) {
        if (e instanceof AnswerGenerationFailedException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new AnswerGenerationFailedException("Генерация ответа не уложилась в таймаут", HttpStatus.GATEWAY_TIMEOUT, e);
        }
        if (e instanceof WebClientRequestException) {
            return new AnswerGenerationFailedException("Не удалось подключиться к сервису генерации: " + e.getMessage(),
                    HttpStatus.BAD_GATEWAY, e);
        }
        if (e instanceof WebClientResponseException webE) {
            log.error("Сервис генерации вернул ошибку. Статус: {}, тело ответа: {}", webE.getStatusCode(), webE.getResponseBodyAsString());
            return new AnswerGenerationFailedException("Сервис генерации вернул ошибку: " + webE.getStatusCode(),
                    HttpStatus.BAD_GATEWAY, e);
        }
        return new AnswerGenerationFailedException("Ошибка генерации ответа: " + e.getMessage(), HttpStatus.BAD_GATEWAY, e);
    }
}
