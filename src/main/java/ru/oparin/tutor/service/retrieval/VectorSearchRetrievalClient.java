package ru.oparin.tutor.service.retrieval;

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
import ru.oparin.tutor.config.properties.RetrievalProperties;
import ru.oparin.tutor.exception.AnswerGenerationFailedException;
import ru.oparin.tutor.model.domain.RetrievedPassage;
import ru.oparin.tutor.model.dto.retrieval.EmbeddingResponseDTO;
import ru.oparin.tutor.model.dto.retrieval.VectorSearchResponseDTO;
import ru.oparin.tutor.util.ServiceAvailabilityUtil;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Поиск фрагментов через два внешних сервиса: вопрос превращается в вектор
 * OpenAI-совместимым эндпоинтом /embeddings, затем по вектору ищутся ближайшие точки
 * в векторном хранилище (REST API в формате Qdrant).
 */
@Slf4j
@Service
public class VectorSearchRetrievalClient implements ContentRetrievalClient {

    private static final String EMBEDDINGS_ENDPOINT = "/embeddings";
    private static final String SEARCH_ENDPOINT = "/collections/{collection}/points/search";

    private final WebClient embeddingClient;
    private final WebClient vectorStoreClient;
    private final RetrievalProperties properties;

    public VectorSearchRetrievalClient(WebClient.Builder webClientBuilder,
                                       RetrievalProperties retrievalProperties) {
        this.properties = retrievalProperties;

        WebClient.Builder embeddingBuilder = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (retrievalProperties.getEmbedding().getUrl() != null) {
            embeddingBuilder.baseUrl(retrievalProperties.getEmbedding().getUrl());
        }
        if (StringUtils.hasText(retrievalProperties.getEmbedding().getKey())) {
            embeddingBuilder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + retrievalProperties.getEmbedding().getKey());
        }
        this.embeddingClient = embeddingBuilder.build();

        WebClient.Builder vectorStoreBuilder = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (retrievalProperties.getVectorStore().getUrl() != null) {
            vectorStoreBuilder.baseUrl(retrievalProperties.getVectorStore().getUrl());
        }
        if (StringUtils.hasText(retrievalProperties.getVectorStore().getKey())) {
            vectorStoreBuilder.defaultHeader("api-key", retrievalProperties.getVectorStore().getKey());
        }
        this.vectorStoreClient = vectorStoreBuilder.build();
    }

    @Override
    public Mono<List<RetrievedPassage>> retrieve(String question) {
        return embed(question)
                .flatMap(this::search)
                .doOnNext(passages -> log.info("Найдено фрагментов: {}", passages.size()))
                .onErrorMap(this::mapToAnswerGenerationFailed);
    }

    @Override
    public Mono<Boolean> checkAvailability() {
        Duration timeout = Duration.ofMillis(properties.getTimeout());
        return Mono.zip(ServiceAvailabilityUtil.check(embeddingClient, timeout, "эмбеддингов"),
                        ServiceAvailabilityUtil.check(vectorStoreClient, timeout, "векторного хранилища"))
                .map(results -> results.getT1() && results.getT2());
    }

    private Mono<List<Double>> embed(String question) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", properties.getEmbeddingModel());
        requestBody.put("input", question);

        return embeddingClient.post()
                .uri(EMBEDDINGS_ENDPOINT)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(EmbeddingResponseDTO.class)
                .timeout(Duration.ofMillis(properties.getTimeout()))
                .map(response -> {
                    if (response.getData() == null || response.getData().isEmpty()
                            || response.getData().get(0).getEmbedding() == null
                            || response.getData().get(0).getEmbedding().isEmpty()) {
                        throw new AnswerGenerationFailedException("Сервис эмбеддингов вернул пустой вектор", HttpStatus.BAD_GATEWAY);
                    }
                    return response.getData().get(0).getEmbedding();
                });
    }

    private Mono<List<RetrievedPassage>> search(List<Double> vector) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("vector", vector);
        requestBody.put("limit", properties.getTopK());
        requestBody.put("score_threshold", properties.getScoreThreshold());
        requestBody.put("with_payload", true);

        return vectorStoreClient.post()
                .uri(SEARCH_ENDPOINT, properties.getCollection())
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(VectorSearchResponseDTO.class)
                .timeout(Duration.ofMillis(properties.getTimeout()))
                .map(this::toPassages);
    }

    private List<RetrievedPassage> toPassages(VectorSearchResponseDTO response) {
        if (response.getResult() == null) {
            return List.of();
        }
        return response.getResult().stream()
                .filter(Objects::nonNull)
                .map(this::toPassage)
                .filter(passage -> StringUtils.hasText(passage.getPassageText()))
                .sorted(Comparator.comparingDouble(RetrievedPassage::getRelevanceScore).reversed())
                .toList();
    }

    private RetrievedPassage toPassage(VectorSearchResponseDTO.ScoredPoint point) {
        Map<String, Object> payload = point.getPayload() != null ? point.getPayload() : Map.of();
        return RetrievedPassage.builder()
                .passageText(firstText(payload, "chunk_text", "content_text", "text"))
                .sourceChapter(firstText(payload, "chapter"))
                .sourceSection(firstText(payload, "section"))
                .sourceUrl(firstText(payload, "source_url", "page_url", "url"))
                .relevanceScore(point.getScore() != null ? point.getScore() : 0.0)
                .build();
    }

    private String firstText(Map<String, Object> payload, String... keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value != null && StringUtils.hasText(value.toString())) {
                return value.toString();
            }
        }
        return null;
    }

    /**
     * Преобразование ошибок WebClient в AnswerGenerationFailedException.
     */
    private Throwable mapToAnswerGenerationFailed(Throwable e) {
        if (e instanceof AnswerGenerationFailedException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new AnswerGenerationFailedException("Поиск фрагментов не уложился в таймаут", HttpStatus.GATEWAY_TIMEOUT, e);
        }
        if (e instanceof WebClientRequestException) {
            return new AnswerGenerationFailedException("Не удалось подключиться к сервису поиска: " + e.getMessage(),
                    HttpStatus.BAD_GATEWAY, e);
        }
        if (e instanceof WebClientResponseException webE) {
            log.error("Сервис поиска вернул ошибку. Статус: {}, тело ответа: {}", webE.getStatusCode(), webE.getResponseBodyAsString());
            return new AnswerGenerationFailedException("Сервис поиска вернул ошибку: " + webE.getStatusCode(),
                    HttpStatus.BAD_GATEWAY, e);
        }
        return new AnswerGenerationFailedException("Ошибка поиска фрагментов: " + e.getMessage(), HttpStatus.BAD_GATEWAY, e);
    }
}
