/**
 * HTTP client for the remote generative backend
 *
 * @author William Callahan
 *
 * Features:
 * - One-shot text and JSON generation
 * - Progressive tasks: start and status endpoints used by TaskPoller
 * - SSE endpoints decoded through StreamEventParser
 * - Availability check consulted before any remote generation
 * - Paragraph alignment of a finished translation
 * - Maps HTTP and transport failures onto the ErrorClassification taxonomy
 */

package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.GenerationTask;
import com.williamcallahan.dictionary_engine.model.ModelConfig;
import com.williamcallahan.dictionary_engine.model.Paragraph;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationResult;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import com.williamcallahan.dictionary_engine.util.ErrorHandlingUtils;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class GenerationApiClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AppConfigurationProperties.Generation settings;

    /**
     * Constructs the client against the configured backend base URL
     *
     * @param webClientBuilder shared WebClient builder (cloned, never mutated)
     * @param objectMapper mapper for SSE frame payloads
     * @param properties application properties
     */
    public GenerationApiClient(WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper,
                               AppConfigurationProperties properties) {
        this.settings = properties.getGeneration();
        this.webClient = webClientBuilder.clone().baseUrl(settings.getBaseUrl()).build();
        this.objectMapper = objectMapper;
    }

    public ModelConfig defaultModelConfig() {
        return new ModelConfig(settings.getProvider(), settings.getModel(), settings.getMaxTokens(), settings.getTemperature());
    }

    /**
     * POST /generate
     *
     * @return generated text
     */
    public Mono<String> generateText(String prompt, ModelConfig config) {
        return postJson("/generate", prompt, config, "generate")
            .timeout(settings.getBasicTimeout())
            .flatMap(node -> {
                JsonNode text = node.get("text");
                if (text == null || !text.isTextual()) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "generate response has no text field"));
                }
                return Mono.just(text.asText());
            })
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, "generate"));
    }

    /**
     * POST /generate-json
     *
     * @return generated document and token usage
     */
    public Mono<GenerationResult> generateJson(String prompt, ModelConfig config) {
        return postJson("/generate-json", prompt, config, "generate-json")
            .timeout(settings.getBasicTimeout())
            .flatMap(node -> {
                JsonNode data = node.get("data");
                if (data == null || data.isNull()) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "generate-json response has no data field"));
                }
                return Mono.just(new GenerationResult(data, node.path("tokensUsed").asInt(0)));
            })
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, "generate-json"));
    }

    /**
     * POST /generate-json-progressive
     *
     * @return id of the started task
     */
    public Mono<String> startProgressiveTask(String prompt, ModelConfig config) {
        return postJson("/generate-json-progressive", prompt, config, "generate-json-progressive")
            .timeout(settings.getBasicTimeout())
            .flatMap(node -> {
                String taskId = node.path("taskId").asText("");
                if (taskId.isEmpty()) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "generate-json-progressive response has no taskId"));
                }
                log.debug("Started progressive task {}", taskId);
                return Mono.just(taskId);
            })
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, "generate-json-progressive"));
    }

    /**
     * GET /task/{taskId}. A 404 surfaces as TASK_NOT_FOUND and a 429 as RATE_LIMITED so the
     * poller can apply its soft-retry policies.
     */
    public Mono<GenerationTask> getTask(String taskId) {
        return webClient.get()
            .uri("/task/{taskId}", taskId)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toStatusError(response, "task status", true))
            .bodyToMono(GenerationTask.class)
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, "task status"));
    }

    /**
     * POST /generate-additional-stream
     */
    public Flux<StreamEvent> streamAdditional(String prompt, ModelConfig config) {
        return postStream("/generate-additional-stream", prompt, config, "generate-additional-stream");
    }

    /**
     * POST /generate-suggestions-stream
     */
    public Flux<StreamEvent> streamSuggestions(String prompt, ModelConfig config) {
        return postStream("/generate-suggestions-stream", prompt, config, "generate-suggestions-stream");
    }

    /**
     * POST to the configured paragraph split URL, which lives next to the generation API
     *
     * @param translation finished translation to align
     * @return aligned paragraphs in order, indexed from 0
     */
    public Mono<List<Paragraph>> splitParagraphs(TranslationResult translation) {
        Map<String, String> body = Map.of(
            "originalText", translation.originalText(),
            "translatedText", translation.translatedText(),
            "sourceLang", translation.sourceLang(),
            "targetLang", translation.targetLang());
        return webClient.post()
            .uri(URI.create(settings.getParagraphSplitUrl()))
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toStatusError(response, "split-paragraphs", false))
            .bodyToMono(JsonNode.class)
            .timeout(settings.getBasicTimeout())
            .flatMap(node -> {
                JsonNode paragraphs = node.get("paragraphs");
                if (paragraphs == null || !paragraphs.isArray()) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "split-paragraphs response has no paragraphs array"));
                }
                List<Paragraph> result = new ArrayList<>();
                for (JsonNode paragraph : paragraphs) {
                    result.add(new Paragraph(paragraph.path("originalText").asText(""),
                        paragraph.path("translatedText").asText(""), result.size()));
                }
                return Mono.just(result);
            })
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, "split-paragraphs"));
    }

    /**
     * GET /status. Any failure counts as "not configured".
     * Cached briefly in the generationStatus cache so a burst of lookups checks once.
     */
    @Cacheable("generationStatus")
    public Mono<Boolean> isConfigured() {
        return webClient.get()
            .uri("/status")
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(settings.getStatusTimeout())
            .map(node -> node.path("configured").asBoolean(false))
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Generation backend status check failed, treating as not configured: {}", e.getMessage());
                return Mono.just(false);
            });
    }

    private Mono<JsonNode> postJson(String path, String prompt, ModelConfig config, String operation) {
        return webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(requestBody(prompt, config))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toStatusError(response, operation, false))
            .bodyToMono(JsonNode.class)
            .switchIfEmpty(Mono.error(() -> new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                operation + " returned an empty body")))
            .retryWhen(Retry.backoff(1, Duration.ofSeconds(1))
                .filter(throwable -> {
                    // Gateway hiccups only; 429 is never retried here
                    if (throwable instanceof GenerationException ge && ge.getHttpStatus() != null) {
                        return ge.getHttpStatus() == 502 || ge.getHttpStatus() == 503;
                    }
                    return false;
                })
                .doBeforeRetry(signal -> log.warn("Retrying {} after {}", operation, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Flux<StreamEvent> postStream(String path, String prompt, ModelConfig config, String operation) {
        Flux<DataBuffer> body = webClient.post()
            .uri(path)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.TEXT_EVENT_STREAM)
            .bodyValue(requestBody(prompt, config))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> toStatusError(response, operation, false))
            .bodyToFlux(DataBuffer.class);

        return StreamEventParser.decode(body, objectMapper)
            .timeout(settings.getStreamTimeout())
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, operation, abbreviate(prompt)))
            .onErrorMap(e -> !(e instanceof GenerationException), e -> ErrorHandlingUtils.toGenerationException(e, operation));
    }

    private Map<String, Object> requestBody(String prompt, ModelConfig config) {
        return Map.of("prompt", prompt, "config", config != null ? config : defaultModelConfig());
    }

    private Mono<GenerationException> toStatusError(ClientResponse response, String operation, boolean taskLookup) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> {
                ErrorClassification classification;
                if (status == 429) {
                    classification = ErrorClassification.RATE_LIMITED;
                } else if (status == 404 && taskLookup) {
                    classification = ErrorClassification.TASK_NOT_FOUND;
                } else if (status == 408 || status == 504) {
                    classification = ErrorClassification.TIMEOUT;
                } else {
                    classification = ErrorClassification.UPSTREAM_ERROR;
                }
                String message = operation + " returned HTTP " + status + (body.isBlank() ? "" : ": " + abbreviate(body));
                return new GenerationException(classification, message, status, null);
            });
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= 120 ? value : value.substring(0, 117) + "...";
    }
}
