/**
 * Test suite for GenerationApiClient against a stubbed exchange function
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.GenerationTask;
import com.williamcallahan.dictionary_engine.model.Paragraph;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenerationApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private AppConfigurationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AppConfigurationProperties();
        properties.getGeneration().setBaseUrl("http://generation.test/api");
    }

    private GenerationApiClient clientAnswering(HttpStatus status, String contentType, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build());
        });
        return new GenerationApiClient(builder, new ObjectMapper(), properties);
    }

    @Test
    void generateJson_returnsDataAndTokenUsage() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE,
            "{\"data\":{\"headword\":{\"lemma\":\"run\"}},\"tokensUsed\":17}");

        StepVerifier.create(client.generateJson("prompt", null))
            .expectNextMatches(result -> result.tokensUsed() == 17
                && "run".equals(result.data().path("headword").path("lemma").asText()))
            .verifyComplete();

        assertEquals("/api/generate-json", requests.get(0).url().getPath());
    }

    @Test
    void generateJson_failsAsMalformed_whenDataIsMissing() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"tokensUsed\":1}");

        StepVerifier.create(client.generateJson("prompt", null))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.MALFORMED_RESPONSE))
            .verify();
    }

    @Test
    void generateText_mapsClientErrorToUpstreamError_withoutRetrying() {
        GenerationApiClient client = clientAnswering(HttpStatus.BAD_REQUEST, MediaType.APPLICATION_JSON_VALUE,
            "{\"error\":\"bad prompt\"}");

        StepVerifier.create(client.generateText("prompt", null))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.UPSTREAM_ERROR)
                && ge.getHttpStatus() == 400)
            .verify();
        assertEquals(1, requests.size());
    }

    @Test
    void generateJson_mapsTooManyRequestsToRateLimited() {
        GenerationApiClient client = clientAnswering(HttpStatus.TOO_MANY_REQUESTS, MediaType.APPLICATION_JSON_VALUE, "{}");

        StepVerifier.create(client.generateJson("prompt", null))
            .expectErrorMatches(error -> error instanceof GenerationException ge && ge.is(ErrorClassification.RATE_LIMITED))
            .verify();
    }

    @Test
    void startProgressiveTask_returnsTaskId() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"taskId\":\"abc\"}");

        StepVerifier.create(client.startProgressiveTask("prompt", null))
            .expectNext("abc")
            .verifyComplete();
    }

    @Test
    void getTask_deserializesLegacyStatusNames() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE,
            "{\"id\":\"abc\",\"status\":\"generating\",\"progress\":40,\"partialData\":{\"hint\":\"h\"},\"extra\":1}");

        StepVerifier.create(client.getTask("abc"))
            .expectNextMatches(task -> task.getStatus() == GenerationTask.Status.RUNNING
                && task.getProgress() == 40
                && task.hasPartialData())
            .verifyComplete();
        assertEquals("/api/task/abc", requests.get(0).url().getPath());
    }

    @Test
    void getTask_mapsNotFoundToTaskNotFound() {
        GenerationApiClient client = clientAnswering(HttpStatus.NOT_FOUND, MediaType.APPLICATION_JSON_VALUE,
            "{\"error\":\"Task not found\"}");

        StepVerifier.create(client.getTask("gone"))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.TASK_NOT_FOUND)
                && ge.getHttpStatus() == 404)
            .verify();
    }

    @Test
    void streamSuggestions_decodesServerSentEvents() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM_VALUE,
            "data: {\"type\":\"section\",\"section\":\"suggestion\",\"data\":{\"lemma\":\"run\"}}\n\n"
                + "data: {\"type\":\"complete\",\"data\":{},\"tokensUsed\":5}\n\n");

        StepVerifier.create(client.streamSuggestions("prompt", null))
            .expectNextMatches(event -> event instanceof StreamEvent.Section section
                && "run".equals(section.data().path("lemma").asText()))
            .expectNextMatches(event -> event instanceof StreamEvent.Complete complete && complete.tokensUsed() == 5)
            .verifyComplete();
        assertTrue(requests.get(0).url().getPath().endsWith("/generate-suggestions-stream"));
    }

    @Test
    void isConfigured_readsStatusFlag() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"configured\":true}");

        StepVerifier.create(client.isConfigured())
            .expectNext(true)
            .verifyComplete();
    }

    @Test
    void isConfigured_isFalse_whenStatusCheckFails() {
        GenerationApiClient client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR, MediaType.APPLICATION_JSON_VALUE, "{}");

        StepVerifier.create(client.isConfigured())
            .expectNext(false)
            .verifyComplete();
    }

    @Test
    void splitParagraphs_postsBothTexts_andIndexesReturnedParagraphs() {
        properties.getGeneration().setParagraphSplitUrl("http://translate.test/api/translate/split-paragraphs");
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE,
            "{\"paragraphs\":[{\"originalText\":\"Un.\",\"translatedText\":\"One.\"},"
                + "{\"originalText\":\"Deux.\",\"translatedText\":\"Two.\"}]}");

        StepVerifier.create(client.splitParagraphs(new TranslationResult("Un. Deux.", "One. Two.", "fr", "en")))
            .expectNext(List.of(new Paragraph("Un.", "One.", 0), new Paragraph("Deux.", "Two.", 1)))
            .verifyComplete();

        assertEquals("translate.test", requests.get(0).url().getHost());
        assertEquals("/api/translate/split-paragraphs", requests.get(0).url().getPath());
    }

    @Test
    void splitParagraphs_failsAsMalformed_whenParagraphsAreMissing() {
        GenerationApiClient client = clientAnswering(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"result\":[]}");

        StepVerifier.create(client.splitParagraphs(new TranslationResult("a", "b", "fr", "en")))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.MALFORMED_RESPONSE))
            .verify();
    }
}
