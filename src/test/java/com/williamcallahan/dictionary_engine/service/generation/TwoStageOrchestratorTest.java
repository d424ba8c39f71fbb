/**
 * Test suite for TwoStageOrchestrator
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationResult;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TwoStageOrchestratorTest {

    @Mock
    private GenerationApiClient apiClient;

    @Mock
    private DetailedStage detailedStage;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TwoStageOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new TwoStageOrchestrator(apiClient, new PromptFactory(), new PartialMerger(), detailedStage);
    }

    private ObjectNode json(String text) throws JsonProcessingException {
        return (ObjectNode) objectMapper.readTree(text);
    }

    @Test
    void fetch_surfacesBasicFirst_thenRescaledDetail_thenMergedResult() throws Exception {
        ObjectNode basic = json("{\"headword\":{\"lemma\":\"run\",\"lang\":\"en\"},\"senses\":[{\"id\":\"1\",\"glossShort\":\"走る\"}]}");
        // stubs answer lazily so delays are assembled on the virtual clock
        when(apiClient.generateJson(anyString(), any()))
            .thenAnswer(invocation -> Mono.just(new GenerationResult(basic, 10)).delayElement(Duration.ofMillis(250)));
        when(detailedStage.run(eq("run"), eq("en"), eq("ja"))).thenAnswer(invocation -> Flux.concat(
            Mono.just(GenerationUpdate.progress(29, json("{\"hint\":{\"text\":\"h\"}}"))).delayElement(Duration.ofMillis(500)),
            Mono.just(GenerationUpdate.progress(57, json("{\"hint\":{\"text\":\"h\"},\"metrics\":{\"frequency\":90}}"))).delayElement(Duration.ofMillis(500)),
            Mono.just(GenerationUpdate.completed(json("{\"hint\":{\"text\":\"h\"},\"metrics\":{\"frequency\":90},"
                + "\"examples\":[{\"textSrc\":\"I run.\",\"textDst\":\"走る。\"}],\"senses\":[]}"), 20))
                .delayElement(Duration.ofMillis(500))));

        List<GenerationUpdate> updates = new ArrayList<>();
        StepVerifier.withVirtualTime(() -> orchestrator.fetch("run", "en", "ja"))
            .thenAwait(Duration.ofSeconds(3))
            .recordWith(() -> updates)
            .thenConsumeWhile(update -> true)
            .verifyComplete();

        assertEquals(List.of(30, 50, 70, 100), updates.stream().map(GenerationUpdate::progress).toList());
        assertEquals("run", updates.get(0).data().path("headword").path("lemma").asText());
        assertTrue(updates.get(1).data().has("senses"), "detail updates keep the basic fields");

        GenerationUpdate last = updates.get(3);
        assertTrue(last.done());
        assertEquals(30, last.tokensUsed());
        assertEquals(1, last.data().path("senses").size(), "empty senses from the detailed stage keep basic senses");
        assertEquals("I run.", last.data().path("examples").get(0).path("textSrc").asText());
        assertEquals(90, last.data().path("metrics").path("frequency").asInt());
    }

    @Test
    void fetch_neverLetsProgressGoBackwards_whenDetailArrivesBeforeBasic() throws Exception {
        ObjectNode basic = json("{\"headword\":{\"lemma\":\"walk\"}}");
        when(apiClient.generateJson(anyString(), any()))
            .thenAnswer(invocation -> Mono.just(new GenerationResult(basic, 1)).delayElement(Duration.ofSeconds(2)));
        when(detailedStage.run(anyString(), anyString(), anyString())).thenAnswer(invocation ->
            Mono.just(GenerationUpdate.progress(57, json("{\"metrics\":{\"frequency\":1}}"))).delayElement(Duration.ofSeconds(1)).flux());

        List<GenerationUpdate> updates = new ArrayList<>();
        StepVerifier.withVirtualTime(() -> orchestrator.fetch("walk", "en", "ja"))
            .thenAwait(Duration.ofSeconds(3))
            .recordWith(() -> updates)
            .thenConsumeWhile(update -> true)
            .verifyComplete();

        List<Integer> progress = updates.stream().map(GenerationUpdate::progress).toList();
        assertEquals(List.of(70, 70, 100), progress);
        assertTrue(updates.get(2).data().has("metrics"));
    }

    @Test
    void fetch_degradesToBasicAndPartialDetail_whenDetailedStageFails() throws Exception {
        ObjectNode basic = json("{\"headword\":{\"lemma\":\"run\"},\"senses\":[{\"id\":\"1\",\"glossShort\":\"走る\"}]}");
        when(apiClient.generateJson(anyString(), any())).thenReturn(Mono.just(new GenerationResult(basic, 5)));
        when(detailedStage.run(anyString(), anyString(), anyString())).thenReturn(Flux.concat(
            Mono.just(GenerationUpdate.progress(29, json("{\"hint\":{\"text\":\"partial hint\"}}"))),
            Mono.error(new GenerationException(ErrorClassification.TASK_NOT_FOUND, "evicted"))));

        StepVerifier.create(orchestrator.fetch("run", "en", "ja").last())
            .expectNextMatches(update -> update.done()
                && "run".equals(update.data().path("headword").path("lemma").asText())
                && "partial hint".equals(update.data().path("hint").path("text").asText()))
            .verifyComplete();
    }

    @Test
    void fetch_fails_whenBasicStageFails() {
        when(apiClient.generateJson(anyString(), any()))
            .thenReturn(Mono.error(new GenerationException(ErrorClassification.RATE_LIMITED, "429")));
        when(detailedStage.run(anyString(), anyString(), anyString())).thenReturn(Flux.never());

        StepVerifier.create(orchestrator.fetch("run", "en", "ja"))
            .expectErrorMatches(error -> error instanceof GenerationException ge && ge.is(ErrorClassification.RATE_LIMITED))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void fetch_rejectsNonObjectBasicPayload() {
        when(apiClient.generateJson(anyString(), any()))
            .thenReturn(Mono.just(new GenerationResult(objectMapper.createArrayNode(), 0)));
        when(detailedStage.run(anyString(), anyString(), anyString())).thenReturn(Flux.empty());

        StepVerifier.create(orchestrator.fetch("run", "en", "ja"))
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.MALFORMED_RESPONSE))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void rescaleDetailed_mapsOntoRemainingRange() {
        assertEquals(30, TwoStageOrchestrator.rescaleDetailed(0));
        assertEquals(50, TwoStageOrchestrator.rescaleDetailed(29));
        assertEquals(70, TwoStageOrchestrator.rescaleDetailed(57));
        assertEquals(90, TwoStageOrchestrator.rescaleDetailed(86));
        assertEquals(100, TwoStageOrchestrator.rescaleDetailed(100));
        assertEquals(100, TwoStageOrchestrator.rescaleDetailed(140));
        assertFalse(TwoStageOrchestrator.rescaleDetailed(-5) < 30);
    }
}
