package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StreamingDetailedStageTest {

    @Mock
    private GenerationApiClient apiClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StreamingDetailedStage stage;

    @BeforeEach
    void setUp() {
        stage = new StreamingDetailedStage(apiClient, new PromptFactory(), new PartialMerger());
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void run_mapsEachSectionToFixedProgress_andFinishesWithMergedDocument() throws Exception {
        when(apiClient.streamAdditional(anyString(), any())).thenReturn(Flux.just(
            new StreamEvent.Section("hint", json("{\"text\":\"よく使う\"}")),
            new StreamEvent.Chunk("ignored text"),
            new StreamEvent.Section("metrics", json("{\"frequency\":80}")),
            new StreamEvent.Section("examples", json("[{\"textSrc\":\"I run.\"}]")),
            new StreamEvent.Complete(json("{}"), 33)));

        List<GenerationUpdate> updates = new ArrayList<>();
        StepVerifier.create(stage.run("run", "en", "ja"))
            .recordWith(() -> updates)
            .thenConsumeWhile(update -> true)
            .verifyComplete();

        assertEquals(List.of(29, 57, 86, 100), updates.stream().map(GenerationUpdate::progress).toList());
        GenerationUpdate last = updates.get(3);
        assertTrue(last.done());
        assertEquals(33, last.tokensUsed());
        assertEquals("よく使う", last.data().path("hint").path("text").asText());
        assertEquals(80, last.data().path("metrics").path("frequency").asInt());
        assertEquals("I run.", last.data().path("examples").get(0).path("textSrc").asText());
    }

    @Test
    void run_completesWithAccumulatedSections_whenStreamEndsWithoutTerminalEvent() throws Exception {
        when(apiClient.streamAdditional(anyString(), any())).thenReturn(Flux.just(
            new StreamEvent.Section("hint", json("{\"text\":\"h\"}"))));

        StepVerifier.create(stage.run("run", "en", "ja"))
            .expectNextMatches(update -> update.progress() == 29 && !update.done())
            .expectNextMatches(update -> update.done()
                && update.progress() == 100
                && "h".equals(update.data().path("hint").path("text").asText()))
            .verifyComplete();
    }

    @Test
    void run_neverLowersProgress_forUnknownOrRepeatedSections() throws Exception {
        when(apiClient.streamAdditional(anyString(), any())).thenReturn(Flux.just(
            new StreamEvent.Section("metrics", json("{\"frequency\":1}")),
            new StreamEvent.Section("hint", json("{\"text\":\"late\"}")),
            new StreamEvent.Section("etymology", json("{\"origin\":\"x\"}"))));

        StepVerifier.create(stage.run("run", "en", "ja").map(GenerationUpdate::progress))
            .expectNext(57, 57, 57, 100)
            .verifyComplete();
    }

    @Test
    void run_failsWithGenerationFailed_onErrorEvent() throws Exception {
        when(apiClient.streamAdditional(anyString(), any())).thenReturn(Flux.just(
            new StreamEvent.Section("hint", json("{\"text\":\"h\"}")),
            new StreamEvent.Error("quota exceeded")));

        StepVerifier.create(stage.run("run", "en", "ja"))
            .expectNextMatches(update -> update.progress() == 29)
            .expectErrorMatches(error -> error instanceof GenerationException ge
                && ge.is(ErrorClassification.GENERATION_FAILED)
                && "quota exceeded".equals(ge.getMessage()))
            .verify();
    }
}
