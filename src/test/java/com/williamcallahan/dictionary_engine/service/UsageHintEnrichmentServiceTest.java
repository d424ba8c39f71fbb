package com.williamcallahan.dictionary_engine.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.SuggestionItem;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class UsageHintEnrichmentServiceTest {

    private static final CacheKey KEY = CacheKey.of("走る", "en");

    @Mock
    private GenerationApiClient apiClient;

    private UsageHintEnrichmentService service;

    @BeforeEach
    void setUp() {
        service = new UsageHintEnrichmentService(apiClient, new PromptFactory(), Runnable::run, new AppConfigurationProperties());
    }

    private static SuggestionItem item(String lemma, String hint) {
        return new SuggestionItem(lemma, List.of("verb"), List.of("走る"), 0.9, null, hint, null);
    }

    private static Mono<GenerationResult> hint(String text) {
        return Mono.just(new GenerationResult(JsonNodeFactory.instance.objectNode().put("hint", text), 3));
    }

    @Test
    void attachHint_updatesMatchingLemmaOnly() {
        List<SuggestionItem> items = List.of(item("run", null), item("jog", null));

        List<SuggestionItem> updated = UsageHintEnrichmentService.attachHint("RUN", "普通に走る").apply(items);

        assertEquals("普通に走る", updated.get(0).usageHint());
        assertNull(updated.get(1).usageHint());
        assertNull(items.get(0).usageHint(), "input list is left untouched");
    }

    @Test
    void enrichments_requestHintsOnlyForItemsWithoutOne_andSkipFailures() {
        when(apiClient.generateJson(contains("\"run\""), any())).thenReturn(hint("一般的"));
        when(apiClient.generateJson(contains("\"jog\""), any()))
            .thenReturn(Mono.error(new GenerationException(ErrorClassification.RATE_LIMITED, "429")));
        when(apiClient.generateJson(contains("\"sprint\""), any())).thenReturn(hint(" "));

        List<UnaryOperator<List<SuggestionItem>>> transforms = service.enrichments(KEY,
                List.of(item("run", null), item("jog", null), item("sprint", null), item("dash", "既存")))
            .collectList()
            .block(Duration.ofSeconds(5));

        assertEquals(1, transforms.size(), "failed and blank hints produce no transform");
        List<SuggestionItem> applied = transforms.get(0).apply(List.of(item("run", null), item("dash", "既存")));
        assertEquals("一般的", applied.get(0).usageHint());
        assertEquals("既存", applied.get(1).usageHint());
        verify(apiClient, never()).generateJson(contains("\"dash\""), any());
    }

    @Test
    void enrichments_isEmpty_whenEveryItemHasHint() {
        assertEquals(0L, service.enrichments(KEY, List.of(item("run", "h"))).count().block());
        verify(apiClient, never()).generateJson(anyString(), any());
    }
}
