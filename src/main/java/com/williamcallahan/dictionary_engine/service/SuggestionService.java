/**
 * Native-language search returning candidate target-language words
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves through FallbackChain: cache, exact bundled match, streamed generation, substring static match
 * - Generated candidates arrive one SSE section at a time; each new lemma grows the emitted list
 * - Bundled hits answer immediately while a deduplicated background refresh merges generated candidates
 *   into the cache and enriches the merged list
 * - Lists are deduplicated by lemma (case-insensitive) and capped at the configured maximum
 * - Generated lists are enriched with usage hints in the background
 */

package com.williamcallahan.dictionary_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.SuggestionItem;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.service.dataset.BundledDictionary;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import com.williamcallahan.dictionary_engine.types.StreamEvent;
import com.williamcallahan.dictionary_engine.util.ErrorHandlingUtils;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class SuggestionService {

    private final FallbackChain<List<SuggestionItem>> chain;
    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final AppConfigurationProperties.Generation settings;

    public SuggestionService(ResultCache<List<SuggestionItem>> suggestionCache,
                             BundledDictionary dictionary,
                             GenerationApiClient apiClient,
                             PromptFactory prompts,
                             UsageHintEnrichmentService usageHintEnrichment,
                             ObjectMapper objectMapper,
                             AppConfigurationProperties properties,
                             MetricsService metricsService) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.settings = properties.getGeneration();
        RequestDeduplicator<CacheKey, LookupUpdate<List<SuggestionItem>>> deduplicator =
            new RequestDeduplicator<>("suggestions", properties.getDedup().isAbortOnLastCancel(), metricsService);
        this.chain = new FallbackChain<>(
            "suggestions",
            suggestionCache,
            dictionary::findSuggestions,
            this::generate,
            dictionary::findStaticSuggestions,
            deduplicator,
            apiClient::isConfigured,
            usageHintEnrichment,
            metricsService);
    }

    /**
     * Streams the growing candidate list for {@code query}; the last update is done.
     *
     * @param query search text in the learner's native language
     * @param targetLanguage language of the candidates
     * @return progressive updates, or LookupNotFoundException when nothing matches
     */
    public Flux<LookupUpdate<List<SuggestionItem>>> search(String query, String targetLanguage) {
        return Mono.fromCallable(() -> keyFor(query, targetLanguage))
            .flatMapMany(key -> chain.resolve(key)
                .doOnNext(update -> {
                    if (update.done() && update.source() == ResultSource.LOCAL_DATASET) {
                        refreshInBackground(key);
                    }
                }));
    }

    /**
     * Keeps the first occurrence of each lemma, primary items first, at most {@code max} items
     */
    static List<SuggestionItem> mergeSuggestions(List<SuggestionItem> primary, List<SuggestionItem> secondary, int max) {
        List<SuggestionItem> merged = new ArrayList<>();
        for (List<SuggestionItem> source : List.of(primary, secondary)) {
            for (SuggestionItem item : source) {
                if (merged.size() >= max) {
                    return merged;
                }
                if (item.lemma() != null && merged.stream().noneMatch(item::sameLemma)) {
                    merged.add(item);
                }
            }
        }
        return merged;
    }

    private CacheKey keyFor(String query, String targetLanguage) {
        String normalized = CacheKey.normalizeQuery(query);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        if (normalized.length() > settings.getMaxQueryLength()) {
            throw new IllegalArgumentException("Search query must be at most " + settings.getMaxQueryLength() + " characters");
        }
        return CacheKey.of(query, targetLanguage);
    }

    private Flux<LookupUpdate<List<SuggestionItem>>> generate(CacheKey key) {
        return Flux.defer(() -> {
            SuggestionState state = new SuggestionState();
            ExternalApiLogger.logApiCallAttempt(log, "suggestions stream", key.normalizedQuery());
            return apiClient.streamSuggestions(
                    prompts.suggestions(key.normalizedQuery(), key.targetLanguage(), settings.getNativeLanguage()),
                    apiClient.defaultModelConfig())
                .takeUntilOther(Mono.delay(settings.getSuggestionTimeout()).doOnNext(tick -> state.timedOut = true))
                .concatMap(event -> onEvent(state, event))
                .concatWith(Mono.defer(() -> finish(state, key)));
        });
    }

    private Mono<LookupUpdate<List<SuggestionItem>>> onEvent(SuggestionState state, StreamEvent event) {
        if (event instanceof StreamEvent.Section section) {
            if (!addAll(state, section.data())) {
                return Mono.empty();
            }
            ExternalApiLogger.logStreamProgress(log, "suggestions stream", state.items.size());
            int progress = Math.min(90, state.items.size() * 100 / settings.getMaxSuggestions());
            return Mono.just(LookupUpdate.partial(progress, List.copyOf(state.items), ResultSource.REMOTE));
        }
        if (event instanceof StreamEvent.Complete complete) {
            JsonNode data = complete.data();
            addAll(state, data != null && data.has("items") ? data.get("items") : data);
            state.complete = true;
            return Mono.empty();
        }
        if (event instanceof StreamEvent.Error error) {
            return Mono.error(new GenerationException(ErrorClassification.GENERATION_FAILED, error.message()));
        }
        return Mono.empty();
    }

    private Mono<LookupUpdate<List<SuggestionItem>>> finish(SuggestionState state, CacheKey key) {
        if (state.items.isEmpty()) {
            ErrorClassification classification = state.timedOut
                ? ErrorClassification.TIMEOUT
                : ErrorClassification.GENERATION_FAILED;
            return Mono.error(new GenerationException(classification,
                "No suggestions generated for '" + key + "'" + (state.timedOut ? " before the timeout" : "")));
        }
        if (state.timedOut) {
            log.info("Suggestion stream for {} timed out, keeping {} candidates", key, state.items.size());
        } else if (!state.complete) {
            log.debug("Suggestion stream for {} ended without a complete event", key);
        }
        return Mono.just(LookupUpdate.done(List.copyOf(state.items), ResultSource.REMOTE, List.of()));
    }

    // Accepts a single item or an array of items; returns whether the list grew
    private boolean addAll(SuggestionState state, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        boolean grew = false;
        Iterable<JsonNode> candidates = node.isArray() ? node : List.of(node);
        for (JsonNode candidate : candidates) {
            if (state.items.size() >= settings.getMaxSuggestions()) {
                break;
            }
            SuggestionItem item = toItem(candidate);
            if (item != null && item.lemma() != null && state.items.stream().noneMatch(item::sameLemma)) {
                state.items.add(item);
                grew = true;
            }
        }
        return grew;
    }

    private SuggestionItem toItem(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, SuggestionItem.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed suggestion item: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void refreshInBackground(CacheKey key) {
        chain.refresh(key, (generated, existing) -> mergeSuggestions(generated, existing, settings.getMaxSuggestions()))
            .subscribe(
                updated -> updated.ifPresent(items -> log.debug("Merged generated suggestions into {} ({} items)", key, items.size())),
                error -> ErrorHandlingUtils.logFallThrough(log, "suggestion refresh for '" + key + "'", error, metricsService));
    }

    private static final class SuggestionState {
        private final List<SuggestionItem> items = new ArrayList<>();
        private volatile boolean timedOut;
        private boolean complete;
    }
}
