/**
 * Dictionary entry lookups for a single headword
 *
 * @author William Callahan
 *
 * Features:
 * - Resolves through FallbackChain: cache, bundled dictionary, two-stage generation, static fallback
 * - Streams progressive entries while the two-stage generation runs
 * - A generated entry without a headword lemma is rejected as a malformed response
 * - Typo suggestions from the bundled dictionary when a lookup comes back empty
 */

package com.williamcallahan.dictionary_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.WordDetail;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.service.dataset.BundledDictionary;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.TwoStageOrchestrator;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.GenerationUpdate;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class WordDetailService {

    private static final int MAX_TYPO_SUGGESTIONS = 3;

    private final FallbackChain<WordDetail> chain;
    private final TwoStageOrchestrator orchestrator;
    private final BundledDictionary dictionary;
    private final ObjectMapper objectMapper;
    private final AppConfigurationProperties.Generation settings;

    public WordDetailService(TwoStageOrchestrator orchestrator,
                             ResultCache<WordDetail> wordDetailCache,
                             BundledDictionary dictionary,
                             GenerationApiClient apiClient,
                             ObjectMapper objectMapper,
                             AppConfigurationProperties properties,
                             MetricsService metricsService) {
        this.orchestrator = orchestrator;
        this.dictionary = dictionary;
        this.objectMapper = objectMapper;
        this.settings = properties.getGeneration();
        RequestDeduplicator<CacheKey, LookupUpdate<WordDetail>> deduplicator =
            new RequestDeduplicator<>("word-detail", properties.getDedup().isAbortOnLastCancel(), metricsService);
        this.chain = new FallbackChain<>(
            "word-detail",
            wordDetailCache,
            dictionary::findWordDetail,
            this::generate,
            dictionary::findStaticWordDetail,
            deduplicator,
            apiClient::isConfigured,
            null,
            metricsService);
    }

    /**
     * Streams progressive entries for {@code word}; the last update is done.
     *
     * @param word headword in the target language
     * @param targetLanguage language of the headword
     * @return progressive updates, or LookupNotFoundException when no source knows the word
     */
    public Flux<LookupUpdate<WordDetail>> lookup(String word, String targetLanguage) {
        return Mono.fromCallable(() -> keyFor(word, targetLanguage))
            .flatMapMany(chain::resolve);
    }

    /**
     * Final entry only
     */
    public Mono<WordDetail> lookupFinal(String word, String targetLanguage) {
        return Mono.fromCallable(() -> keyFor(word, targetLanguage))
            .flatMap(chain::resolveFinal)
            .map(LookupUpdate::value);
    }

    /**
     * Bundled headwords sharing the first letter of {@code word}, excluding the word itself
     */
    public List<String> typoSuggestions(String word, String targetLanguage) {
        String normalized = CacheKey.normalizeQuery(word);
        if (normalized.isEmpty()) {
            return List.of();
        }
        char first = normalized.charAt(0);
        return dictionary.headwords(CacheKey.of(word, targetLanguage).targetLanguage()).stream()
            .filter(headword -> !headword.isEmpty() && headword.charAt(0) == first && !headword.equals(normalized))
            .limit(MAX_TYPO_SUGGESTIONS)
            .collect(Collectors.toList());
    }

    private CacheKey keyFor(String word, String targetLanguage) {
        String normalized = CacheKey.normalizeQuery(word);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Word must not be blank");
        }
        if (normalized.length() > settings.getMaxQueryLength()) {
            throw new IllegalArgumentException("Word must be at most " + settings.getMaxQueryLength() + " characters");
        }
        return CacheKey.of(word, targetLanguage);
    }

    private Flux<LookupUpdate<WordDetail>> generate(CacheKey key) {
        return orchestrator.fetch(key.normalizedQuery(), key.targetLanguage(), settings.getNativeLanguage())
            .concatMap(update -> toLookupUpdate(key, update));
    }

    private Mono<LookupUpdate<WordDetail>> toLookupUpdate(CacheKey key, GenerationUpdate update) {
        return Mono.fromCallable(() -> toWordDetail(update.data()))
            .flatMap(detail -> {
                if (!update.done()) {
                    return Mono.just(LookupUpdate.partial(update.progress(), detail, ResultSource.REMOTE));
                }
                if (!detail.hasLemma()) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "Generated entry for '" + key + "' has no headword lemma"));
                }
                return Mono.just(LookupUpdate.done(detail, ResultSource.REMOTE, List.of()));
            });
    }

    private WordDetail toWordDetail(ObjectNode data) {
        try {
            return objectMapper.treeToValue(data, WordDetail.class);
        } catch (JsonProcessingException e) {
            throw new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                "Generated entry does not match the dictionary shape: " + e.getOriginalMessage(), e);
        }
    }
}
