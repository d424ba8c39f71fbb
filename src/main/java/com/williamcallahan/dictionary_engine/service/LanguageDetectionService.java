/**
 * Detects which language a single word belongs to
 *
 * @author William Callahan
 *
 * Features:
 * - Script check first: kana means Japanese, kanji without kana means Chinese
 * - Otherwise the remote generator picks one of the caller's candidate languages
 * - Detections are cached in their own namespace, keyed by word and candidate set
 * - Concurrent detections of the same word share one remote request
 * - An undetectable word yields an empty result instead of an error
 */

package com.williamcallahan.dictionary_engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.exception.LookupNotFoundException;
import com.williamcallahan.dictionary_engine.model.LanguageDetection;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@Slf4j
public class LanguageDetectionService {

    private static final String CANDIDATE_SEPARATOR = ",";

    private final FallbackChain<LanguageDetection> chain;
    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final List<String> defaultCandidates;
    private final int maxQueryLength;

    public LanguageDetectionService(ResultCache<LanguageDetection> languageDetectionCache,
                                    GenerationApiClient apiClient,
                                    PromptFactory prompts,
                                    AppConfigurationProperties properties,
                                    MetricsService metricsService) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.defaultCandidates = properties.getGeneration().getDetectionCandidates();
        this.maxQueryLength = properties.getGeneration().getMaxQueryLength();
        RequestDeduplicator<CacheKey, LookupUpdate<LanguageDetection>> deduplicator =
            new RequestDeduplicator<>("language-detection", properties.getDedup().isAbortOnLastCancel(), metricsService);
        this.chain = new FallbackChain<>(
            "language-detection",
            languageDetectionCache,
            key -> detectByScript(key.normalizedQuery()),
            this::generate,
            null,
            deduplicator,
            apiClient::isConfigured,
            null,
            metricsService);
    }

    public Mono<LanguageDetection> detect(String word) {
        return detect(word, defaultCandidates);
    }

    /**
     * @param word single word to classify
     * @param candidates language codes the answer must come from
     * @return the detection, or empty when neither the script nor the generator settles it
     */
    public Mono<LanguageDetection> detect(String word, List<String> candidates) {
        return Mono.fromCallable(() -> keyFor(word, candidates))
            .flatMap(chain::resolveFinal)
            .map(LookupUpdate::value)
            .onErrorResume(LookupNotFoundException.class, e -> {
                log.info("Could not detect the language of '{}'", word);
                return Mono.empty();
            });
    }

    /**
     * Kana anywhere means Japanese; kanji without kana means Chinese
     */
    static Optional<LanguageDetection> detectByScript(String word) {
        boolean kana = word.codePoints().anyMatch(LanguageDetectionService::isKana);
        if (kana) {
            return Optional.of(new LanguageDetection("ja", 1.0));
        }
        boolean kanji = word.codePoints()
            .anyMatch(codePoint -> Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN);
        if (kanji) {
            return Optional.of(new LanguageDetection("zh", 1.0));
        }
        return Optional.empty();
    }

    private static boolean isKana(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HIRAGANA || script == Character.UnicodeScript.KATAKANA;
    }

    private CacheKey keyFor(String word, List<String> candidates) {
        String normalized = CacheKey.normalizeQuery(word);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Word must not be blank");
        }
        if (normalized.length() > maxQueryLength) {
            throw new IllegalArgumentException("Word must be at most " + maxQueryLength + " characters");
        }
        List<String> normalizedCandidates = candidates == null ? List.of() : candidates.stream()
            .filter(candidate -> candidate != null && !candidate.isBlank())
            .map(candidate -> candidate.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .sorted()
            .toList();
        if (normalizedCandidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate language is required");
        }
        return CacheKey.of(word, String.join(CANDIDATE_SEPARATOR, normalizedCandidates));
    }

    private Flux<LookupUpdate<LanguageDetection>> generate(CacheKey key) {
        List<String> candidates = Arrays.asList(key.targetLanguage().split(CANDIDATE_SEPARATOR));
        return apiClient.generateJson(prompts.languageDetection(key.normalizedQuery(), candidates), apiClient.defaultModelConfig())
            .flatMap(result -> {
                JsonNode data = result.data();
                String language = data.path("language").asText("").trim().toLowerCase(Locale.ROOT);
                if (!candidates.contains(language)) {
                    return Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                        "Detected language '" + language + "' is not one of " + candidates));
                }
                double confidence = Math.max(0.0, Math.min(1.0, data.path("confidence").asDouble(0.0)));
                return Mono.just(LookupUpdate.done(new LanguageDetection(language, confidence), ResultSource.REMOTE, List.of()));
            })
            .flux();
    }
}
