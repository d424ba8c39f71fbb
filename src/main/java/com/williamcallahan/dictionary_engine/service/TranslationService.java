package com.williamcallahan.dictionary_engine.service;

import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.model.Paragraph;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Free-text translation through the cache and the remote generator.
 * There is no offline tier, so an unavailable or failing backend ends in LookupNotFoundException.
 * Results are keyed by the normalized text and the {@code source>target} language pair.
 * Finished translations can also be returned as aligned paragraph pairs.
 */
@Service
@Slf4j
public class TranslationService {

    private final FallbackChain<TranslationResult> chain;
    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final ParagraphSplitter paragraphSplitter;
    private final int maxLength;

    public TranslationService(ResultCache<TranslationResult> translationCache,
                              GenerationApiClient apiClient,
                              PromptFactory prompts,
                              ParagraphSplitter paragraphSplitter,
                              AppConfigurationProperties properties,
                              MetricsService metricsService) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.paragraphSplitter = paragraphSplitter;
        this.maxLength = properties.getGeneration().getMaxTranslationLength();
        RequestDeduplicator<CacheKey, LookupUpdate<TranslationResult>> deduplicator =
            new RequestDeduplicator<>("translation", properties.getDedup().isAbortOnLastCancel(), metricsService);
        this.chain = new FallbackChain<>(
            "translation",
            translationCache,
            null,
            null,
            null,
            deduplicator,
            apiClient::isConfigured,
            null,
            metricsService);
    }

    public Mono<TranslationResult> translate(String text, String sourceLanguage, String targetLanguage) {
        return Mono.fromCallable(() -> {
                validate(text);
                return CacheKey.of(text, languagePair(sourceLanguage, targetLanguage));
            })
            .flatMap(key -> chain.resolveFinal(key, cacheKey -> generate(text, sourceLanguage, targetLanguage)))
            .map(LookupUpdate::value);
    }

    /**
     * Translates {@code text} and aligns the result into paragraph pairs
     */
    public Mono<List<Paragraph>> translateParagraphs(String text, String sourceLanguage, String targetLanguage) {
        return translate(text, sourceLanguage, targetLanguage).flatMap(paragraphSplitter::split);
    }

    static String languagePair(String sourceLanguage, String targetLanguage) {
        return normalizeLanguage(sourceLanguage) + ">" + normalizeLanguage(targetLanguage);
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to translate must not be blank");
        }
        if (text.length() > maxLength) {
            throw new IllegalArgumentException("Text to translate must be at most " + maxLength + " characters");
        }
    }

    private Flux<LookupUpdate<TranslationResult>> generate(String text, String sourceLanguage, String targetLanguage) {
        ExternalApiLogger.logApiCallAttempt(log, "translate", sourceLanguage + ">" + targetLanguage);
        return apiClient.generateText(prompts.translation(text.trim(), sourceLanguage, targetLanguage), apiClient.defaultModelConfig())
            .map(String::trim)
            .flatMap(translated -> translated.isEmpty()
                ? Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE, "Empty translation returned"))
                : Mono.just(translated))
            .map(translated -> LookupUpdate.done(
                new TranslationResult(text, translated, normalizeLanguage(sourceLanguage), normalizeLanguage(targetLanguage)),
                ResultSource.REMOTE,
                List.of()))
            .flux();
    }

    private static String normalizeLanguage(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }
}
