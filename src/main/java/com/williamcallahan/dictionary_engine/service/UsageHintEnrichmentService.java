/**
 * Background usage-hint enrichment for generated suggestion lists
 *
 * @author William Callahan
 *
 * Features:
 * - One usage-hint request per suggestion lacking a hint, run in parallel on the enrichment executor
 * - Each finished hint becomes a transform applied through ResultCache.update, so hints landing
 *   at the same time never overwrite each other
 * - A failing hint is logged and skipped; the remaining hints still land
 */

package com.williamcallahan.dictionary_engine.service;

import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.model.SuggestionItem;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.generation.GenerationApiClient;
import com.williamcallahan.dictionary_engine.service.generation.PromptFactory;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Usage-hint enricher plugged into the suggestion FallbackChain
 */
@Component
public class UsageHintEnrichmentService implements FallbackChain.Enricher<List<SuggestionItem>> {

    private static final Logger logger = LoggerFactory.getLogger(UsageHintEnrichmentService.class);

    private final GenerationApiClient apiClient;
    private final PromptFactory prompts;
    private final Scheduler scheduler;
    private final int concurrency;
    private final String nativeLanguage;

    public UsageHintEnrichmentService(GenerationApiClient apiClient,
                                      PromptFactory prompts,
                                      @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
                                      AppConfigurationProperties properties) {
        this.apiClient = apiClient;
        this.prompts = prompts;
        this.scheduler = Schedulers.fromExecutor(enrichmentExecutor);
        this.concurrency = Math.max(1, properties.getGeneration().getEnrichmentConcurrency());
        this.nativeLanguage = properties.getGeneration().getNativeLanguage();
    }

    @Override
    public Flux<UnaryOperator<List<SuggestionItem>>> enrichments(CacheKey key, List<SuggestionItem> items) {
        List<SuggestionItem> pending = items.stream()
            .filter(item -> item.lemma() != null && item.usageHint() == null)
            .collect(Collectors.toList());
        if (pending.isEmpty()) {
            return Flux.empty();
        }
        logger.debug("Enriching {} suggestions for {} with usage hints", pending.size(), key);
        return Flux.fromIterable(pending)
            .flatMap(item -> fetchHint(key, item)
                .map(hint -> attachHint(item.lemma(), hint)), concurrency)
            .subscribeOn(scheduler);
    }

    private Mono<String> fetchHint(CacheKey key, SuggestionItem item) {
        return apiClient.generateJson(prompts.usageHint(item.lemma(), key.normalizedQuery(), nativeLanguage),
                apiClient.defaultModelConfig())
            .map(result -> result.data().path("hint").asText(""))
            .filter(hint -> !hint.isBlank())
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(logger, "usage hint", item.lemma(), e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Replaces the hint of every item whose lemma matches, leaving the rest of the list untouched
     */
    static UnaryOperator<List<SuggestionItem>> attachHint(String lemma, String hint) {
        return current -> current.stream()
            .map(item -> lemma.equalsIgnoreCase(item.lemma()) ? item.withUsageHint(hint) : item)
            .collect(Collectors.toList());
    }
}
