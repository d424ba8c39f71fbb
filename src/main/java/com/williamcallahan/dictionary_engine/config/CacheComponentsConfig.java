/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - Selecting the durable store behind every ResultCache (local disk or none)
 * - One ResultCache per content type, each in its own namespace
 * - The Spring CacheManager backing @Cacheable (backend status check)
 * - The Clock used for TTL decisions
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.config;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.dictionary_engine.model.LanguageDetection;
import com.williamcallahan.dictionary_engine.model.SuggestionItem;
import com.williamcallahan.dictionary_engine.model.TranslationResult;
import com.williamcallahan.dictionary_engine.model.WordDetail;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.DurableResultStore;
import com.williamcallahan.dictionary_engine.service.cache.LocalDiskResultStore;
import com.williamcallahan.dictionary_engine.service.cache.NoOpResultStore;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

@Configuration
public class CacheComponentsConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheComponentsConfig.class);

    public static final String WORD_DETAIL_NAMESPACE = "word-detail";
    public static final String SUGGESTIONS_NAMESPACE = "suggestions";
    public static final String TRANSLATION_NAMESPACE = "translation";
    public static final String LANGUAGE_DETECTION_NAMESPACE = "language-detection";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DurableResultStore durableResultStore(AppConfigurationProperties properties,
                                                 @Qualifier("cacheIoExecutor") Executor cacheIoExecutor) {
        AppConfigurationProperties.Cache cache = properties.getCache();
        if (cache.getDurableStore() == AppConfigurationProperties.Cache.DurableStore.NONE) {
            logger.info("Durable result store disabled; results live in memory only");
            return new NoOpResultStore();
        }
        Path directory = Path.of(cache.getDirectory());
        logger.info("Durable result store at {}", directory.toAbsolutePath());
        return new LocalDiskResultStore(directory, cacheIoExecutor);
    }

    @Bean
    public ResultCache<WordDetail> wordDetailCache(DurableResultStore store, ObjectMapper objectMapper,
                                                   AppConfigurationProperties properties, Clock clock,
                                                   MetricsService metricsService) {
        JavaType type = objectMapper.getTypeFactory().constructType(WordDetail.class);
        return newCache(WORD_DETAIL_NAMESPACE, type, store, objectMapper, properties, clock, metricsService);
    }

    @Bean
    public ResultCache<List<SuggestionItem>> suggestionCache(DurableResultStore store, ObjectMapper objectMapper,
                                                             AppConfigurationProperties properties, Clock clock,
                                                             MetricsService metricsService) {
        JavaType type = objectMapper.getTypeFactory().constructCollectionType(List.class, SuggestionItem.class);
        return newCache(SUGGESTIONS_NAMESPACE, type, store, objectMapper, properties, clock, metricsService);
    }

    @Bean
    public ResultCache<TranslationResult> translationCache(DurableResultStore store, ObjectMapper objectMapper,
                                                           AppConfigurationProperties properties, Clock clock,
                                                           MetricsService metricsService) {
        JavaType type = objectMapper.getTypeFactory().constructType(TranslationResult.class);
        return newCache(TRANSLATION_NAMESPACE, type, store, objectMapper, properties, clock, metricsService);
    }

    @Bean
    public ResultCache<LanguageDetection> languageDetectionCache(DurableResultStore store, ObjectMapper objectMapper,
                                                                 AppConfigurationProperties properties, Clock clock,
                                                                 MetricsService metricsService) {
        JavaType type = objectMapper.getTypeFactory().constructType(LanguageDetection.class);
        return newCache(LANGUAGE_DETECTION_NAMESPACE, type, store, objectMapper, properties, clock, metricsService);
    }

    @Bean
    @Primary
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(100)
                .expireAfterWrite(Duration.ofSeconds(30))
                .recordStats()); // Enable statistics recording for metrics
        cacheManager.setCacheNames(List.of("generationStatus")); // Set cache names for @Cacheable annotations
        cacheManager.setAsyncCacheMode(true); // Enable async cache mode for reactive methods
        return cacheManager;
    }

    private static <V> ResultCache<V> newCache(String namespace, JavaType valueType, DurableResultStore store,
                                               ObjectMapper objectMapper, AppConfigurationProperties properties,
                                               Clock clock, MetricsService metricsService) {
        AppConfigurationProperties.Cache cache = properties.getCache();
        return new ResultCache<>(namespace, valueType, store, objectMapper, cache.getTtl(),
            cache.getMaximumSize(), clock, metricsService);
    }
}
