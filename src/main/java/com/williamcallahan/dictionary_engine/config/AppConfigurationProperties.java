/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.dictionary_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Generation generation = new Generation();

    @NestedConfigurationProperty
    private Poller poller = new Poller();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Dedup dedup = new Dedup();

    @NestedConfigurationProperty
    private Dataset dataset = new Dataset();

    // Getters and setters
    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }

    public Poller getPoller() { return poller; }
    public void setPoller(Poller poller) { this.poller = poller; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }

    public Dataset getDataset() { return dataset; }
    public void setDataset(Dataset dataset) { this.dataset = dataset; }

    // Nested configuration classes
    public static class Generation {
        private String baseUrl = "http://localhost:3000/api/gemini";
        private String provider = "gemini";
        private String model = "gemini-2.5-flash-lite";
        private int maxTokens = 1024;
        private double temperature = 0.1;
        private DetailedMode detailedMode = DetailedMode.POLLING;
        private Duration basicTimeout = Duration.ofSeconds(15);
        private Duration suggestionTimeout = Duration.ofSeconds(10);
        private Duration streamTimeout = Duration.ofSeconds(60);
        private Duration statusTimeout = Duration.ofSeconds(3);
        private int maxSuggestions = 10;
        private String nativeLanguage = "ja";
        private int maxTranslationLength = 4000;
        private int maxQueryLength = 100;
        private int enrichmentConcurrency = 4;
        private String paragraphSplitUrl = "http://localhost:3000/api/translate/split-paragraphs";
        private int paragraphSplitMinLength = 500;
        private List<String> detectionCandidates = List.of("en", "pt", "es", "fr", "de", "it", "zh", "ko", "vi", "id");

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public DetailedMode getDetailedMode() { return detailedMode; }
        public void setDetailedMode(DetailedMode detailedMode) { this.detailedMode = detailedMode; }

        public Duration getBasicTimeout() { return basicTimeout; }
        public void setBasicTimeout(Duration basicTimeout) { this.basicTimeout = basicTimeout; }

        public Duration getSuggestionTimeout() { return suggestionTimeout; }
        public void setSuggestionTimeout(Duration suggestionTimeout) { this.suggestionTimeout = suggestionTimeout; }

        public Duration getStreamTimeout() { return streamTimeout; }
        public void setStreamTimeout(Duration streamTimeout) { this.streamTimeout = streamTimeout; }

        public Duration getStatusTimeout() { return statusTimeout; }
        public void setStatusTimeout(Duration statusTimeout) { this.statusTimeout = statusTimeout; }

        public int getMaxSuggestions() { return maxSuggestions; }
        public void setMaxSuggestions(int maxSuggestions) { this.maxSuggestions = maxSuggestions; }

        public String getNativeLanguage() { return nativeLanguage; }
        public void setNativeLanguage(String nativeLanguage) { this.nativeLanguage = nativeLanguage; }

        public int getMaxTranslationLength() { return maxTranslationLength; }
        public void setMaxTranslationLength(int maxTranslationLength) { this.maxTranslationLength = maxTranslationLength; }

        public int getMaxQueryLength() { return maxQueryLength; }
        public void setMaxQueryLength(int maxQueryLength) { this.maxQueryLength = maxQueryLength; }

        public int getEnrichmentConcurrency() { return enrichmentConcurrency; }
        public void setEnrichmentConcurrency(int enrichmentConcurrency) { this.enrichmentConcurrency = enrichmentConcurrency; }

        public String getParagraphSplitUrl() { return paragraphSplitUrl; }
        public void setParagraphSplitUrl(String paragraphSplitUrl) { this.paragraphSplitUrl = paragraphSplitUrl; }

        public int getParagraphSplitMinLength() { return paragraphSplitMinLength; }
        public void setParagraphSplitMinLength(int paragraphSplitMinLength) { this.paragraphSplitMinLength = paragraphSplitMinLength; }

        public List<String> getDetectionCandidates() { return detectionCandidates; }
        public void setDetectionCandidates(List<String> detectionCandidates) { this.detectionCandidates = detectionCandidates; }

        public enum DetailedMode {
            POLLING,
            STREAMING
        }
    }

    public static class Poller {
        private Duration interval = Duration.ofMillis(500);
        private Duration rateLimitCooldown = Duration.ofSeconds(1);
        private int notFoundHighWaterMark = 75;
        private int notFoundRetryBudget = 3;
        private Duration overallTimeout = Duration.ofSeconds(60);

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getRateLimitCooldown() { return rateLimitCooldown; }
        public void setRateLimitCooldown(Duration rateLimitCooldown) { this.rateLimitCooldown = rateLimitCooldown; }

        public int getNotFoundHighWaterMark() { return notFoundHighWaterMark; }
        public void setNotFoundHighWaterMark(int notFoundHighWaterMark) { this.notFoundHighWaterMark = notFoundHighWaterMark; }

        public int getNotFoundRetryBudget() { return notFoundRetryBudget; }
        public void setNotFoundRetryBudget(int notFoundRetryBudget) { this.notFoundRetryBudget = notFoundRetryBudget; }

        public Duration getOverallTimeout() { return overallTimeout; }
        public void setOverallTimeout(Duration overallTimeout) { this.overallTimeout = overallTimeout; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofDays(7);
        private long maximumSize = 10_000;
        private DurableStore durableStore = DurableStore.DISK;
        private String directory = "./.cache/dictionary-engine";

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }

        public DurableStore getDurableStore() { return durableStore; }
        public void setDurableStore(DurableStore durableStore) { this.durableStore = durableStore; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public enum DurableStore {
            DISK,
            NONE
        }
    }

    public static class Dedup {
        private boolean abortOnLastCancel = false;

        public boolean isAbortOnLastCancel() { return abortOnLastCancel; }
        public void setAbortOnLastCancel(boolean abortOnLastCancel) { this.abortOnLastCancel = abortOnLastCancel; }
    }

    public static class Dataset {
        private String localPath = "classpath:dictionary/local-dictionary.json";
        private String staticFallbackPath = "classpath:dictionary/static-fallback.json";
        private int maxStaticMatches = 10;

        public String getLocalPath() { return localPath; }
        public void setLocalPath(String localPath) { this.localPath = localPath; }

        public String getStaticFallbackPath() { return staticFallbackPath; }
        public void setStaticFallbackPath(String staticFallbackPath) { this.staticFallbackPath = staticFallbackPath; }

        public int getMaxStaticMatches() { return maxStaticMatches; }
        public void setMaxStaticMatches(int maxStaticMatches) { this.maxStaticMatches = maxStaticMatches; }
    }
}
