/**
 * Offline dictionary data shipped with the application
 *
 * @author William Callahan
 *
 * Features:
 * - Local dataset: exact headword and exact query matches, consulted before any remote call
 * - Static fallback: a smaller emergency set, consulted only after remote generation is
 *   unavailable or failed; suggestion queries match by substring
 * - Both files are keyed by target language and loaded once at startup
 * - A missing or unreadable file leaves that tier empty and is logged, it never fails startup
 */

package com.williamcallahan.dictionary_engine.service.dataset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.dictionary_engine.config.AppConfigurationProperties;
import com.williamcallahan.dictionary_engine.model.SuggestionItem;
import com.williamcallahan.dictionary_engine.model.WordDetail;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
@Slf4j
public class BundledDictionary {

    private final DictionaryData local;
    private final DictionaryData staticFallback;
    private final int maxStaticMatches;

    @Autowired
    public BundledDictionary(ResourceLoader resourceLoader,
                             ObjectMapper objectMapper,
                             AppConfigurationProperties properties) {
        AppConfigurationProperties.Dataset dataset = properties.getDataset();
        this.local = load(resourceLoader, objectMapper, dataset.getLocalPath());
        this.staticFallback = load(resourceLoader, objectMapper, dataset.getStaticFallbackPath());
        this.maxStaticMatches = dataset.getMaxStaticMatches();
        log.info("Bundled dictionary loaded: {} local headwords, {} static headwords",
            local.headwordCount(), staticFallback.headwordCount());
    }

    BundledDictionary(DictionaryData local, DictionaryData staticFallback, int maxStaticMatches) {
        this.local = local;
        this.staticFallback = staticFallback;
        this.maxStaticMatches = maxStaticMatches;
    }

    public Optional<WordDetail> findWordDetail(CacheKey key) {
        return local.word(key);
    }

    public Optional<WordDetail> findStaticWordDetail(CacheKey key) {
        return staticFallback.word(key);
    }

    public Optional<List<SuggestionItem>> findSuggestions(CacheKey key) {
        List<SuggestionItem> items = local.suggestionsFor(key.targetLanguage()).get(key.normalizedQuery());
        if (items == null || items.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(limit(items));
    }

    /**
     * Exact query first, then the first entry whose query contains the search text
     */
    public Optional<List<SuggestionItem>> findStaticSuggestions(CacheKey key) {
        Map<String, List<SuggestionItem>> byQuery = staticFallback.suggestionsFor(key.targetLanguage());
        String query = key.normalizedQuery();
        if (query.isEmpty()) {
            return Optional.empty();
        }
        List<SuggestionItem> exact = byQuery.get(query);
        if (exact != null && !exact.isEmpty()) {
            return Optional.of(limit(exact));
        }
        return byQuery.entrySet().stream()
            .filter(entry -> entry.getKey().contains(query) && !entry.getValue().isEmpty())
            .findFirst()
            .map(entry -> limit(entry.getValue()));
    }

    /**
     * Local headwords for a target language, in file order
     */
    public List<String> headwords(String targetLanguage) {
        return List.copyOf(local.wordsFor(targetLanguage).keySet());
    }

    private List<SuggestionItem> limit(List<SuggestionItem> items) {
        return items.stream().limit(maxStaticMatches).collect(Collectors.toList());
    }

    private static DictionaryData load(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        if (location == null || location.isBlank()) {
            return DictionaryData.EMPTY;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Dictionary resource {} not found; that tier stays empty", location);
            return DictionaryData.EMPTY;
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, DictionaryData.class).normalized();
        } catch (IOException e) {
            log.error("Failed to read dictionary resource {}: {}", location, e.getMessage(), e);
            return DictionaryData.EMPTY;
        }
    }

    /**
     * File layout: {"words": {lang: {headword: WordDetail}}, "suggestions": {lang: {query: [SuggestionItem]}}}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record DictionaryData(Map<String, Map<String, WordDetail>> words,
                          Map<String, Map<String, List<SuggestionItem>>> suggestions) {

        static final DictionaryData EMPTY = new DictionaryData(Map.of(), Map.of());

        DictionaryData {
            words = words == null ? Map.of() : words;
            suggestions = suggestions == null ? Map.of() : suggestions;
        }

        // Keys go through the same normalization as lookups so "Run" in the file matches "run"
        DictionaryData normalized() {
            Map<String, Map<String, WordDetail>> normalizedWords = new LinkedHashMap<>();
            words.forEach((lang, entries) -> {
                Map<String, WordDetail> byHeadword = new LinkedHashMap<>();
                entries.forEach((headword, detail) -> byHeadword.put(CacheKey.normalizeQuery(headword), detail));
                normalizedWords.put(lang.toLowerCase(Locale.ROOT), byHeadword);
            });
            Map<String, Map<String, List<SuggestionItem>>> normalizedSuggestions = new LinkedHashMap<>();
            suggestions.forEach((lang, entries) -> {
                Map<String, List<SuggestionItem>> byQuery = new LinkedHashMap<>();
                entries.forEach((query, items) -> byQuery.put(CacheKey.normalizeQuery(query), items));
                normalizedSuggestions.put(lang.toLowerCase(Locale.ROOT), byQuery);
            });
            return new DictionaryData(normalizedWords, normalizedSuggestions);
        }

        Optional<WordDetail> word(CacheKey key) {
            return Optional.ofNullable(wordsFor(key.targetLanguage()).get(key.normalizedQuery()));
        }

        Map<String, WordDetail> wordsFor(String lang) {
            return words.getOrDefault(lang, Map.of());
        }

        Map<String, List<SuggestionItem>> suggestionsFor(String lang) {
            return suggestions.getOrDefault(lang, Map.of());
        }

        int headwordCount() {
            return words.values().stream().mapToInt(Map::size).sum();
        }
    }
}
