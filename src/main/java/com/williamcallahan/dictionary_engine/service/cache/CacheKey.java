package com.williamcallahan.dictionary_engine.service.cache;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a cached or in-flight lookup: normalized query plus target language.
 * Also used as the dedup key, so two spellings of the same query share one remote fetch.
 */
public record CacheKey(String normalizedQuery, String targetLanguage) {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    public static CacheKey of(String query, String targetLanguage) {
        String language = targetLanguage == null ? "" : targetLanguage.trim().toLowerCase(Locale.ROOT);
        return new CacheKey(normalizeQuery(query), language);
    }

    /**
     * Trims, lower-cases, turns full-width spaces into ASCII spaces and collapses whitespace runs
     */
    public static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        String normalized = query.replace('　', ' ').trim().toLowerCase(Locale.ROOT);
        return WHITESPACE_RUN.matcher(normalized).replaceAll(" ");
    }

    /**
     * Flat form used by durable stores, e.g. {@code "run:en"}
     */
    public String asStorageKey() {
        return normalizedQuery + ":" + targetLanguage;
    }

    @Override
    public String toString() {
        return asStorageKey();
    }
}
