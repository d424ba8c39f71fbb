package com.williamcallahan.dictionary_engine.service.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class CacheKeyTest {

    @Test
    void of_normalizesCaseWhitespaceAndLanguage() {
        CacheKey key = CacheKey.of("  Give   UP\t", " EN ");

        assertEquals("give up", key.normalizedQuery());
        assertEquals("en", key.targetLanguage());
        assertEquals(key, CacheKey.of("give up", "en"));
    }

    @Test
    void normalizeQuery_treatsFullWidthSpaceAsWhitespace() {
        assertEquals("水 を 飲む", CacheKey.normalizeQuery("　水　を  飲む　"));
    }

    @Test
    void normalizeQuery_handlesNull() {
        assertEquals("", CacheKey.normalizeQuery(null));
        assertEquals("", CacheKey.of(null, null).targetLanguage());
    }

    @Test
    void languageIsPartOfIdentity() {
        assertNotEquals(CacheKey.of("run", "en"), CacheKey.of("run", "fr"));
        assertEquals("run:en", CacheKey.of("Run", "en").asStorageKey());
        assertEquals("run:en", CacheKey.of("Run", "en").toString());
    }
}
