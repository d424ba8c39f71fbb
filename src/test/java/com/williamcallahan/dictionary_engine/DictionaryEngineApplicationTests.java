/**
 * Basic application context load test for the dictionary engine
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads with the test configuration
 * - Checks the lookup services and the typed result caches are wired
 * - The generation backend points at an unused local port and the durable store is disabled,
 *   so no network or disk access is needed
 */

package com.williamcallahan.dictionary_engine;

import com.williamcallahan.dictionary_engine.model.WordDetail;
import com.williamcallahan.dictionary_engine.service.SuggestionService;
import com.williamcallahan.dictionary_engine.service.TranslationService;
import com.williamcallahan.dictionary_engine.service.WordDetailService;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.service.generation.DetailedStage;
import com.williamcallahan.dictionary_engine.service.generation.PollingDetailedStage;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
class DictionaryEngineApplicationTests {

    @Autowired
    private WordDetailService wordDetailService;

    @Autowired
    private SuggestionService suggestionService;

    @Autowired
    private TranslationService translationService;

    @Autowired
    private ResultCache<WordDetail> wordDetailCache;

    @Autowired
    private DetailedStage detailedStage;

    @Test
    void contextLoads() {
        assertNotNull(suggestionService);
        assertNotNull(translationService);
        assertEquals("word-detail", wordDetailCache.getNamespace());
        assertInstanceOf(PollingDetailedStage.class, detailedStage);
    }

    @Test
    void bundledWordResolvesWithoutBackend() {
        assertEquals(ResultSource.LOCAL_DATASET,
            wordDetailService.lookup("walk", "en").blockLast(Duration.ofSeconds(5)).source());
    }
}
