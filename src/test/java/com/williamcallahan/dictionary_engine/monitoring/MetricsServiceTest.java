/**
 * Test suite for MetricsService
 *
 * @author William Callahan
 */
package com.williamcallahan.dictionary_engine.monitoring;

import com.williamcallahan.dictionary_engine.types.ResultSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MetricsServiceTest {

    private Locale originalLocale;

    @BeforeEach
    void setUp() {
        originalLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(originalLocale);
    }

    @Test
    void incrementLookup_tagsSourceIndependentlyOfDefaultLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MetricsService metricsService = new MetricsService(registry);

        metricsService.incrementLookup(ResultSource.STATIC_FALLBACK);

        assertNotNull(registry.find("dictionary.lookups").tag("source", "static_fallback").counter());
        assertEquals(1.0, registry.counter("dictionary.lookups", "source", "static_fallback").count());
    }
}
