/**
 * Service for tracking lookup and generation metrics
 * Provides counters, gauges, and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.dictionary_engine.monitoring;

import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter dedupJoins;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter lostEnrichments;

    // Gauges
    private final AtomicInteger activeGenerations = new AtomicInteger(0);

    // Timers
    private final Timer remoteGenerationTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.dedupJoins = Counter.builder("generation.dedup.joins")
            .description("Callers attached to an already running remote fetch")
            .register(meterRegistry);

        this.cacheHits = Counter.builder("result_cache.hits")
            .description("Result cache reads that returned a live entry")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("result_cache.misses")
            .description("Result cache reads that found nothing or an expired entry")
            .register(meterRegistry);

        this.lostEnrichments = Counter.builder("result_cache.enrichment.dropped")
            .description("Background enrichment updates that found no entry to update")
            .register(meterRegistry);

        Gauge.builder("generation.active", activeGenerations, AtomicInteger::get)
            .description("Remote generations currently in flight")
            .register(meterRegistry);

        this.remoteGenerationTimer = Timer.builder("generation.remote.duration")
            .description("Wall-clock duration of remote generation")
            .register(meterRegistry);
    }

    public void incrementLookup(ResultSource source) {
        meterRegistry.counter("dictionary.lookups", "source", source.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementLookupNotFound() {
        meterRegistry.counter("dictionary.lookups.not_found").increment();
    }

    public void incrementRemoteFailure(ErrorClassification classification) {
        meterRegistry.counter("generation.remote.failures", "classification", classification.getCode()).increment();
    }

    public void incrementDedupJoin() {
        dedupJoins.increment();
    }

    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementDroppedEnrichment() {
        lostEnrichments.increment();
    }

    public void generationStarted() {
        activeGenerations.incrementAndGet();
    }

    public void generationFinished(Duration elapsed) {
        activeGenerations.decrementAndGet();
        remoteGenerationTimer.record(elapsed);
    }
}
