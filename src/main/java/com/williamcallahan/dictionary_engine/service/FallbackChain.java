/**
 * Resolves a lookup by trying its sources in a fixed order
 *
 * @author William Callahan
 *
 * Features:
 * - Cache, then the bundled local dataset, then remote generation, then the static fallback
 * - The first source that answers ends the chain; later sources are never touched
 * - Remote generation is skipped when the backend reports itself unconfigured and goes through
 *   the request deduplicator, so concurrent identical lookups share one remote fetch
 * - Remote partial results are streamed to the caller and tracked in the cache as partial entries
 * - Any remote failure is logged (transient ones at WARN) and the chain descends to the static fallback
 * - Optional background enrichment after a remote success, applied with serialized cache updates
 * - Background refresh folds a remote result into a value another source already answered
 * - Exhausting every source raises LookupNotFoundException carrying the visited states
 */

package com.williamcallahan.dictionary_engine.service;

import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.exception.LookupNotFoundException;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.service.cache.CacheKey;
import com.williamcallahan.dictionary_engine.service.cache.ResultCache;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.types.FallbackState;
import com.williamcallahan.dictionary_engine.types.LookupUpdate;
import com.williamcallahan.dictionary_engine.types.ResultSource;
import com.williamcallahan.dictionary_engine.util.ErrorHandlingUtils;
import com.williamcallahan.dictionary_engine.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

public class FallbackChain<V> {

    private static final Logger logger = LoggerFactory.getLogger(FallbackChain.class);

    /**
     * Synchronous, offline source such as a bundled dataset
     */
    @FunctionalInterface
    public interface LookupSource<V> {
        Optional<V> find(CacheKey key);

        static <V> LookupSource<V> none() {
            return key -> Optional.empty();
        }
    }

    /**
     * Remote generation producing partial updates and a final done update
     */
    @FunctionalInterface
    public interface RemoteGeneration<V> {
        Flux<LookupUpdate<V>> generate(CacheKey key);
    }

    /**
     * Derives follow-up modifications of a freshly generated value, e.g. attaching usage hints
     */
    @FunctionalInterface
    public interface Enricher<V> {
        Flux<UnaryOperator<V>> enrichments(CacheKey key, V value);
    }

    private final String name;
    private final ResultCache<V> cache;
    private final LookupSource<V> localDataset;
    private final RemoteGeneration<V> remoteGeneration;
    private final LookupSource<V> staticFallback;
    private final RequestDeduplicator<CacheKey, LookupUpdate<V>> deduplicator;
    private final Supplier<Mono<Boolean>> remoteAvailability;
    private final Enricher<V> enricher;
    private final MetricsService metricsService;

    public FallbackChain(String name,
                         ResultCache<V> cache,
                         LookupSource<V> localDataset,
                         RemoteGeneration<V> remoteGeneration,
                         LookupSource<V> staticFallback,
                         RequestDeduplicator<CacheKey, LookupUpdate<V>> deduplicator,
                         Supplier<Mono<Boolean>> remoteAvailability,
                         Enricher<V> enricher,
                         MetricsService metricsService) {
        this.name = name;
        this.cache = cache;
        this.localDataset = localDataset != null ? localDataset : LookupSource.none();
        this.remoteGeneration = remoteGeneration;
        this.staticFallback = staticFallback != null ? staticFallback : LookupSource.none();
        this.deduplicator = deduplicator;
        this.remoteAvailability = remoteAvailability;
        this.enricher = enricher;
        this.metricsService = metricsService;
    }

    /**
     * Streams the lookup: zero or more partial updates from remote generation, then one done update.
     * Fails with {@link LookupNotFoundException} when no source has the key.
     */
    public Flux<LookupUpdate<V>> resolve(CacheKey key) {
        return resolve(key, remoteGeneration);
    }

    /**
     * Same as {@link #resolve(CacheKey)} with a request-specific remote stage, for callers whose
     * remote request needs more than the normalized key (e.g. the original casing of a text).
     * Concurrent calls with the same key still share one remote fetch.
     */
    public Flux<LookupUpdate<V>> resolve(CacheKey key, RemoteGeneration<V> remote) {
        return Flux.defer(() -> {
            List<FallbackState> trail = new ArrayList<>();
            trail.add(FallbackState.CACHE_LOOKUP);
            return Mono.fromFuture(() -> cache.readAsync(key))
                .flatMapMany(cached -> cached
                    .map(value -> Flux.just(done(value, ResultSource.CACHE, trail, key)))
                    .orElseGet(() -> fromLocalDataset(key, remote, trail)));
        });
    }

    /**
     * Only the final update of {@link #resolve}
     */
    public Mono<LookupUpdate<V>> resolveFinal(CacheKey key) {
        return resolve(key).last();
    }

    public Mono<LookupUpdate<V>> resolveFinal(CacheKey key, RemoteGeneration<V> remote) {
        return resolve(key, remote).last();
    }

    /**
     * Generates {@code key} remotely and merges the result into the cached value, then enriches the
     * merged value. Goes through the request deduplicator, so a refresh never runs next to another
     * remote fetch for the same key.
     *
     * @param key entry answered earlier by a non-remote source
     * @param merge combines the generated value (first) with the cached one (second)
     * @return the merged value, or empty when the backend is unavailable or no complete entry is cached
     */
    public Mono<Optional<V>> refresh(CacheKey key, BinaryOperator<V> merge) {
        if (remoteGeneration == null) {
            return Mono.just(Optional.empty());
        }
        return remoteAvailability.get()
            .defaultIfEmpty(false)
            .filter(Boolean::booleanValue)
            .flatMap(configured -> deduplicator.getOrStart(key, () -> remoteGeneration.generate(key))
                .filter(LookupUpdate::done)
                .next())
            .flatMap(generated -> Mono.fromFuture(() -> cache.update(key, existing -> merge.apply(generated.value(), existing))))
            .doOnNext(merged -> merged.ifPresent(value -> startEnrichment(key, value)))
            .defaultIfEmpty(Optional.empty());
    }

    public ResultCache<V> getCache() {
        return cache;
    }

    private Flux<LookupUpdate<V>> fromLocalDataset(CacheKey key, RemoteGeneration<V> remote, List<FallbackState> trail) {
        trail.add(FallbackState.LOCAL_DATASET);
        Optional<V> local = localDataset.find(key);
        if (local.isPresent()) {
            cache.write(key, local.get());
            return Flux.just(done(local.get(), ResultSource.LOCAL_DATASET, trail, key));
        }
        return fromRemote(key, remote, trail);
    }

    private Flux<LookupUpdate<V>> fromRemote(CacheKey key, RemoteGeneration<V> remote, List<FallbackState> trail) {
        trail.add(FallbackState.REMOTE_GENERATION);
        if (remote == null) {
            return fromStaticFallback(key, trail);
        }
        return remoteAvailability.get()
            .defaultIfEmpty(false)
            .flatMapMany(configured -> {
                if (!configured) {
                    ExternalApiLogger.logGenerationUnavailable(logger, key.normalizedQuery());
                    return fromStaticFallback(key, trail);
                }
                AtomicBoolean finished = new AtomicBoolean(false);
                return deduplicator.getOrStart(key, () -> startRemote(key, remote))
                    .map(update -> {
                        if (update.done()) {
                            finished.set(true);
                            return done(update.value(), ResultSource.REMOTE, trail, key);
                        }
                        return LookupUpdate.partial(update.progress(), update.value(), ResultSource.REMOTE);
                    })
                    .concatWith(Mono.defer(() -> finished.get()
                        ? Mono.empty()
                        : Mono.error(new GenerationException(ErrorClassification.MALFORMED_RESPONSE,
                            name + " remote generation ended without a result"))))
                    .onErrorResume(e -> !(e instanceof LookupNotFoundException), e -> {
                        ErrorHandlingUtils.logFallThrough(logger, name + " remote generation for '" + key + "'", e, metricsService);
                        return fromStaticFallback(key, trail);
                    });
            });
    }

    // Runs once per deduplicated fetch, not once per subscriber
    private Flux<LookupUpdate<V>> startRemote(CacheKey key, RemoteGeneration<V> remote) {
        Instant started = Instant.now();
        return remote.generate(key)
            .doOnSubscribe(s -> {
                if (metricsService != null) {
                    metricsService.generationStarted();
                }
            })
            .doOnNext(update -> {
                if (update.value() == null) {
                    return;
                }
                if (update.done()) {
                    cache.write(key, update.value());
                    startEnrichment(key, update.value());
                } else {
                    cache.writePartial(key, update.value());
                }
            })
            .doFinally(signal -> {
                if (metricsService != null) {
                    metricsService.generationFinished(Duration.between(started, Instant.now()));
                }
            });
    }

    private Flux<LookupUpdate<V>> fromStaticFallback(CacheKey key, List<FallbackState> trail) {
        trail.add(FallbackState.STATIC_FALLBACK);
        Optional<V> fallback = staticFallback.find(key);
        if (fallback.isPresent()) {
            return Flux.just(done(fallback.get(), ResultSource.STATIC_FALLBACK, trail, key));
        }
        trail.add(FallbackState.FAILED);
        logger.info("{} lookup for '{}' exhausted every source: {}", name, key, trail);
        if (metricsService != null) {
            metricsService.incrementLookupNotFound();
        }
        return Flux.error(new LookupNotFoundException(key.normalizedQuery(), trail));
    }

    private void startEnrichment(CacheKey key, V value) {
        if (enricher == null) {
            return;
        }
        enricher.enrichments(key, value)
            .flatMap(transform -> Mono.fromFuture(() -> cache.update(key, transform)))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                updated -> logger.debug("{} enrichment applied to {}", name, key),
                error -> logger.warn("{} enrichment for {} stopped: {}", name, key, error.getMessage()),
                () -> logger.debug("{} enrichment for {} finished", name, key));
    }

    private LookupUpdate<V> done(V value, ResultSource source, List<FallbackState> trail, CacheKey key) {
        List<FallbackState> visited = new ArrayList<>(trail);
        visited.add(FallbackState.DONE);
        ExternalApiLogger.logFallbackResolved(logger, key.normalizedQuery(), source.name(), visited);
        if (metricsService != null) {
            metricsService.incrementLookup(source);
        }
        return LookupUpdate.done(value, source, visited);
    }
}
