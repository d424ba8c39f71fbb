/**
 * Two-tier cache for generated lookup results
 *
 * @author William Callahan
 *
 * Features:
 * - Caffeine memory tier answers synchronous best-effort reads
 * - Durable tier is consulted on memory misses and repopulates memory on a hit
 * - Per-entry TTL; expired entries read as absent and are evicted
 * - Partial entries track an in-flight generation without being persisted or served as hits
 * - Read-modify-write updates are chained per key so concurrent enrichments never lose writes
 * - Change listeners for callers that render cached values as they improve
 */

package com.williamcallahan.dictionary_engine.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

@Slf4j
public class ResultCache<V> {

    /**
     * Notified after every memory-tier write, partial or complete
     */
    @FunctionalInterface
    public interface Listener<V> {
        void onChange(CacheKey key, V value, boolean partial);
    }

    private final String namespace;
    private final Cache<CacheKey, CacheEntry<V>> memory;
    private final DurableResultStore durableStore;
    private final ObjectMapper objectMapper;
    private final JavaType entryType;
    private final Duration defaultTtl;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ConcurrentHashMap<CacheKey, CompletableFuture<Optional<V>>> updateChains = new ConcurrentHashMap<>();
    private final List<Listener<V>> listeners = new CopyOnWriteArrayList<>();

    public ResultCache(String namespace,
                       JavaType valueType,
                       DurableResultStore durableStore,
                       ObjectMapper objectMapper,
                       Duration defaultTtl,
                       long maximumSize,
                       Clock clock,
                       MetricsService metricsService) {
        this.namespace = namespace;
        this.durableStore = durableStore;
        this.objectMapper = objectMapper;
        this.entryType = objectMapper.getTypeFactory().constructParametricType(CacheEntry.class, valueType);
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.metricsService = metricsService;
        this.memory = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryTtlExpiry<V>(clock))
            .recordStats()
            .build();
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Memory-only read of a complete, live entry
     */
    public Optional<V> readSync(CacheKey key) {
        Optional<V> value = liveEntry(key).filter(entry -> !entry.partial()).map(CacheEntry::value);
        recordRead(value.isPresent());
        return value;
    }

    /**
     * Memory read that also returns a partial entry of an in-flight generation
     */
    public Optional<V> peek(CacheKey key) {
        return liveEntry(key).map(CacheEntry::value);
    }

    /**
     * Memory first, then the durable store. A durable hit is copied back into memory.
     * Durable-store failures are logged and read as a miss.
     */
    public CompletableFuture<Optional<V>> readAsync(CacheKey key) {
        return readEntryAsync(key).thenApply(entry -> {
            Optional<V> value = entry.map(CacheEntry::value);
            recordRead(value.isPresent());
            return value;
        });
    }

    public CompletableFuture<Void> write(CacheKey key, V value) {
        return write(key, value, defaultTtl);
    }

    /**
     * Replaces the entry in memory immediately and persists it asynchronously.
     * Plain writes are last-writer-wins.
     *
     * @return completes once the durable store has the entry; persistence failures are logged, not thrown
     */
    public CompletableFuture<Void> write(CacheKey key, V value, Duration ttl) {
        CacheEntry<V> entry = new CacheEntry<>(key.asStorageKey(), value, clock.instant(), ttl, false);
        return store(key, entry);
    }

    /**
     * Records an in-progress value in memory. Never replaces a complete entry and never reaches the durable store.
     */
    public void writePartial(CacheKey key, V value) {
        CacheEntry<V> existing = memory.getIfPresent(key);
        if (existing != null && !existing.partial() && !existing.isExpired(clock.instant())) {
            return;
        }
        memory.put(key, new CacheEntry<>(key.asStorageKey(), value, clock.instant(), defaultTtl, true));
        notifyListeners(key, value, true);
    }

    /**
     * Serialized read-modify-write. Updates for the same key run one after another, each seeing
     * the previous one's result; updates for different keys run independently.
     * The entry keeps its original write time and TTL.
     *
     * @param key entry to update
     * @param transform derives the new value from the current one
     * @return the updated value, or empty when no live entry existed
     */
    public CompletableFuture<Optional<V>> update(CacheKey key, UnaryOperator<V> transform) {
        CompletableFuture<Optional<V>> next = new CompletableFuture<>();
        CompletableFuture<Optional<V>> tail = updateChains.put(key, next);
        CompletableFuture<?> predecessor = tail != null ? tail : CompletableFuture.completedFuture(null);

        // a failed predecessor must not stall the chain
        predecessor
            .handle((ignored, error) -> (Void) null)
            .thenCompose(ignored -> applyUpdate(key, transform))
            .whenComplete((value, error) -> {
                updateChains.remove(key, next);
                if (error != null) {
                    next.completeExceptionally(error);
                } else {
                    next.complete(value);
                }
            });
        return next;
    }

    public CompletableFuture<Void> invalidate(CacheKey key) {
        memory.invalidate(key);
        return durableStore.delete(namespace, key.asStorageKey())
            .exceptionally(e -> {
                log.warn("[{}] failed to delete durable entry {}: {}", namespace, key, e.getMessage());
                return null;
            });
    }

    public void subscribe(Listener<V> listener) {
        listeners.add(listener);
    }

    public void unsubscribe(Listener<V> listener) {
        listeners.remove(listener);
    }

    private CompletableFuture<Optional<V>> applyUpdate(CacheKey key, UnaryOperator<V> transform) {
        return readEntryAsync(key).thenCompose(current -> {
            if (current.isEmpty() || current.get().partial()) {
                log.debug("[{}] no complete entry for {}, dropping update", namespace, key);
                if (metricsService != null) {
                    metricsService.incrementDroppedEnrichment();
                }
                return CompletableFuture.completedFuture(Optional.<V>empty());
            }
            V updated = transform.apply(current.get().value());
            return store(key, current.get().withValue(updated)).thenApply(ignored -> Optional.of(updated));
        });
    }

    private CompletableFuture<Void> store(CacheKey key, CacheEntry<V> entry) {
        memory.put(key, entry);
        notifyListeners(key, entry.value(), false);

        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.error("[{}] failed to serialize entry {}, keeping it in memory only", namespace, key, e);
            return CompletableFuture.completedFuture(null);
        }
        return durableStore.write(namespace, key.asStorageKey(), serialized)
            .exceptionally(e -> {
                log.warn("[{}] failed to persist entry {}: {}", namespace, key, e.getMessage());
                return null;
            });
    }

    private CompletableFuture<Optional<CacheEntry<V>>> readEntryAsync(CacheKey key) {
        Optional<CacheEntry<V>> inMemory = liveEntry(key).filter(entry -> !entry.partial());
        if (inMemory.isPresent()) {
            return CompletableFuture.completedFuture(inMemory);
        }
        return durableStore.read(namespace, key.asStorageKey())
            .thenApply(serialized -> serialized.flatMap(json -> hydrate(key, json)))
            .exceptionally(e -> {
                log.warn("[{}] durable read failed for {}, treating as miss: {}", namespace, key, e.getMessage());
                return Optional.empty();
            });
    }

    private Optional<CacheEntry<V>> hydrate(CacheKey key, String json) {
        CacheEntry<V> entry;
        try {
            entry = objectMapper.readValue(json, entryType);
        } catch (JsonProcessingException e) {
            log.warn("[{}] discarding unreadable durable entry {}: {}", namespace, key, e.getOriginalMessage());
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            return evictExpired(key, entry);
        }
        // another writer may have filled memory while the durable read ran
        CacheEntry<V> current = memory.asMap().merge(key, entry,
            (existing, loaded) -> existing.partial() ? loaded : existing);
        return Optional.of(current);
    }

    // A write that landed while the durable read ran wins over the expired copy
    private Optional<CacheEntry<V>> evictExpired(CacheKey key, CacheEntry<V> expired) {
        memory.asMap().remove(key, expired);
        Optional<CacheEntry<V>> fresher = liveEntry(key).filter(current -> !current.partial());
        if (fresher.isPresent()) {
            log.debug("[{}] durable entry {} expired but a newer write exists, keeping it", namespace, key);
            return fresher;
        }
        log.debug("[{}] durable entry {} expired, evicting", namespace, key);
        durableStore.delete(namespace, key.asStorageKey())
            .exceptionally(e -> {
                log.warn("[{}] failed to delete expired durable entry {}: {}", namespace, key, e.getMessage());
                return null;
            });
        return Optional.empty();
    }

    private Optional<CacheEntry<V>> liveEntry(CacheKey key) {
        CacheEntry<V> entry = memory.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            memory.asMap().remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private void notifyListeners(CacheKey key, V value, boolean partial) {
        for (Listener<V> listener : listeners) {
            try {
                listener.onChange(key, value, partial);
            } catch (RuntimeException e) {
                log.warn("[{}] cache listener failed for {}: {}", namespace, key, e.getMessage());
            }
        }
    }

    private void recordRead(boolean hit) {
        if (metricsService == null) {
            return;
        }
        if (hit) {
            metricsService.incrementCacheHit();
        } else {
            metricsService.incrementCacheMiss();
        }
    }

    /**
     * Lets Caffeine evict entries on the same TTL the read path checks
     */
    private static final class EntryTtlExpiry<V> implements Expiry<CacheKey, CacheEntry<V>> {

        private final Clock clock;

        private EntryTtlExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry<V> entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry<V> entry) {
            Duration remaining = Duration.between(clock.instant(), entry.writtenAt().plus(entry.ttl()));
            if (remaining.isNegative()) {
                return 0L;
            }
            try {
                return remaining.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }
}
