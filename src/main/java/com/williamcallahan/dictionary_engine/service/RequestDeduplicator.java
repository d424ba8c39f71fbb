/**
 * Collapses concurrent identical remote fetches into one shared operation
 *
 * @author William Callahan
 *
 * Features:
 * - Atomic get-or-create keyed registry (ConcurrentHashMap.computeIfAbsent)
 * - Shared operation replays every emitted element to each subscriber, so late joiners
 *   see the same ordered progress sequence and the same terminal signal
 * - Registration is removed exactly once when the operation settles or is aborted
 * - Optional abort of the underlying operation when its last subscriber cancels
 */

package com.williamcallahan.dictionary_engine.service;

import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.ConnectableFlux;
import reactor.core.publisher.Flux;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

@Slf4j
public class RequestDeduplicator<K, T> {

    private final String name;
    private final boolean abortOnLastCancel;
    private final MetricsService metricsService;
    private final Map<K, PendingOperation<K, T>> pending = new ConcurrentHashMap<>();

    /**
     * @param name label used in logs
     * @param abortOnLastCancel cancel the underlying operation once every subscriber has cancelled;
     *                          when false the operation always runs to its terminal signal
     * @param metricsService optional metrics sink, may be null
     */
    public RequestDeduplicator(String name, boolean abortOnLastCancel, MetricsService metricsService) {
        this.name = name;
        this.abortOnLastCancel = abortOnLastCancel;
        this.metricsService = metricsService;
    }

    /**
     * Returns the in-flight operation for {@code key}, starting one with {@code factory} if none exists.
     * The factory is invoked at most once per registration; the operation begins with the first subscription.
     *
     * @param key dedup key
     * @param factory creates the remote operation
     * @return shared, replaying view of the operation
     */
    public Flux<T> getOrStart(K key, Supplier<Flux<T>> factory) {
        AtomicBoolean created = new AtomicBoolean(false);
        // computeIfAbsent for atomic get-or-create
        PendingOperation<K, T> operation = pending.computeIfAbsent(key, k -> {
            created.set(true);
            return start(k, factory);
        });
        if (!created.get()) {
            log.debug("[{}] joining in-flight operation for {}", name, key);
            if (metricsService != null) {
                metricsService.incrementDedupJoin();
            }
        }
        return operation.shared();
    }

    public boolean isPending(K key) {
        return pending.containsKey(key);
    }

    public int inFlightCount() {
        return pending.size();
    }

    private PendingOperation<K, T> start(K key, Supplier<Flux<T>> factory) {
        log.debug("[{}] starting operation for {}", name, key);
        PendingOperation<K, T> operation = new PendingOperation<>(key);
        ConnectableFlux<T> replayed = factory.get()
            .doFinally(signal -> {
                if (pending.remove(key, operation)) {
                    log.debug("[{}] operation for {} settled ({})", name, key, signal);
                }
            })
            .replay();
        operation.shared = abortOnLastCancel ? replayed.refCount(1) : replayed.autoConnect(1);
        return operation;
    }

    /**
     * Registry entry for one outstanding remote fetch
     */
    private static final class PendingOperation<K, T> {
        private final K key;
        private volatile Flux<T> shared;

        private PendingOperation(K key) {
            this.key = key;
        }

        private Flux<T> shared() {
            return shared;
        }

        @Override
        public String toString() {
            return "PendingOperation[" + key + "]";
        }
    }
}
