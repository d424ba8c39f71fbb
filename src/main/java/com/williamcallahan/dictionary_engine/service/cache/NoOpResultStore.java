package com.williamcallahan.dictionary_engine.service.cache;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Durable store used when persistence is disabled: memory-only caching.
 */
public class NoOpResultStore implements DurableResultStore {

    @Override
    public CompletableFuture<Optional<String>> read(String namespace, String key) {
        return CompletableFuture.completedFuture(Optional.empty());
    }

    @Override
    public CompletableFuture<Void> write(String namespace, String key, String serializedEntry) {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(String namespace, String key) {
        return CompletableFuture.completedFuture(null);
    }
}
