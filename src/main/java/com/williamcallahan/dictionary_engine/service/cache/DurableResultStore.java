package com.williamcallahan.dictionary_engine.service.cache;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Long-term key-value store behind the in-memory result cache.
 * Values are opaque serialized cache entries; implementations decide the on-disk format.
 */
public interface DurableResultStore {

    CompletableFuture<Optional<String>> read(String namespace, String key);

    CompletableFuture<Void> write(String namespace, String key, String serializedEntry);

    CompletableFuture<Void> delete(String namespace, String key);
}
