/**
 * File-backed durable store for cached lookup results
 *
 * @author William Callahan
 *
 * Features:
 * - One JSON file per entry under {directory}/{namespace}/
 * - File names are SHA-256 hashes of the storage key, so any query text is safe on disk
 * - Writes go to a temp file first and are moved into place
 * - All file I/O runs on the supplied executor, never on the caller's thread
 */

package com.williamcallahan.dictionary_engine.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
public class LocalDiskResultStore implements DurableResultStore {

    private final Path directory;
    private final Executor executor;

    public LocalDiskResultStore(Path directory, Executor executor) {
        this.directory = directory;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<String>> read(String namespace, String key) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = fileFor(namespace, key);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read cache file " + file, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> write(String namespace, String key, String serializedEntry) {
        return CompletableFuture.runAsync(() -> {
            Path file = fileFor(namespace, key);
            try {
                Files.createDirectories(file.getParent());
                Path temp = Files.createTempFile(file.getParent(), "entry-", ".tmp");
                Files.writeString(temp, serializedEntry, StandardCharsets.UTF_8);
                try {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("Persisted cache entry {} to {}", key, file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write cache file " + file, e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> delete(String namespace, String key) {
        return CompletableFuture.runAsync(() -> {
            Path file = fileFor(namespace, key);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete cache file " + file, e);
            }
        }, executor);
    }

    Path fileFor(String namespace, String key) {
        return directory.resolve(namespace).resolve(sha256(key) + ".json");
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
