package com.williamcallahan.dictionary_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to the remote generation backend.
 *
 * These logs help debug the fallback flow:
 * - cache
 * - bundled dataset
 * - remote generation (basic, progressive task, SSE streams)
 * - static fallback
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log a remote call attempt
     */
    public static void logApiCallAttempt(Logger log, String operation, String query) {
        log.info("{} [GENERATION] ATTEMPT: {} for query='{}'", PREFIX, operation, query);
    }

    /**
     * Log a remote call success
     */
    public static void logApiCallSuccess(Logger log, String operation, String query, int tokensUsed) {
        log.info("{} [GENERATION] SUCCESS: {} for query='{}' (tokens={})", PREFIX, operation, query, tokensUsed);
    }

    /**
     * Log a remote call failure
     */
    public static void logApiCallFailure(Logger log, String operation, String query, String reason) {
        log.warn("{} [GENERATION] FAILURE: {} failed for query='{}' - {}", PREFIX, operation, query, reason);
    }

    /**
     * Log when remote generation is skipped because the backend reports itself unconfigured
     */
    public static void logGenerationUnavailable(Logger log, String query) {
        log.info("{} [GENERATION] UNAVAILABLE: backend not configured, skipping remote stage for query='{}'", PREFIX, query);
    }

    /**
     * Log which fallback state produced the result
     */
    public static void logFallbackResolved(Logger log, String query, String source, Object trail) {
        log.info("{} [FALLBACK] RESOLVED: query='{}' from {} via {}", PREFIX, query, source, trail);
    }

    /**
     * Log a poll step of a progressive task
     */
    public static void logPollProgress(Logger log, String taskId, String status, int progress) {
        log.debug("{} [POLL] task={} status={} progress={}", PREFIX, taskId, status, progress);
    }

    /**
     * Log stream processing
     */
    public static void logStreamProgress(Logger log, String operation, int currentCount) {
        log.debug("{} [STREAM] {}: {} items received", PREFIX, operation, currentCount);
    }
}
