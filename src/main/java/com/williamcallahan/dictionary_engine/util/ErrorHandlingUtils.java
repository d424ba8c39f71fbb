/**
 * Utility class for standardized error handling across the application
 * Provides consistent classification and logging of remote generation failures
 *
 * @author William Callahan
 */

package com.williamcallahan.dictionary_engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.monitoring.MetricsService;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import org.slf4j.Logger;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Categorize an exception into the generation error taxonomy
     */
    public static ErrorClassification categorizeError(Throwable throwable) {
        if (throwable == null) {
            return ErrorClassification.GENERATION_FAILED;
        }
        if (throwable instanceof GenerationException ge) {
            return ge.getClassification();
        }
        if (hasTimeoutCause(throwable)) {
            return ErrorClassification.TIMEOUT;
        }
        if (throwable instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            if (status == 429) {
                return ErrorClassification.RATE_LIMITED;
            }
            if (status == 408 || status == 504) {
                return ErrorClassification.TIMEOUT;
            }
            return ErrorClassification.UPSTREAM_ERROR;
        }
        if (throwable instanceof WebClientRequestException
                || throwable instanceof ConnectException) {
            return ErrorClassification.NETWORK;
        }
        if (throwable instanceof JsonProcessingException || throwable instanceof DecodingException) {
            return ErrorClassification.MALFORMED_RESPONSE;
        }
        if (throwable instanceof IOException) {
            return ErrorClassification.NETWORK;
        }
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return categorizeError(throwable.getCause());
        }
        if (throwable.getCause() != null && throwable.getCause() != throwable) {
            return categorizeError(throwable.getCause());
        }
        return ErrorClassification.GENERATION_FAILED;
    }

    /**
     * Wraps any failure as a GenerationException, keeping an existing one untouched
     */
    public static GenerationException toGenerationException(Throwable throwable, String operationName) {
        Throwable unwrapped = unwrap(throwable);
        if (unwrapped instanceof GenerationException ge) {
            return ge;
        }
        ErrorClassification classification = categorizeError(unwrapped);
        Integer status = unwrapped instanceof WebClientResponseException wcre ? wcre.getStatusCode().value() : null;
        String detail = unwrapped.getMessage() != null ? unwrapped.getMessage() : unwrapped.getClass().getSimpleName();
        return new GenerationException(classification, operationName + " failed: " + detail, status, unwrapped);
    }

    /**
     * Logs a failure that lets a fallback chain move on to its next source.
     * Transient failures log at WARN without a stack trace, anything else at ERROR.
     */
    public static ErrorClassification logFallThrough(Logger logger, String operationName, Throwable throwable,
                                                     MetricsService metricsService) {
        ErrorClassification classification = categorizeError(throwable);
        if (classification.isTransient()) {
            logger.warn("{} failed ({}), falling through: {}", operationName, classification.getCode(), throwable.getMessage());
        } else {
            logger.error("{} failed ({}), falling through: {}", operationName, classification.getCode(), throwable.getMessage(), throwable);
        }
        if (metricsService != null) {
            metricsService.incrementRemoteFailure(classification);
        }
        return classification;
    }

    /**
     * Check if an error is worth trying again against another source
     */
    public static boolean isRetryable(Throwable throwable) {
        return categorizeError(throwable).isTransient();
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasTimeoutCause(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current instanceof GenerationException) {
                return false;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
