package com.williamcallahan.dictionary_engine.controller.support;

import com.williamcallahan.dictionary_engine.exception.GenerationException;
import com.williamcallahan.dictionary_engine.exception.LookupNotFoundException;
import com.williamcallahan.dictionary_engine.types.ErrorClassification;
import com.williamcallahan.dictionary_engine.util.ErrorHandlingUtils;
import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across JSON responses and SSE error events.
 */
public final class ErrorResponseUtils {

    public static final String INVALID_REQUEST = "invalid_request";

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        return body;
    }

    /**
     * Error payload for any failure of a lookup, including the visited fallback states when known
     */
    public static Map<String, Object> errorBody(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return errorBody(INVALID_REQUEST, error.getMessage());
        }
        ErrorClassification classification = ErrorHandlingUtils.categorizeError(error);
        Map<String, Object> body = errorBody(classification.getCode(), error.getMessage());
        if (error instanceof LookupNotFoundException notFound) {
            body.put("trail", notFound.getTrail());
        }
        return body;
    }

    public static HttpStatus statusFor(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof LookupNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof GenerationException generation && generation.is(ErrorClassification.TIMEOUT)) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
