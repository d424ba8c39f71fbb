/**
 * Classification of failures raised while resolving generated content
 *
 * @author William Callahan
 *
 * Features:
 * - Stable lower-case codes surfaced to callers and SSE clients
 * - Marks which classifications let the fallback chain descend quietly
 */

package com.williamcallahan.dictionary_engine.types;

public enum ErrorClassification {
    NETWORK("network"),
    RATE_LIMITED("rate_limited"),
    TASK_NOT_FOUND("task_not_found"),
    TIMEOUT("timeout"),
    MALFORMED_RESPONSE("malformed_response"),
    GENERATION_FAILED("generation_failed"),
    UPSTREAM_ERROR("upstream_error"),
    NOT_FOUND("not_found");

    private final String code;

    ErrorClassification(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Transient failures that are logged as warnings and never abort a fallback chain
     */
    public boolean isTransient() {
        return this == NETWORK || this == RATE_LIMITED || this == TIMEOUT;
    }
}
