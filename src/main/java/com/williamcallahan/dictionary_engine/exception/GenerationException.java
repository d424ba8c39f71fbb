/**
 * Runtime failure raised by the remote generation client and the components driving it
 *
 * @author William Callahan
 *
 * Features:
 * - Carries an ErrorClassification so callers can branch without string matching
 * - Keeps the upstream HTTP status when one was observed
 */

package com.williamcallahan.dictionary_engine.exception;

import com.williamcallahan.dictionary_engine.types.ErrorClassification;

public class GenerationException extends RuntimeException {

    private final ErrorClassification classification;
    private final Integer httpStatus;

    public GenerationException(ErrorClassification classification, String message) {
        this(classification, message, null, null);
    }

    public GenerationException(ErrorClassification classification, String message, Throwable cause) {
        this(classification, message, null, cause);
    }

    public GenerationException(ErrorClassification classification, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.httpStatus = httpStatus;
    }

    public ErrorClassification getClassification() {
        return classification;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public boolean is(ErrorClassification expected) {
        return classification == expected;
    }
}
