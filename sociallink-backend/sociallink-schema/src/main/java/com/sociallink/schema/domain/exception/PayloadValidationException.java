package com.sociallink.schema.domain.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Thrown when a payload is missing a required field or carries a malformed one.
 * Holds every violation as field name to message, ordered by field name.
 */
public class PayloadValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public PayloadValidationException(String message, Map<String, String> fieldErrors) {
        super(message);
        this.fieldErrors = Collections.unmodifiableMap(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
