package com.sociallink.smoke.domain.exception;

/**
 * Thrown when the API under test answers differently than expected.
 * Aborts the smoke run.
 */
public class SmokeAssertionException extends RuntimeException {

    public SmokeAssertionException(String message) {
        super(message);
    }

    public SmokeAssertionException(String message, Throwable cause) {
        super(message, cause);
    }
}
