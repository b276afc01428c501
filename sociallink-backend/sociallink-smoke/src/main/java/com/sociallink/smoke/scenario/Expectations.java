package com.sociallink.smoke.scenario;

import com.sociallink.schema.domain.exception.PayloadValidationException;
import com.sociallink.schema.domain.validation.PayloadValidator;
import com.sociallink.smoke.client.ApiResponse;
import com.sociallink.smoke.domain.exception.SmokeAssertionException;

import java.util.Objects;

/**
 * Assertions used by scenario steps. Each failure raises {@link SmokeAssertionException}.
 */
public final class Expectations {

    private Expectations() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static void expectStatus(ApiResponse response, int expected, String message) {
        if (response.getStatus() != expected) {
            throw new SmokeAssertionException(message + " (expected " + expected + ", got "
                    + response.getStatus() + "): " + response.getBody());
        }
    }

    public static void expectThat(boolean condition, String message) {
        if (!condition) {
            throw new SmokeAssertionException(message);
        }
    }

    public static void expectEquals(Object expected, Object actual, String message) {
        if (!Objects.equals(expected, actual)) {
            throw new SmokeAssertionException(message + " (expected '" + expected + "', got '" + actual + "')");
        }
    }

    public static void expectDetailContains(ApiResponse response, String fragment, String message) {
        String detail = response.detail();
        if (!detail.contains(fragment)) {
            throw new SmokeAssertionException(message + " (detail: '" + detail + "')");
        }
    }

    /**
     * Binds the body to {@code type} and checks its required fields.
     */
    public static <T> T expectBody(ApiResponse response, Class<T> type, PayloadValidator validator) {
        T body = response.readBody(type);
        try {
            return validator.validate(body);
        } catch (PayloadValidationException e) {
            throw new SmokeAssertionException(type.getSimpleName() + " is incomplete: " + e.getFieldErrors(), e);
        }
    }

    public static void expectJsonArray(ApiResponse response, String message) {
        if (!response.json().isArray()) {
            throw new SmokeAssertionException(message);
        }
    }
}
