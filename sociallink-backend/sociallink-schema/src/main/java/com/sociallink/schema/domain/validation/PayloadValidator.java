package com.sociallink.schema.domain.validation;

import com.sociallink.schema.domain.exception.PayloadValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Payload Validator - field presence and format checks for API payloads
 * Delegates to Jakarta Bean Validation; no business rules live here.
 */
@Slf4j
public class PayloadValidator {

    private final Validator validator;

    public PayloadValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validator backed by the default Bean Validation provider (Hibernate Validator).
     */
    public static PayloadValidator createDefault() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return new PayloadValidator(factory.getValidator());
    }

    /**
     * Accept the payload or reject it with every field violation.
     *
     * @param payload Request or response body
     * @return the same payload, for chaining
     * @throws PayloadValidationException if any constraint is violated
     */
    public <T> T validate(T payload) {
        if (payload == null) {
            throw new PayloadValidationException("Payload is required", Map.of());
        }

        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (violations.isEmpty()) {
            log.debug("[PAYLOAD_VALID] Payload accepted | type={}", payload.getClass().getSimpleName());
            return payload;
        }

        // Violations arrive unordered; when one field breaks several constraints the
        // alphabetically first message is kept
        List<ConstraintViolation<T>> ordered = new ArrayList<>(violations);
        ordered.sort(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                .thenComparing(ConstraintViolation::getMessage));

        Map<String, String> fieldErrors = new TreeMap<>();
        for (ConstraintViolation<T> violation : ordered) {
            fieldErrors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
        }

        log.debug("[PAYLOAD_INVALID] Payload rejected | type={} | fields={}",
                payload.getClass().getSimpleName(), fieldErrors.keySet());
        Map.Entry<String, String> first = fieldErrors.entrySet().iterator().next();
        throw new PayloadValidationException(first.getKey() + " " + first.getValue(), fieldErrors);
    }

    /**
     * Non-throwing variant of {@link #validate(Object)}.
     */
    public boolean isValid(Object payload) {
        return payload != null && validator.validate(payload).isEmpty();
    }
}
