package com.flagship.budget_ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejected input. Thrown before anything is written, so the caller can
 * correct the request and retry.
 *
 * Extends IllegalArgumentException so that code catching the broader type
 * keeps working; the HTTP layer maps this subtype to 422.
 */
public class ValidationException extends IllegalArgumentException {

    private final Map<String, String> details;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ValidationException forField(String field, String message) {
        return new ValidationException(message, Map.of(field, message));
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
