package io.chatrelay.server.core;

import java.util.List;

/**
 * A submission is missing a required field. Maps to HTTP 400.
 */
public final class ValidationException extends RuntimeException {
    private final String field;
    private final List<String> requiredFields;

    public ValidationException(String field, List<String> requiredFields) {
        super("Missing required field: " + field);
        this.field = field;
        this.requiredFields = List.copyOf(requiredFields);
    }

    public String field() {
        return field;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }
}
