package com.biblioteca.backend.global.error;

import java.util.List;
import java.util.Map;

/**
 * Validation failure detected by a service after bean validation passed (uniqueness, cross-field rules).
 * Rendered as 400 with the same per-field {@code errors} map as bean validation.
 */
public class FieldValidationException extends RuntimeException {

    private final Map<String, List<String>> errors;

    public FieldValidationException(Map<String, List<String>> errors) {
        super(summarize(errors));
        this.errors = Map.copyOf(errors);
    }

    public static FieldValidationException of(String field, String message) {
        return new FieldValidationException(Map.of(field, List.of(message)));
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    private static String summarize(Map<String, List<String>> errors) {
        StringBuilder sb = new StringBuilder();
        errors.forEach((field, messages) -> messages.forEach(message ->
                sb.append(field).append(": ").append(message).append("; ")));
        return sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Datos inválidos";
    }
}
