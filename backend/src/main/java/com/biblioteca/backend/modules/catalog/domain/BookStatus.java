package com.biblioteca.backend.modules.catalog.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BookStatus {
    DISPONIBLE("disponible"),
    AGOTADO("agotado"),
    EN_MANTENIMIENTO("en mantenimiento");

    private final String code;

    BookStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static BookStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Book status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (BookStatus status : values()) {
            if (status.code.equals(normalized) || status.name().equalsIgnoreCase(normalized.replace(' ', '_'))) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported book status: " + raw);
    }
}
