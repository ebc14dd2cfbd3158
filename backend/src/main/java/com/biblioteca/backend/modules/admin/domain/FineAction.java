package com.biblioteca.backend.modules.admin.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FineAction {
    PAGAR("pagar"),
    AGREGAR("agregar"),
    ESTABLECER("establecer");

    private final String code;

    FineAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static FineAction fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Fine action must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FineAction action : values()) {
            if (action.code.equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unsupported fine action: " + raw);
    }
}
