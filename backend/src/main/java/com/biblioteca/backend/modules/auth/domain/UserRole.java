package com.biblioteca.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    USUARIO("usuario"),
    BIBLIOTECARIO("bibliotecario"),
    ADMIN("admin");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public boolean isStaff() {
        return this == BIBLIOTECARIO || this == ADMIN;
    }

    @JsonCreator
    public static UserRole fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Role must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (UserRole role : values()) {
            if (role.code.equals(normalized) || role.name().equalsIgnoreCase(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unsupported role: " + raw);
    }
}
