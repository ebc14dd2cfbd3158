package com.biblioteca.backend.modules.loan.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LoanStatus {
    ACTIVO("activo"),
    DEVUELTO("devuelto"),
    VENCIDO("vencido");

    private final String code;

    LoanStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isOpen() {
        return this != DEVUELTO;
    }

    @JsonCreator
    public static LoanStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Loan status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (LoanStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported loan status: " + raw);
    }
}
