package com.biblioteca.backend.modules.reservation.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReservationStatus {
    PENDIENTE("pendiente"),
    NOTIFICADA("notificada"),
    COMPLETADA("completada"),
    CANCELADA("cancelada");

    public static final Set<ReservationStatus> ACTIVE = EnumSet.of(PENDIENTE, NOTIFICADA);

    private final String code;

    ReservationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ReservationStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Reservation status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ReservationStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported reservation status: " + raw);
    }
}
