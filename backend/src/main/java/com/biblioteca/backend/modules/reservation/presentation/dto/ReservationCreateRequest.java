package com.biblioteca.backend.modules.reservation.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record ReservationCreateRequest(
        @NotNull(message = "El libro es requerido") Long libro
) {
}
