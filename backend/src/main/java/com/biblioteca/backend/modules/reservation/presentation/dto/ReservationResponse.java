package com.biblioteca.backend.modules.reservation.presentation.dto;

import java.time.OffsetDateTime;

import com.biblioteca.backend.modules.reservation.domain.Reservation;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;

public record ReservationResponse(
        Long id,
        Long usuario,
        String usuarioNombre,
        Long libro,
        String libroTitulo,
        String libroAutor,
        OffsetDateTime fechaReserva,
        ReservationStatus estado,
        OffsetDateTime fechaNotificacion,
        OffsetDateTime fechaExpiracion,
        int prioridad
) {

    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getUser().getId(),
                reservation.getUser().getFullName(),
                reservation.getBook().getId(),
                reservation.getBook().getTitle(),
                reservation.getBook().getAuthor(),
                reservation.getReservedAt(),
                reservation.getStatus(),
                reservation.getNotifiedAt(),
                reservation.getExpiresAt(),
                reservation.getPriority()
        );
    }
}
