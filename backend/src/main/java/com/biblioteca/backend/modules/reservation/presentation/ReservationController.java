package com.biblioteca.backend.modules.reservation.presentation;

import java.util.List;

import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.reservation.application.ReservationService;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;
import com.biblioteca.backend.modules.reservation.presentation.dto.NotifyAvailabilityRequest;
import com.biblioteca.backend.modules.reservation.presentation.dto.NotifyAvailabilityResponse;
import com.biblioteca.backend.modules.reservation.presentation.dto.ReservationCreateRequest;
import com.biblioteca.backend.modules.reservation.presentation.dto.ReservationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reservas")
@Tag(name = "Reservas")
@SecurityRequirement(name = "bearerAuth")
public class ReservationController {

    private final ReservationService reservationService;

    public ReservationController(ReservationService reservationService) {
        this.reservationService = reservationService;
    }

    @Operation(summary = "Reservar libro agotado", description = "Solo para libros sin copias disponibles y fuera de mantenimiento.")
    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody ReservationCreateRequest request
    ) {
        ReservationResponse response = reservationService.createReservation(principal.userId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Listar reservas", description = "Un usuario solo ve sus propias reservas.")
    @GetMapping
    public ResponseEntity<List<ReservationResponse>> listReservations(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "estado", required = false) String status,
            @RequestParam(name = "libro", required = false) Long bookId
    ) {
        return ResponseEntity.ok(reservationService.listReservations(principal, parseStatus(status), bookId));
    }

    @GetMapping("/mis-reservas")
    public ResponseEntity<List<ReservationResponse>> myReservations(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(reservationService.listOwnReservations(principal.userId()));
    }

    @Operation(summary = "Eliminar reserva", description = "Permitido solo al propietario o a un administrador.")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteReservation(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long reservationId
    ) {
        reservationService.cancelReservation(principal, reservationId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Notificar disponibilidad", description = "Notifica reservas pendientes en orden de prioridad hasta agotar las copias disponibles.")
    @PostMapping("/notificar-disponibilidad")
    public ResponseEntity<NotifyAvailabilityResponse> notifyAvailability(
            @RequestBody(required = false) NotifyAvailabilityRequest request
    ) {
        Long bookId = request == null ? null : request.libro();
        return ResponseEntity.ok(reservationService.notifyAvailability(bookId));
    }

    private ReservationStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ReservationStatus.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invalid_parameter", "Estado de reserva inválido: " + value);
        }
    }
}
