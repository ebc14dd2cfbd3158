package com.biblioteca.backend.modules.reservation.presentation.dto;

import java.util.List;

public record NotifyAvailabilityResponse(int notificadas, List<ReservationResponse> reservas) {
}
