package com.biblioteca.backend.modules.reservation.presentation.dto;

public record NotifyAvailabilityRequest(Long libro) {
}
