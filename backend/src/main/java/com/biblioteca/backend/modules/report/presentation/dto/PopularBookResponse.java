package com.biblioteca.backend.modules.report.presentation.dto;

public record PopularBookResponse(Long libro, String titulo, String autor, long totalPrestamos) {
}
