package com.biblioteca.backend.modules.loan.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotNull;

/**
 * {@code usuario} lets staff register a loan on behalf of a patron; it is ignored for regular users.
 */
public record LoanCreateRequest(
        @NotNull(message = "El libro es requerido") Long libro,
        OffsetDateTime fechaDevolucionEsperada,
        Long usuario
) {
}
