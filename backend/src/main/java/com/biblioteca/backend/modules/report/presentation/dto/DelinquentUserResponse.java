package com.biblioteca.backend.modules.report.presentation.dto;

import java.math.BigDecimal;

public record DelinquentUserResponse(
        Long id,
        String nombreCompleto,
        String correo,
        String telefono,
        BigDecimal multas,
        long prestamosVencidos
) {
}
