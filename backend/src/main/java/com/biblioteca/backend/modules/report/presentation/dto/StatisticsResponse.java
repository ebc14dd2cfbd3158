package com.biblioteca.backend.modules.report.presentation.dto;

import java.math.BigDecimal;

public record StatisticsResponse(
        long totalUsuarios,
        long usuariosActivos,
        long totalLibros,
        long copiasTotales,
        long copiasDisponibles,
        long prestamosActivos,
        long prestamosVencidos,
        long reservasPendientes,
        BigDecimal multasPendientes
) {
}
