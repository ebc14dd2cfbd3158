package com.biblioteca.backend.modules.report.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.biblioteca.backend.modules.loan.presentation.dto.LoanResponse;

public record LoanHistoryResponse(
        long totalPrestamos,
        long prestamosActivos,
        BigDecimal totalMultasGeneradas,
        BigDecimal multasPendientes,
        List<LoanResponse> prestamos
) {
}
