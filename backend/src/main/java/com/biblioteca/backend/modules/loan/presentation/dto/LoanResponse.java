package com.biblioteca.backend.modules.loan.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.biblioteca.backend.modules.loan.domain.Loan;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;

public record LoanResponse(
        Long id,
        Long usuario,
        String usuarioNombre,
        Long libro,
        String libroTitulo,
        String libroAutor,
        OffsetDateTime fechaPrestamo,
        OffsetDateTime fechaDevolucionEsperada,
        OffsetDateTime fechaDevolucionReal,
        int diasRetraso,
        BigDecimal multaGenerada,
        LoanStatus estado,
        int renovaciones,
        Long registradoPor
) {

    public static LoanResponse from(Loan loan) {
        return new LoanResponse(
                loan.getId(),
                loan.getUser().getId(),
                loan.getUser().getFullName(),
                loan.getBook().getId(),
                loan.getBook().getTitle(),
                loan.getBook().getAuthor(),
                loan.getLoanedAt(),
                loan.getDueAt(),
                loan.getReturnedAt(),
                loan.getDaysOverdue(),
                loan.getFineAmount(),
                loan.getStatus(),
                loan.getRenewals(),
                loan.getCreatedBy()
        );
    }
}
