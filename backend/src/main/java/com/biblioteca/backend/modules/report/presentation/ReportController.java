package com.biblioteca.backend.modules.report.presentation;

import java.util.List;

import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.report.application.ReportService;
import com.biblioteca.backend.modules.report.presentation.dto.DelinquentUserResponse;
import com.biblioteca.backend.modules.report.presentation.dto.LoanHistoryResponse;
import com.biblioteca.backend.modules.report.presentation.dto.PopularBookResponse;
import com.biblioteca.backend.modules.report.presentation.dto.StatisticsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Reportes")
@SecurityRequirement(name = "bearerAuth")
public class ReportController {

    private static final int MAX_POPULAR_LIMIT = 50;

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @Operation(summary = "Usuarios morosos", description = "Usuarios con multas o préstamos vencidos, ordenados por multa descendente.")
    @GetMapping("/reportes/usuarios-morosos")
    public ResponseEntity<List<DelinquentUserResponse>> delinquentUsers() {
        return ResponseEntity.ok(reportService.delinquentUsers());
    }

    @Operation(summary = "Libros más prestados")
    @GetMapping("/reportes/libros-populares")
    public ResponseEntity<List<PopularBookResponse>> popularBooks(
            @RequestParam(name = "limite", defaultValue = "10") int limit
    ) {
        int safeLimit = Math.min(Math.max(limit, 1), MAX_POPULAR_LIMIT);
        return ResponseEntity.ok(reportService.popularBooks(safeLimit));
    }

    @GetMapping("/reportes/mi-historial")
    public ResponseEntity<LoanHistoryResponse> myHistory(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(reportService.loanHistory(principal.userId()));
    }

    @Operation(summary = "Estadísticas generales")
    @GetMapping("/estadisticas")
    public ResponseEntity<StatisticsResponse> statistics() {
        return ResponseEntity.ok(reportService.statistics());
    }
}
