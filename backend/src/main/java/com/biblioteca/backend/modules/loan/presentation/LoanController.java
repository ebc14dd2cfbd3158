package com.biblioteca.backend.modules.loan.presentation;

import java.util.List;

import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.loan.application.LoanService;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanCreateRequest;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/prestamos")
@Tag(name = "Préstamos")
@SecurityRequirement(name = "bearerAuth")
public class LoanController {

    private final LoanService loanService;

    public LoanController(LoanService loanService) {
        this.loanService = loanService;
    }

    @Operation(summary = "Registrar préstamo", description = "Descuenta una copia disponible. `usuario` solo aplica para bibliotecario/admin.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Préstamo creado"),
            @ApiResponse(responseCode = "400", description = "Libro sin copias o fecha de devolución inválida"),
            @ApiResponse(responseCode = "409", description = "Límite de préstamos o multas pendientes")
    })
    @PostMapping
    public ResponseEntity<LoanResponse> createLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody LoanCreateRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(loanService.createLoan(principal, request));
    }

    @Operation(summary = "Listar préstamos", description = "Un usuario solo ve sus propios préstamos.")
    @GetMapping
    public ResponseEntity<List<LoanResponse>> listLoans(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "estado", required = false) String status,
            @RequestParam(name = "usuario", required = false) Long userId
    ) {
        return ResponseEntity.ok(loanService.listLoans(principal, parseStatus(status), userId));
    }

    @GetMapping("/vencidos")
    public ResponseEntity<List<LoanResponse>> overdueLoans() {
        return ResponseEntity.ok(loanService.listOverdueLoans());
    }

    @Operation(summary = "Devolver préstamo", description = "Calcula días de retraso y multa; libera la copia.")
    @PutMapping("/{id}/devolver")
    public ResponseEntity<LoanResponse> returnLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long loanId
    ) {
        return ResponseEntity.ok(loanService.returnLoan(principal, loanId));
    }

    @Operation(summary = "Renovar préstamo")
    @PutMapping("/{id}/renovar")
    public ResponseEntity<LoanResponse> renewLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("id") Long loanId
    ) {
        return ResponseEntity.ok(loanService.renewLoan(principal, loanId));
    }

    private LoanStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LoanStatus.fromCode(value);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "invalid_parameter", "Estado de préstamo inválido: " + value);
        }
    }
}
