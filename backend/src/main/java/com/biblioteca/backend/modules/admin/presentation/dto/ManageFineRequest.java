package com.biblioteca.backend.modules.admin.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ManageFineRequest(
        @NotBlank(message = "La acción es requerida") String accion,
        @NotNull(message = "El monto es requerido")
        @DecimalMin(value = "0.00", message = "El monto no puede ser negativo")
        @Digits(integer = 8, fraction = 2, message = "El monto admite hasta dos decimales") BigDecimal monto
) {
}
