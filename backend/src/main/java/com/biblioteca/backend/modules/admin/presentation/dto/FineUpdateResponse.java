package com.biblioteca.backend.modules.admin.presentation.dto;

import java.math.BigDecimal;

import com.biblioteca.backend.modules.admin.domain.FineAction;
import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

public record FineUpdateResponse(
        FineAction accion,
        BigDecimal monto,
        BigDecimal multasAnteriores,
        UserResponse usuario
) {
}
