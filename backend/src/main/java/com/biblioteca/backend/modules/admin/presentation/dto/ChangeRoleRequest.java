package com.biblioteca.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ChangeRoleRequest(
        @NotBlank(message = "El rol es requerido") String rol
) {
}
