package com.biblioteca.backend.modules.auth.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;

public record UserResponse(
        Long id,
        String nombre,
        String apellido,
        String nombreCompleto,
        String correo,
        int edad,
        String numeroIdentidad,
        String telefono,
        UserRole rol,
        boolean activo,
        OffsetDateTime fechaRegistro,
        BigDecimal multas
) {

    public static UserResponse from(LibraryUser user) {
        return new UserResponse(
                user.getId(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getEmail(),
                user.getAge(),
                user.getIdentityNumber(),
                user.getPhone(),
                user.getRole(),
                user.isActive(),
                user.getRegisteredAt(),
                user.getFines()
        );
    }
}
