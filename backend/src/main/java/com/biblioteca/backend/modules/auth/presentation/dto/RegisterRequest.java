package com.biblioteca.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "El nombre es requerido") @Size(max = 100) String nombre,
        @NotBlank(message = "El apellido es requerido") @Size(max = 100) String apellido,
        @NotBlank(message = "El correo es requerido") @Email(message = "Correo electrónico inválido") @Size(max = 254) String correo,
        @JsonProperty("contraseña") @JsonAlias("password")
        @NotBlank(message = "La contraseña es requerida")
        @Size(min = 6, max = 128, message = "La contraseña debe tener al menos 6 caracteres") String password,
        @NotNull(message = "La edad es requerida") @Min(1) @Max(150) Integer edad,
        @NotBlank(message = "El número de identidad es requerido") @Size(max = 50) String numeroIdentidad,
        @NotBlank(message = "El teléfono es requerido") @Size(max = 20) String telefono
) {
}
