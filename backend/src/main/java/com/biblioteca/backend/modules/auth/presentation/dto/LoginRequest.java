package com.biblioteca.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "Correo y contraseña son requeridos") String correo,
        @JsonProperty("contraseña") @JsonAlias("password")
        @NotBlank(message = "Correo y contraseña son requeridos") String password
) {
}
