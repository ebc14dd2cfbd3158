package com.biblioteca.backend.modules.catalog.presentation.dto;

import com.biblioteca.backend.modules.catalog.domain.BookStatus;
import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BookCreateRequest(
        @NotBlank(message = "El título es requerido") @Size(max = 200) String titulo,
        @NotBlank(message = "El autor es requerido") @Size(max = 100) String autor,
        @NotBlank(message = "El ISBN es requerido") @Size(max = 20) String isbn,
        @NotBlank(message = "La categoría es requerida") @Size(max = 100) String categoria,
        @NotBlank(message = "La editorial es requerida") @Size(max = 100) String editorial,
        @JsonAlias("añoPublicacion")
        @NotNull(message = "El año de publicación es requerido") @Min(0) @Max(9999) Integer anioPublicacion,
        @NotNull(message = "El total de copias es requerido") @Min(value = 0, message = "No puede ser negativo") Integer copiasTotal,
        @Min(value = 0, message = "No puede ser negativo") Integer copiasDisponibles,
        @NotBlank(message = "La ubicación es requerida") @Size(max = 100) String ubicacion,
        BookStatus estado,
        @Size(max = 4000) String descripcion
) {
}
