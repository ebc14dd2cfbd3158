package com.biblioteca.backend.modules.catalog.presentation.dto;

import com.biblioteca.backend.modules.catalog.domain.BookStatus;
import com.fasterxml.jackson.annotation.JsonAlias;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record BookUpdateRequest(
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 200) String titulo,
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 100) String autor,
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 20) String isbn,
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 100) String categoria,
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 100) String editorial,
        @JsonAlias("añoPublicacion") @Min(0) @Max(9999) Integer anioPublicacion,
        @Min(value = 0, message = "No puede ser negativo") Integer copiasTotal,
        @Min(value = 0, message = "No puede ser negativo") Integer copiasDisponibles,
        @Pattern(regexp = ".*\\S.*", message = "No puede estar vacío") @Size(max = 100) String ubicacion,
        BookStatus estado,
        @Size(max = 4000) String descripcion
) {
}
