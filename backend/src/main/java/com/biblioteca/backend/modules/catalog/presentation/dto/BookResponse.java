package com.biblioteca.backend.modules.catalog.presentation.dto;

import java.time.OffsetDateTime;

import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.domain.BookStatus;

public record BookResponse(
        Long id,
        String titulo,
        String autor,
        String isbn,
        String categoria,
        String editorial,
        int anioPublicacion,
        int copiasDisponibles,
        int copiasTotal,
        String ubicacion,
        BookStatus estado,
        String descripcion,
        OffsetDateTime fechaIngreso
) {

    public static BookResponse from(Book book) {
        return new BookResponse(
                book.getId(),
                book.getTitle(),
                book.getAuthor(),
                book.getIsbn(),
                book.getCategory(),
                book.getPublisher(),
                book.getPublicationYear(),
                book.getAvailableCopies(),
                book.getTotalCopies(),
                book.getLocation(),
                book.getStatus(),
                book.getDescription(),
                book.getAddedAt()
        );
    }
}
