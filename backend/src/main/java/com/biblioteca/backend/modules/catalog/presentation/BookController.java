package com.biblioteca.backend.modules.catalog.presentation;

import java.util.List;

import com.biblioteca.backend.modules.catalog.application.BookService;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookSearchCondition;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookCreateRequest;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookListResponse;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookResponse;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/libros")
@Tag(name = "Libros")
@SecurityRequirement(name = "bearerAuth")
public class BookController {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_PAGE = Integer.MAX_VALUE / MAX_PAGE_SIZE;

    private final BookService bookService;

    public BookController(BookService bookService) {
        this.bookService = bookService;
    }

    @Operation(summary = "Catálogo de libros", description = "Filtra por categoría exacta, autor/título parcial y disponibilidad. Ordenado por título.")
    @GetMapping
    public ResponseEntity<BookListResponse> listBooks(
            @RequestParam(name = "categoria", required = false) String category,
            @RequestParam(name = "autor", required = false) String author,
            @RequestParam(name = "titulo", required = false) String title,
            @RequestParam(name = "disponible", required = false) Boolean available,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.min(Math.max(page, 0), MAX_PAGE);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        Page<Book> result = bookService.searchBooks(
                new BookSearchCondition(category, author, title, available),
                PageRequest.of(safePage, safeSize)
        );
        List<BookResponse> items = result.getContent().stream()
                .map(BookResponse::from)
                .toList();
        return ResponseEntity.ok(new BookListResponse(
                items,
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BookResponse> getBook(@PathVariable("id") Long bookId) {
        return ResponseEntity.ok(BookResponse.from(bookService.getBook(bookId)));
    }

    @Operation(summary = "Registrar libro", description = "Solo bibliotecario o admin. `copiasDisponibles` toma `copiasTotal` si se omite.")
    @PostMapping
    public ResponseEntity<BookResponse> createBook(@Valid @RequestBody BookCreateRequest request) {
        Book book = bookService.createBook(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BookResponse.from(book));
    }

    @Operation(summary = "Actualizar libro", description = "Actualización parcial; los campos omitidos conservan su valor.")
    @PutMapping("/{id}")
    public ResponseEntity<BookResponse> updateBook(
            @PathVariable("id") Long bookId,
            @Valid @RequestBody BookUpdateRequest request
    ) {
        return ResponseEntity.ok(BookResponse.from(bookService.updateBook(bookId, request)));
    }

    @Operation(summary = "Eliminar libro", description = "Rechazado con 409 mientras existan préstamos sin devolver.")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBook(@PathVariable("id") Long bookId) {
        bookService.deleteBook(bookId);
        return ResponseEntity.noContent().build();
    }
}
