package com.biblioteca.backend.modules.catalog.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.biblioteca.backend.global.error.FieldValidationException;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.domain.BookStatus;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookSearchCondition;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookCreateRequest;
import com.biblioteca.backend.modules.catalog.presentation.dto.BookUpdateRequest;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.biblioteca.backend.modules.reservation.infrastructure.persistence.ReservationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final ReservationRepository reservationRepository;
    private final Clock clock;

    public BookService(
            BookRepository bookRepository,
            LoanRepository loanRepository,
            ReservationRepository reservationRepository,
            Clock clock
    ) {
        this.bookRepository = bookRepository;
        this.loanRepository = loanRepository;
        this.reservationRepository = reservationRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Page<Book> searchBooks(BookSearchCondition condition, Pageable pageable) {
        return bookRepository.searchBooks(condition, pageable);
    }

    @Transactional(readOnly = true)
    public Book getBook(Long bookId) {
        return bookRepository.findById(bookId).orElseThrow(() -> bookNotFound(bookId));
    }

    public Book createBook(BookCreateRequest request) {
        String isbn = request.isbn().trim();
        if (bookRepository.existsByIsbn(isbn)) {
            throw new ProblemException(HttpStatus.CONFLICT, "catalog.isbn_duplicate", "Ya existe un libro con este ISBN");
        }
        int total = request.copiasTotal();
        int available = request.copiasDisponibles() != null ? request.copiasDisponibles() : total;
        if (available > total) {
            throw FieldValidationException.of("copiasDisponibles", "No puede exceder el total de copias");
        }

        Book book = new Book();
        book.setTitle(request.titulo().trim());
        book.setAuthor(request.autor().trim());
        book.setIsbn(isbn);
        book.setCategory(request.categoria().trim());
        book.setPublisher(request.editorial().trim());
        book.setPublicationYear(request.anioPublicacion());
        book.setLocation(request.ubicacion().trim());
        book.setDescription(request.descripcion());
        book.setAddedAt(OffsetDateTime.now(clock));
        book.setStatus(request.estado() != null ? request.estado() : BookStatus.DISPONIBLE);
        book.changeCopies(total, available);

        Book saved = bookRepository.save(book);
        log.info("Created book id={} isbn={} copies={}/{}", saved.getId(), saved.getIsbn(),
                saved.getAvailableCopies(), saved.getTotalCopies());
        return saved;
    }

    public Book updateBook(Long bookId, BookUpdateRequest request) {
        Book book = bookRepository.findByIdForUpdate(bookId).orElseThrow(() -> bookNotFound(bookId));

        if (request.isbn() != null) {
            String isbn = request.isbn().trim();
            if (!isbn.equals(book.getIsbn()) && bookRepository.existsByIsbnAndIdNot(isbn, bookId)) {
                throw new ProblemException(HttpStatus.CONFLICT, "catalog.isbn_duplicate", "Ya existe un libro con este ISBN");
            }
            book.setIsbn(isbn);
        }
        if (request.titulo() != null) {
            book.setTitle(request.titulo().trim());
        }
        if (request.autor() != null) {
            book.setAuthor(request.autor().trim());
        }
        if (request.categoria() != null) {
            book.setCategory(request.categoria().trim());
        }
        if (request.editorial() != null) {
            book.setPublisher(request.editorial().trim());
        }
        if (request.anioPublicacion() != null) {
            book.setPublicationYear(request.anioPublicacion());
        }
        if (request.ubicacion() != null) {
            book.setLocation(request.ubicacion().trim());
        }
        if (request.descripcion() != null) {
            book.setDescription(request.descripcion());
        }
        if (request.estado() != null) {
            book.setStatus(request.estado());
        }

        if (request.copiasTotal() != null || request.copiasDisponibles() != null) {
            int onLoan = book.getCopiesOnLoan();
            int total = request.copiasTotal() != null ? request.copiasTotal() : book.getTotalCopies();
            if (total < onLoan) {
                throw FieldValidationException.of("copiasTotal",
                        "No puede ser menor que " + onLoan + " (copias actualmente prestadas)");
            }
            // Without an explicit value the copies on loan stay on loan.
            int available = request.copiasDisponibles() != null ? request.copiasDisponibles() : total - onLoan;
            if (available > total) {
                throw FieldValidationException.of("copiasDisponibles", "No puede exceder el total de copias");
            }
            book.changeCopies(total, available);
        }

        log.info("Updated book id={} copies={}/{} status={}", book.getId(), book.getAvailableCopies(),
                book.getTotalCopies(), book.getStatus().getCode());
        return book;
    }

    public void deleteBook(Long bookId) {
        Book book = bookRepository.findByIdForUpdate(bookId).orElseThrow(() -> bookNotFound(bookId));
        if (loanRepository.existsByBookIdAndStatusNot(bookId, LoanStatus.DEVUELTO)) {
            throw new ProblemException(HttpStatus.CONFLICT, "catalog.book_has_active_loans",
                    "No se puede eliminar un libro con préstamos activos");
        }
        int removedReservations = reservationRepository.deleteByBookId(bookId);
        int removedLoans = loanRepository.deleteByBookId(bookId);
        bookRepository.delete(book);
        log.info("Deleted book id={} isbn={} (returned loans removed={}, reservations removed={})",
                bookId, book.getIsbn(), removedLoans, removedReservations);
    }

    static ProblemException bookNotFound(Long bookId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "catalog.book_not_found", "Libro no encontrado: " + bookId);
    }
}
