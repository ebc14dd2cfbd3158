package com.biblioteca.backend.modules.reservation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.biblioteca.backend.global.config.BibliotecaProperties;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.domain.BookStatus;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.reservation.domain.Reservation;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;
import com.biblioteca.backend.modules.reservation.infrastructure.persistence.ReservationRepository;
import com.biblioteca.backend.modules.reservation.presentation.dto.NotifyAvailabilityResponse;
import com.biblioteca.backend.modules.reservation.presentation.dto.ReservationCreateRequest;
import com.biblioteca.backend.modules.reservation.presentation.dto.ReservationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Waiting queues for books without available copies.
 *
 * <p>Each book has its own queue made of its {@code pendiente} and {@code notificada} reservations.
 * Whenever a reservation leaves the queue the remaining ones are renumbered 1..n so priorities stay
 * contiguous.</p>
 */
@Service
@Transactional
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);
    private static final Set<ReservationStatus> PENDING_ONLY = EnumSet.of(ReservationStatus.PENDIENTE);

    private final ReservationRepository reservationRepository;
    private final BookRepository bookRepository;
    private final LibraryUserRepository libraryUserRepository;
    private final BibliotecaProperties properties;
    private final Clock clock;

    public ReservationService(
            ReservationRepository reservationRepository,
            BookRepository bookRepository,
            LibraryUserRepository libraryUserRepository,
            BibliotecaProperties properties,
            Clock clock
    ) {
        this.reservationRepository = reservationRepository;
        this.bookRepository = bookRepository;
        this.libraryUserRepository = libraryUserRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public ReservationResponse createReservation(Long userId, ReservationCreateRequest request) {
        LibraryUser user = libraryUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "reservation.user_not_found", "Usuario no encontrado"));
        Book book = bookRepository.findByIdForUpdate(request.libro())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "catalog.book_not_found", "Libro no encontrado: " + request.libro()));

        if (book.getStatus() == BookStatus.EN_MANTENIMIENTO) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "reservation.book_in_maintenance",
                    "El libro está en mantenimiento y no puede ser reservado");
        }
        if (unheldCopies(book) > 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "reservation.not_required",
                    "El libro tiene copias disponibles. No se requiere reserva.");
        }
        if (reservationRepository.existsByUserIdAndBookIdAndStatusIn(userId, book.getId(), ReservationStatus.ACTIVE)) {
            throw new ProblemException(HttpStatus.CONFLICT, "reservation.duplicate",
                    "Ya tiene una reserva activa para este libro");
        }

        int priority = (int) reservationRepository.countByBookIdAndStatusIn(book.getId(), ReservationStatus.ACTIVE) + 1;
        Reservation saved = reservationRepository.save(
                Reservation.enqueue(user, book, OffsetDateTime.now(clock), priority));
        log.info("Reservation id={} created for user={} book={} priority={}", saved.getId(), userId, book.getId(), priority);
        return ReservationResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listReservations(JwtAuthenticationPrincipal principal, ReservationStatus status, Long bookId) {
        Long userFilter = principal.isStaff() ? null : principal.userId();
        return reservationRepository.search(userFilter, bookId, status).stream()
                .map(ReservationResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> listOwnReservations(Long userId) {
        return reservationRepository.findByUserWithBook(userId).stream()
                .map(ReservationResponse::from)
                .toList();
    }

    /**
     * Removes the reservation. Only its owner or an admin may do so; librarians are refused.
     */
    public void cancelReservation(JwtAuthenticationPrincipal principal, Long reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "reservation.not_found", "Reserva no encontrada"));
        boolean owner = reservation.getUser().getId().equals(principal.userId());
        if (!owner && !principal.isAdmin()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "reservation.forbidden",
                    "Solo el propietario o un administrador puede eliminar esta reserva");
        }

        Book book = reservation.getBook();
        boolean wasNotified = reservation.getStatus() == ReservationStatus.NOTIFICADA;
        reservationRepository.delete(reservation);
        renumberQueue(book.getId());
        if (wasNotified) {
            notifyNextPending(book);
        }
        log.info("Reservation id={} deleted by user={}", reservationId, principal.userId());
    }

    /**
     * Notifies pending reservations of one book, or of every book with pending reservations when
     * {@code bookId} is null. Copies already held by a {@code notificada} reservation are not offered again.
     */
    public NotifyAvailabilityResponse notifyAvailability(Long bookId) {
        Set<Long> bookIds = new LinkedHashSet<>();
        if (bookId != null) {
            bookRepository.findById(bookId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "catalog.book_not_found", "Libro no encontrado: " + bookId));
            bookIds.add(bookId);
        } else {
            bookIds.addAll(reservationRepository.findBookIdsWithStatus(ReservationStatus.PENDIENTE));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Reservation> notified = new ArrayList<>();
        for (Long id : bookIds) {
            Optional<Book> book = bookRepository.findById(id);
            if (book.isEmpty()) {
                continue;
            }
            int free = unheldCopies(book.get());
            if (free == 0) {
                continue;
            }
            List<Reservation> pending = reservationRepository.findQueue(id, PENDING_ONLY);
            int slots = Math.min(free, pending.size());
            for (Reservation reservation : pending.subList(0, slots)) {
                reservation.markNotified(now, holdExpiry(now));
                notified.add(reservation);
            }
        }
        log.info("Availability notification: books={} reservations notified={}", bookIds.size(), notified.size());
        return new NotifyAvailabilityResponse(
                notified.size(),
                notified.stream().map(ReservationResponse::from).toList()
        );
    }

    /**
     * Notifies the first pending reservation of {@code book} when a copy is free of holds.
     */
    public Optional<Reservation> notifyNextPending(Book book) {
        if (unheldCopies(book) == 0) {
            return Optional.empty();
        }
        List<Reservation> pending = reservationRepository.findQueue(book.getId(), PENDING_ONLY);
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Reservation next = pending.get(0);
        next.markNotified(now, holdExpiry(now));
        log.info("Reservation id={} notified for book={} (expires {})", next.getId(), book.getId(), next.getExpiresAt());
        return Optional.of(next);
    }

    /**
     * Marks the borrower's active reservation for the book as fulfilled by a loan.
     */
    public void completeReservationFor(Long userId, Long bookId) {
        List<Reservation> held = reservationRepository.findByUserIdAndBookIdAndStatusIn(userId, bookId, ReservationStatus.ACTIVE);
        if (held.isEmpty()) {
            return;
        }
        held.forEach(Reservation::markCompleted);
        renumberQueue(bookId);
        log.info("Reservation(s) {} completed by loan for user={} book={}",
                held.stream().map(Reservation::getId).toList(), userId, bookId);
    }

    /**
     * Cancels notified reservations whose hold window has passed and hands the copy to the next in line.
     *
     * @return number of reservations cancelled
     */
    public int expireNotifiedReservations() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Reservation> expired = reservationRepository.findExpired(ReservationStatus.NOTIFICADA, now);
        if (expired.isEmpty()) {
            return 0;
        }
        Set<Book> affectedBooks = new LinkedHashSet<>();
        for (Reservation reservation : expired) {
            reservation.markCancelled();
            affectedBooks.add(reservation.getBook());
        }
        for (Book book : affectedBooks) {
            renumberQueue(book.getId());
            notifyNextPending(book);
        }
        return expired.size();
    }

    void renumberQueue(Long bookId) {
        List<Reservation> queue = reservationRepository.findQueue(bookId, ReservationStatus.ACTIVE);
        int position = 1;
        for (Reservation reservation : queue) {
            reservation.setPriority(position++);
        }
    }

    /**
     * Available copies not already promised to a notified reservation.
     */
    private int unheldCopies(Book book) {
        long held = reservationRepository.countByBookIdAndStatus(book.getId(), ReservationStatus.NOTIFICADA);
        return (int) Math.max(0, book.getAvailableCopies() - held);
    }

    private OffsetDateTime holdExpiry(OffsetDateTime now) {
        return now.plusHours(properties.getReservations().getHoldHours());
    }
}
