package com.biblioteca.backend.modules.reservation.domain;

import java.time.OffsetDateTime;

import com.biblioteca.backend.global.jpa.AbstractTimestampedEntity;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.catalog.domain.Book;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A place in a book's waiting queue. {@code priority} is 1-based among the book's
 * {@link ReservationStatus#ACTIVE active} reservations.
 */
@Entity
@Table(name = "reservation")
public class Reservation extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private LibraryUser user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "reserved_at", nullable = false, updatable = false)
    private OffsetDateTime reservedAt;

    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status = ReservationStatus.PENDIENTE;

    @Column(name = "notified_at")
    private OffsetDateTime notifiedAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "priority", nullable = false)
    private int priority = 1;

    public static Reservation enqueue(LibraryUser user, Book book, OffsetDateTime reservedAt, int priority) {
        Reservation reservation = new Reservation();
        reservation.user = user;
        reservation.book = book;
        reservation.reservedAt = reservedAt;
        reservation.priority = priority;
        reservation.status = ReservationStatus.PENDIENTE;
        return reservation;
    }

    public Long getId() {
        return id;
    }

    public LibraryUser getUser() {
        return user;
    }

    public Book getBook() {
        return book;
    }

    public OffsetDateTime getReservedAt() {
        return reservedAt;
    }

    public ReservationStatus getStatus() {
        return status;
    }

    public OffsetDateTime getNotifiedAt() {
        return notifiedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isActive() {
        return ReservationStatus.ACTIVE.contains(status);
    }

    public void markNotified(OffsetDateTime now, OffsetDateTime expiresAt) {
        this.status = ReservationStatus.NOTIFICADA;
        this.notifiedAt = now;
        this.expiresAt = expiresAt;
    }

    public void markCompleted() {
        this.status = ReservationStatus.COMPLETADA;
    }

    public void markCancelled() {
        this.status = ReservationStatus.CANCELADA;
    }
}
