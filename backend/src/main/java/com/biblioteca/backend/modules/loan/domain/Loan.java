package com.biblioteca.backend.modules.loan.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
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

import org.springframework.data.annotation.CreatedBy;

@Entity
@Table(name = "loan")
public class Loan extends AbstractTimestampedEntity {

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

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

    @Column(name = "loaned_at", nullable = false, updatable = false)
    private OffsetDateTime loanedAt;

    @Column(name = "due_at", nullable = false)
    private OffsetDateTime dueAt;

    @Column(name = "returned_at")
    private OffsetDateTime returnedAt;

    @Column(name = "days_overdue", nullable = false)
    private int daysOverdue;

    @Column(name = "fine_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal fineAmount = BigDecimal.ZERO.setScale(2);

    @Column(name = "status", nullable = false, length = 20)
    private LoanStatus status = LoanStatus.ACTIVO;

    @Column(name = "renewals", nullable = false)
    private int renewals;

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private Long createdBy;

    public static Loan open(LibraryUser user, Book book, OffsetDateTime loanedAt, OffsetDateTime dueAt) {
        Loan loan = new Loan();
        loan.user = user;
        loan.book = book;
        loan.loanedAt = loanedAt;
        loan.dueAt = dueAt;
        loan.status = LoanStatus.ACTIVO;
        return loan;
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

    public OffsetDateTime getLoanedAt() {
        return loanedAt;
    }

    public OffsetDateTime getDueAt() {
        return dueAt;
    }

    public OffsetDateTime getReturnedAt() {
        return returnedAt;
    }

    public int getDaysOverdue() {
        return daysOverdue;
    }

    public BigDecimal getFineAmount() {
        return fineAmount;
    }

    public LoanStatus getStatus() {
        return status;
    }

    public int getRenewals() {
        return renewals;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public boolean isReturned() {
        return status == LoanStatus.DEVUELTO;
    }

    public boolean isOverdueAt(OffsetDateTime now) {
        return status == LoanStatus.VENCIDO || (!isReturned() && now.isAfter(dueAt));
    }

    /**
     * Closes the loan at {@code now}. Late days are whole days past the due date rounded up.
     *
     * @return the fine generated by this return
     */
    public BigDecimal markReturned(OffsetDateTime now, BigDecimal dailyFine) {
        if (isReturned()) {
            throw new IllegalStateException("Loan " + id + " already returned");
        }
        long lateSeconds = Duration.between(dueAt, now).getSeconds();
        int lateDays = lateSeconds <= 0 ? 0 : (int) ((lateSeconds + SECONDS_PER_DAY - 1) / SECONDS_PER_DAY);

        this.returnedAt = now;
        this.daysOverdue = lateDays;
        this.fineAmount = dailyFine.multiply(BigDecimal.valueOf(lateDays)).setScale(2, RoundingMode.HALF_UP);
        this.status = LoanStatus.DEVUELTO;
        return fineAmount;
    }

    public void renew(int extraDays) {
        this.dueAt = dueAt.plusDays(extraDays);
        this.renewals++;
    }

    public void markOverdue() {
        if (status == LoanStatus.ACTIVO) {
            this.status = LoanStatus.VENCIDO;
        }
    }
}
