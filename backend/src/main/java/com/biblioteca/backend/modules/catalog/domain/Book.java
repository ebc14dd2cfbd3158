package com.biblioteca.backend.modules.catalog.domain;

import java.time.OffsetDateTime;

import com.biblioteca.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Catalog title together with its copy counters.
 *
 * <p>{@code availableCopies} never exceeds {@code totalCopies}. Every change to the counters goes
 * through {@link #checkOutCopy()}, {@link #returnCopy()} or {@link #changeCopies(int, int)}, which
 * re-derive the status afterwards.</p>
 */
@Entity
@Table(name = "book")
public class Book extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "author", nullable = false, length = 100)
    private String author;

    @Column(name = "isbn", nullable = false, unique = true, length = 20)
    private String isbn;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "publisher", nullable = false, length = 100)
    private String publisher;

    @Column(name = "publication_year", nullable = false)
    private int publicationYear;

    @Column(name = "total_copies", nullable = false)
    private int totalCopies;

    @Column(name = "available_copies", nullable = false)
    private int availableCopies;

    @Column(name = "location", nullable = false, length = 100)
    private String location;

    @Column(name = "status", nullable = false, length = 20)
    private BookStatus status = BookStatus.DISPONIBLE;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "added_at", nullable = false, updatable = false)
    private OffsetDateTime addedAt;

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getIsbn() {
        return isbn;
    }

    public void setIsbn(String isbn) {
        this.isbn = isbn;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getPublisher() {
        return publisher;
    }

    public void setPublisher(String publisher) {
        this.publisher = publisher;
    }

    public int getPublicationYear() {
        return publicationYear;
    }

    public void setPublicationYear(int publicationYear) {
        this.publicationYear = publicationYear;
    }

    public int getTotalCopies() {
        return totalCopies;
    }

    public int getAvailableCopies() {
        return availableCopies;
    }

    public int getCopiesOnLoan() {
        return totalCopies - availableCopies;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public BookStatus getStatus() {
        return status;
    }

    public void setStatus(BookStatus status) {
        this.status = status;
        applyStatusRule();
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public OffsetDateTime getAddedAt() {
        return addedAt;
    }

    public void setAddedAt(OffsetDateTime addedAt) {
        this.addedAt = addedAt;
    }

    public boolean isAvailableForLoan() {
        return availableCopies > 0 && status == BookStatus.DISPONIBLE;
    }

    public void changeCopies(int totalCopies, int availableCopies) {
        if (totalCopies < 0 || availableCopies < 0) {
            throw new IllegalArgumentException("Copy counters must not be negative");
        }
        if (availableCopies > totalCopies) {
            throw new IllegalArgumentException("availableCopies must not exceed totalCopies");
        }
        this.totalCopies = totalCopies;
        this.availableCopies = availableCopies;
        applyStatusRule();
    }

    public void checkOutCopy() {
        if (availableCopies <= 0) {
            throw new IllegalStateException("No copies available for book " + id);
        }
        availableCopies--;
        applyStatusRule();
    }

    public void returnCopy() {
        availableCopies = Math.min(availableCopies + 1, totalCopies);
        applyStatusRule();
    }

    private void applyStatusRule() {
        if (availableCopies == 0) {
            status = BookStatus.AGOTADO;
        } else if (status == BookStatus.AGOTADO) {
            status = BookStatus.DISPONIBLE;
        }
    }
}
