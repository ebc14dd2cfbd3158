package com.biblioteca.backend.global.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookSearchCondition;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.BookLoanCountView;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.biblioteca.backend.support.AbstractPostgresIntegrationTest;
import com.biblioteca.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

class PostgresSchemaIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private BookRepository bookRepository;

    @Autowired
    private LoanRepository loanRepository;

    @Test
    void flywayCreatesEveryTable() {
        List<String> tables = jdbcTemplate.queryForList("""
                SELECT table_name FROM information_schema.tables
                 WHERE table_schema = 'public' AND table_name IN ('library_user', 'book', 'loan', 'reservation')
                 ORDER BY table_name
                """, String.class);

        assertThat(tables).containsExactly("book", "library_user", "loan", "reservation");
    }

    @Test
    void copyCounterConstraintRejectsAvailableAboveTotal() {
        Book book = testUserFactory.createBook("Rayuela", 2, 2);

        assertThatThrownBy(() -> jdbcTemplate.update(
                "UPDATE book SET available_copies = 3 WHERE id = ?", book.getId()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void statusCodesAreStoredAsLowercaseWireValues() {
        Book book = testUserFactory.createBook("El Aleph", 1, 0);

        String stored = jdbcTemplate.queryForObject("SELECT status FROM book WHERE id = ?", String.class, book.getId());

        assertThat(stored).isEqualTo("agotado");
    }

    @Test
    void catalogSearchEscapesLikeWildcards() {
        testUserFactory.createBook("100% Borges", 1, 1);
        testUserFactory.createBook("1000 poemas", 1, 1);

        Page<Book> page = bookRepository.searchBooks(
                new BookSearchCondition(null, null, "100%", null), PageRequest.of(0, 10));

        assertThat(page.getContent()).extracting(Book::getTitle).containsExactly("100% Borges");
    }

    @Test
    void popularBooksProjectionRunsOnPostgres() {
        LibraryUser user = testUserFactory.createPatron("pg@example.com", "secreto123");
        Book book = testUserFactory.createBook("Ficciones", 2, 2);
        jdbcTemplate.update("""
                INSERT INTO loan (user_id, book_id, loaned_at, due_at, status, created_at, updated_at)
                VALUES (?, ?, now(), now() + interval '14 days', 'activo', now(), now())
                """, user.getId(), book.getId());

        List<BookLoanCountView> ranking = loanRepository.findMostLoanedBooks(PageRequest.of(0, 5));

        assertThat(ranking).hasSize(1);
        assertThat(ranking.get(0).loanCount()).isEqualTo(1L);
        assertThat(loanRepository.countByStatusNot(LoanStatus.DEVUELTO)).isEqualTo(1L);
    }
}
