package com.biblioteca.backend.modules.loan.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.biblioteca.backend.modules.loan.domain.Loan;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LoanRepository extends JpaRepository<Loan, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from Loan l where l.id = :id")
    Optional<Loan> findByIdForUpdate(@Param("id") Long id);

    boolean existsByBookIdAndStatusNot(Long bookId, LoanStatus status);

    long countByUserIdAndStatusNot(Long userId, LoanStatus status);

    long countByStatusNot(LoanStatus status);

    @Modifying
    @Query("delete from Loan l where l.book.id = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);

    @Query("""
            select l
              from Loan l
              join fetch l.user u
              join fetch l.book b
             where (:userId is null or u.id = :userId)
               and (:status is null or l.status = :status)
             order by l.loanedAt desc, l.id desc
            """)
    List<Loan> search(@Param("userId") Long userId, @Param("status") LoanStatus status);

    @Query("""
            select l
              from Loan l
              join fetch l.user u
              join fetch l.book b
             where l.status <> :returned
               and l.dueAt < :now
             order by l.dueAt asc, l.id asc
            """)
    List<Loan> findOverdue(@Param("returned") LoanStatus returned, @Param("now") OffsetDateTime now);

    @Query("select l from Loan l where l.status = :status and l.dueAt < :now")
    List<Loan> findByStatusAndDueBefore(@Param("status") LoanStatus status, @Param("now") OffsetDateTime now);

    @Query("select count(l) from Loan l where l.status <> :returned and l.dueAt < :now")
    long countOverdue(@Param("returned") LoanStatus returned, @Param("now") OffsetDateTime now);

    @Query("""
            select new com.biblioteca.backend.modules.loan.infrastructure.persistence.BookLoanCountView(
                       b.id, b.title, b.author, count(l))
              from Loan l
              join l.book b
             group by b.id, b.title, b.author
             order by count(l) desc, b.title asc
            """)
    List<BookLoanCountView> findMostLoanedBooks(Pageable pageable);

    @Query("""
            select new com.biblioteca.backend.modules.loan.infrastructure.persistence.UserOverdueCountView(
                       l.user.id, count(l))
              from Loan l
             where l.status <> :returned
               and l.dueAt < :now
             group by l.user.id
            """)
    List<UserOverdueCountView> countOverdueByUser(@Param("returned") LoanStatus returned, @Param("now") OffsetDateTime now);
}
