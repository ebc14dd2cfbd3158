package com.biblioteca.backend.modules.reservation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.biblioteca.backend.modules.reservation.domain.Reservation;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    @Query("""
            select r
              from Reservation r
             where r.book.id = :bookId
               and r.status in :statuses
             order by r.priority asc, r.reservedAt asc, r.id asc
            """)
    List<Reservation> findQueue(@Param("bookId") Long bookId, @Param("statuses") Collection<ReservationStatus> statuses);

    long countByBookIdAndStatusIn(Long bookId, Collection<ReservationStatus> statuses);

    long countByStatus(ReservationStatus status);

    long countByBookIdAndStatus(Long bookId, ReservationStatus status);

    boolean existsByUserIdAndBookIdAndStatusIn(Long userId, Long bookId, Collection<ReservationStatus> statuses);

    boolean existsByBookIdAndUserIdNotAndStatusIn(Long bookId, Long userId, Collection<ReservationStatus> statuses);

    List<Reservation> findByUserIdAndBookIdAndStatusIn(Long userId, Long bookId, Collection<ReservationStatus> statuses);

    @Query("select distinct r.book.id from Reservation r where r.status = :status")
    List<Long> findBookIdsWithStatus(@Param("status") ReservationStatus status);

    @Query("""
            select r
              from Reservation r
             where r.status = :status
               and r.expiresAt < :now
            """)
    List<Reservation> findExpired(@Param("status") ReservationStatus status, @Param("now") OffsetDateTime now);

    @Query("""
            select r
              from Reservation r
              join fetch r.user u
              join fetch r.book b
             where (:userId is null or u.id = :userId)
               and (:bookId is null or b.id = :bookId)
               and (:status is null or r.status = :status)
             order by b.title asc, r.priority asc, r.reservedAt asc
            """)
    List<Reservation> search(
            @Param("userId") Long userId,
            @Param("bookId") Long bookId,
            @Param("status") ReservationStatus status
    );

    @Query("""
            select r
              from Reservation r
              join fetch r.user u
              join fetch r.book b
             where u.id = :userId
             order by r.reservedAt desc, r.id desc
            """)
    List<Reservation> findByUserWithBook(@Param("userId") Long userId);

    @Modifying
    @Query("delete from Reservation r where r.book.id = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);
}
