package com.biblioteca.backend.modules.auth.infrastructure.persistence;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LibraryUserRepository extends JpaRepository<LibraryUser, Long> {

    @Query("select u from LibraryUser u where lower(u.email) = lower(:email)")
    Optional<LibraryUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from LibraryUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    boolean existsByIdentityNumber(String identityNumber);

    Optional<LibraryUser> findByIdAndActiveTrue(Long id);

    boolean existsByRole(UserRole role);

    long countByActiveTrue();

    List<LibraryUser> findByFinesGreaterThan(BigDecimal amount);

    @Query("select sum(u.fines) from LibraryUser u")
    BigDecimal sumOutstandingFines();

    @Query("""
            select u
              from LibraryUser u
             where (:role is null or u.role = :role)
               and (:active is null or u.active = :active)
               and (
                     :searchPattern is null
                  or lower(u.firstName) like :searchPattern escape '\\'
                  or lower(u.lastName) like :searchPattern escape '\\'
                  or lower(u.email) like :searchPattern escape '\\'
                  or u.identityNumber like :searchPattern escape '\\'
               )
             order by u.lastName, u.firstName, u.id
            """)
    Page<LibraryUser> search(
            @Param("role") UserRole role,
            @Param("active") Boolean active,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );
}
