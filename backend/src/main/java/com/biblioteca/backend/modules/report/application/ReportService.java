package com.biblioteca.backend.modules.report.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.UserOverdueCountView;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanResponse;
import com.biblioteca.backend.modules.report.presentation.dto.DelinquentUserResponse;
import com.biblioteca.backend.modules.report.presentation.dto.LoanHistoryResponse;
import com.biblioteca.backend.modules.report.presentation.dto.PopularBookResponse;
import com.biblioteca.backend.modules.report.presentation.dto.StatisticsResponse;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;
import com.biblioteca.backend.modules.reservation.infrastructure.persistence.ReservationRepository;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ReportService {

    private static final BigDecimal ZERO_AMOUNT = BigDecimal.ZERO.setScale(2);

    private final LibraryUserRepository libraryUserRepository;
    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final ReservationRepository reservationRepository;
    private final Clock clock;

    public ReportService(
            LibraryUserRepository libraryUserRepository,
            BookRepository bookRepository,
            LoanRepository loanRepository,
            ReservationRepository reservationRepository,
            Clock clock
    ) {
        this.libraryUserRepository = libraryUserRepository;
        this.bookRepository = bookRepository;
        this.loanRepository = loanRepository;
        this.reservationRepository = reservationRepository;
        this.clock = clock;
    }

    public List<DelinquentUserResponse> delinquentUsers() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Map<Long, Long> overdueByUser = new LinkedHashMap<>();
        for (UserOverdueCountView view : loanRepository.countOverdueByUser(LoanStatus.DEVUELTO, now)) {
            overdueByUser.put(view.userId(), view.overdueCount());
        }

        Map<Long, LibraryUser> users = new LinkedHashMap<>();
        libraryUserRepository.findByFinesGreaterThan(BigDecimal.ZERO)
                .forEach(user -> users.put(user.getId(), user));
        libraryUserRepository.findAllById(overdueByUser.keySet())
                .forEach(user -> users.putIfAbsent(user.getId(), user));

        return users.values().stream()
                .sorted(Comparator.comparing(LibraryUser::getFines).reversed()
                        .thenComparing(LibraryUser::getLastName)
                        .thenComparing(LibraryUser::getId))
                .map(user -> new DelinquentUserResponse(
                        user.getId(),
                        user.getFullName(),
                        user.getEmail(),
                        user.getPhone(),
                        user.getFines(),
                        overdueByUser.getOrDefault(user.getId(), 0L)
                ))
                .toList();
    }

    public List<PopularBookResponse> popularBooks(int limit) {
        return loanRepository.findMostLoanedBooks(PageRequest.of(0, limit)).stream()
                .map(view -> new PopularBookResponse(view.bookId(), view.title(), view.author(), view.loanCount()))
                .toList();
    }

    public LoanHistoryResponse loanHistory(Long userId) {
        LibraryUser user = libraryUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "auth.user_not_found", "Usuario no encontrado"));
        List<LoanResponse> loans = loanRepository.search(userId, null).stream()
                .map(LoanResponse::from)
                .toList();
        long open = loans.stream().filter(loan -> loan.estado().isOpen()).count();
        BigDecimal finesGenerated = loans.stream()
                .map(LoanResponse::multaGenerada)
                .filter(Objects::nonNull)
                .reduce(ZERO_AMOUNT, BigDecimal::add);
        return new LoanHistoryResponse(loans.size(), open, finesGenerated, user.getFines(), loans);
    }

    public StatisticsResponse statistics() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        BigDecimal outstandingFines = libraryUserRepository.sumOutstandingFines();
        return new StatisticsResponse(
                libraryUserRepository.count(),
                libraryUserRepository.countByActiveTrue(),
                bookRepository.count(),
                bookRepository.sumTotalCopies(),
                bookRepository.sumAvailableCopies(),
                loanRepository.countByStatusNot(LoanStatus.DEVUELTO),
                loanRepository.countOverdue(LoanStatus.DEVUELTO, now),
                reservationRepository.countByStatus(ReservationStatus.PENDIENTE),
                outstandingFines == null ? ZERO_AMOUNT : outstandingFines.setScale(2)
        );
    }
}
