package com.biblioteca.backend.modules.loan.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.biblioteca.backend.global.config.BibliotecaProperties;
import com.biblioteca.backend.global.error.FieldValidationException;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.loan.domain.Loan;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanCreateRequest;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanResponse;
import com.biblioteca.backend.modules.reservation.application.ReservationService;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;
import com.biblioteca.backend.modules.reservation.infrastructure.persistence.ReservationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LoanService {

    private static final Logger log = LoggerFactory.getLogger(LoanService.class);
    private static final Set<ReservationStatus> NOTIFIED_ONLY = EnumSet.of(ReservationStatus.NOTIFICADA);

    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final LibraryUserRepository libraryUserRepository;
    private final ReservationRepository reservationRepository;
    private final ReservationService reservationService;
    private final BibliotecaProperties properties;
    private final Clock clock;

    public LoanService(
            LoanRepository loanRepository,
            BookRepository bookRepository,
            LibraryUserRepository libraryUserRepository,
            ReservationRepository reservationRepository,
            ReservationService reservationService,
            BibliotecaProperties properties,
            Clock clock
    ) {
        this.loanRepository = loanRepository;
        this.bookRepository = bookRepository;
        this.libraryUserRepository = libraryUserRepository;
        this.reservationRepository = reservationRepository;
        this.reservationService = reservationService;
        this.properties = properties;
        this.clock = clock;
    }

    public LoanResponse createLoan(JwtAuthenticationPrincipal principal, LoanCreateRequest request) {
        BibliotecaProperties.Loans rules = properties.getLoans();
        OffsetDateTime now = OffsetDateTime.now(clock);

        Long borrowerId = principal.isStaff() && request.usuario() != null ? request.usuario() : principal.userId();
        LibraryUser borrower = libraryUserRepository.findById(borrowerId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "loan.user_not_found", "Usuario no encontrado"));
        if (!borrower.isActive()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "loan.user_inactive", "El usuario está inactivo");
        }

        OffsetDateTime dueAt = request.fechaDevolucionEsperada() != null
                ? request.fechaDevolucionEsperada()
                : now.plusDays(rules.getDefaultDays());
        if (!dueAt.isAfter(now)) {
            throw FieldValidationException.of("fechaDevolucionEsperada", "La fecha de devolución debe ser futura");
        }

        Book book = bookRepository.findByIdForUpdate(request.libro())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "catalog.book_not_found", "Libro no encontrado: " + request.libro()));
        if (book.getAvailableCopies() <= 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "loan.book_unavailable", "El libro no tiene copias disponibles");
        }
        if (!book.isAvailableForLoan()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "loan.book_not_lendable", "El libro no está disponible para préstamo");
        }
        // a notified reservation keeps its copy until the hold expires
        if (!reservationRepository.existsByUserIdAndBookIdAndStatusIn(borrowerId, book.getId(), NOTIFIED_ONLY)) {
            long held = reservationRepository.countByBookIdAndStatus(book.getId(), ReservationStatus.NOTIFICADA);
            if (book.getAvailableCopies() <= held) {
                throw new ProblemException(HttpStatus.CONFLICT, "loan.book_reserved",
                        "Las copias disponibles están apartadas para reservas notificadas");
            }
        }

        long openLoans = loanRepository.countByUserIdAndStatusNot(borrowerId, LoanStatus.DEVUELTO);
        if (openLoans >= rules.getMaxActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.limit_reached",
                    "El usuario alcanzó el máximo de " + rules.getMaxActive() + " préstamos activos");
        }
        if (borrower.getFines().compareTo(rules.getMaxFineToBorrow()) > 0) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.outstanding_fines",
                    "El usuario tiene multas pendientes de L " + borrower.getFines());
        }

        book.checkOutCopy();
        Loan loan = loanRepository.save(Loan.open(borrower, book, now, dueAt));
        reservationService.completeReservationFor(borrowerId, book.getId());

        log.info("Loan id={} created: user={} book={} due={} by={}", loan.getId(), borrowerId, book.getId(), dueAt, principal.userId());
        return LoanResponse.from(loan);
    }

    @Transactional(readOnly = true)
    public List<LoanResponse> listLoans(JwtAuthenticationPrincipal principal, LoanStatus status, Long userId) {
        Long userFilter = principal.isStaff() ? userId : principal.userId();
        return loanRepository.search(userFilter, status).stream()
                .map(LoanResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LoanResponse> listOverdueLoans() {
        return loanRepository.findOverdue(LoanStatus.DEVUELTO, OffsetDateTime.now(clock)).stream()
                .map(LoanResponse::from)
                .toList();
    }

    public LoanResponse returnLoan(JwtAuthenticationPrincipal principal, Long loanId) {
        Loan loan = loadForUpdate(principal, loanId);
        if (loan.isReturned()) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.already_returned", "El préstamo ya fue devuelto");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        BigDecimal fine = loan.markReturned(now, properties.getLoans().getDailyFine());
        if (fine.signum() > 0) {
            loan.getUser().addFine(fine);
        }

        Book book = bookRepository.findByIdForUpdate(loan.getBook().getId())
                .orElseThrow(() -> new IllegalStateException("Loan " + loanId + " references a missing book"));
        book.returnCopy();
        reservationService.notifyNextPending(book);

        log.info("Loan id={} returned: daysLate={} fine={} book={} available={}/{}", loan.getId(), loan.getDaysOverdue(),
                fine, book.getId(), book.getAvailableCopies(), book.getTotalCopies());
        return LoanResponse.from(loan);
    }

    public LoanResponse renewLoan(JwtAuthenticationPrincipal principal, Long loanId) {
        BibliotecaProperties.Loans rules = properties.getLoans();
        Loan loan = loadForUpdate(principal, loanId);
        if (loan.isReturned()) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.already_returned", "No se puede renovar un préstamo devuelto");
        }
        if (loan.isOverdueAt(OffsetDateTime.now(clock))) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.overdue", "No se puede renovar un préstamo vencido");
        }
        if (loan.getRenewals() >= rules.getMaxRenewals()) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.renewal_limit",
                    "Se alcanzó el máximo de " + rules.getMaxRenewals() + " renovaciones");
        }
        if (reservationRepository.existsByBookIdAndUserIdNotAndStatusIn(
                loan.getBook().getId(), loan.getUser().getId(), ReservationStatus.ACTIVE)) {
            throw new ProblemException(HttpStatus.CONFLICT, "loan.book_reserved", "Otros usuarios esperan este libro");
        }

        loan.renew(rules.getRenewalDays());
        log.info("Loan id={} renewed ({}): new due={}", loan.getId(), loan.getRenewals(), loan.getDueAt());
        return LoanResponse.from(loan);
    }

    public int markOverdueLoans() {
        List<Loan> pastDue = loanRepository.findByStatusAndDueBefore(LoanStatus.ACTIVO, OffsetDateTime.now(clock));
        pastDue.forEach(Loan::markOverdue);
        return pastDue.size();
    }

    private Loan loadForUpdate(JwtAuthenticationPrincipal principal, Long loanId) {
        Loan loan = loanRepository.findByIdForUpdate(loanId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "loan.not_found", "Préstamo no encontrado"));
        if (!principal.isStaff() && !loan.getUser().getId().equals(principal.userId())) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "loan.forbidden", "No puede gestionar préstamos de otros usuarios");
        }
        return loan;
    }
}
