package com.biblioteca.backend.modules.loan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.biblioteca.backend.global.config.BibliotecaProperties;
import com.biblioteca.backend.global.error.ProblemException;
import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.catalog.infrastructure.persistence.BookRepository;
import com.biblioteca.backend.modules.loan.application.LoanService;
import com.biblioteca.backend.modules.loan.domain.Loan;
import com.biblioteca.backend.modules.loan.domain.LoanStatus;
import com.biblioteca.backend.modules.loan.infrastructure.persistence.LoanRepository;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanCreateRequest;
import com.biblioteca.backend.modules.loan.presentation.dto.LoanResponse;
import com.biblioteca.backend.modules.reservation.application.ReservationService;
import com.biblioteca.backend.modules.reservation.domain.ReservationStatus;
import com.biblioteca.backend.modules.reservation.infrastructure.persistence.ReservationRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoanServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-10T09:00:00Z");

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private BookRepository bookRepository;

    @Mock
    private LibraryUserRepository libraryUserRepository;

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private ReservationService reservationService;

    private LoanService loanService;
    private LibraryUser borrower;
    private Book book;
    private JwtAuthenticationPrincipal borrowerPrincipal;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        loanService = new LoanService(
                loanRepository,
                bookRepository,
                libraryUserRepository,
                reservationRepository,
                reservationService,
                new BibliotecaProperties(),
                clock
        );

        borrower = new LibraryUser();
        borrower.setFirstName("Ana");
        borrower.setLastName("Reyes");
        borrower.setEmail("ana@example.com");
        borrower.setRole(UserRole.USUARIO);
        assignId(LibraryUser.class, borrower, 11L);

        book = new Book();
        book.setTitle("El llano en llamas");
        book.setAuthor("Juan Rulfo");
        book.changeCopies(2, 2);
        assignId(Book.class, book, 21L);

        borrowerPrincipal = new JwtAuthenticationPrincipal(11L, "ana@example.com", UserRole.USUARIO);
    }

    @Test
    @DisplayName("un préstamo descuenta una copia y completa la reserva del prestatario")
    void createLoan_checksOutCopyAndCompletesReservation() {
        when(libraryUserRepository.findById(11L)).thenReturn(Optional.of(borrower));
        when(bookRepository.findByIdForUpdate(21L)).thenReturn(Optional.of(book));
        when(loanRepository.countByUserIdAndStatusNot(11L, LoanStatus.DEVUELTO)).thenReturn(0L);
        when(loanRepository.save(any(Loan.class))).thenAnswer(invocation -> invocation.getArgument(0));

        LoanResponse response = loanService.createLoan(borrowerPrincipal, new LoanCreateRequest(21L, null, 99L));

        assertThat(book.getAvailableCopies()).isEqualTo(1);
        assertThat(response.usuario()).isEqualTo(11L);
        assertThat(response.fechaDevolucionEsperada()).isEqualTo(NOW.plusDays(14));
        assertThat(response.estado()).isEqualTo(LoanStatus.ACTIVO);
        verify(reservationService).completeReservationFor(11L, 21L);
    }

    @Test
    @DisplayName("las multas pendientes bloquean nuevos préstamos sin tocar las copias")
    void createLoan_rejectsBorrowerWithFines() {
        borrower.setFines(new BigDecimal("0.50"));
        when(libraryUserRepository.findById(11L)).thenReturn(Optional.of(borrower));
        when(bookRepository.findByIdForUpdate(21L)).thenReturn(Optional.of(book));
        when(loanRepository.countByUserIdAndStatusNot(11L, LoanStatus.DEVUELTO)).thenReturn(1L);

        assertThatThrownBy(() -> loanService.createLoan(borrowerPrincipal, new LoanCreateRequest(21L, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("loan.outstanding_fines"));

        assertThat(book.getAvailableCopies()).isEqualTo(2);
        verify(loanRepository, never()).save(any());
    }

    @Test
    @DisplayName("una copia apartada para una reserva notificada no se presta a otro usuario")
    void createLoan_rejectedWhenCopiesAreHeldForOthers() {
        book.changeCopies(2, 1);
        when(libraryUserRepository.findById(11L)).thenReturn(Optional.of(borrower));
        when(bookRepository.findByIdForUpdate(21L)).thenReturn(Optional.of(book));
        when(reservationRepository.countByBookIdAndStatus(21L, ReservationStatus.NOTIFICADA)).thenReturn(1L);

        assertThatThrownBy(() -> loanService.createLoan(borrowerPrincipal, new LoanCreateRequest(21L, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("loan.book_reserved"));

        assertThat(book.getAvailableCopies()).isEqualTo(1);
        verify(loanRepository, never()).save(any());
    }

    @Test
    @DisplayName("la devolución tardía suma la multa al usuario y avisa a la siguiente reserva")
    void returnLoan_chargesFineAndNotifiesQueue() {
        book.checkOutCopy();
        Loan loan = Loan.open(borrower, book, NOW.minusDays(20), NOW.minusDays(5));
        when(loanRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(loan));
        when(bookRepository.findByIdForUpdate(21L)).thenReturn(Optional.of(book));

        LoanResponse response = loanService.returnLoan(borrowerPrincipal, 7L);

        assertThat(response.diasRetraso()).isEqualTo(5);
        assertThat(response.multaGenerada()).isEqualByComparingTo("25.00");
        assertThat(borrower.getFines()).isEqualByComparingTo("25.00");
        assertThat(book.getAvailableCopies()).isEqualTo(2);
        verify(reservationService).notifyNextPending(book);
    }

    @Test
    @DisplayName("no se renueva un préstamo si otros usuarios esperan el libro")
    void renewLoan_rejectedWhenOthersHoldReservations() {
        Loan loan = Loan.open(borrower, book, NOW.minusDays(3), NOW.plusDays(11));
        when(loanRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(loan));
        when(reservationRepository.existsByBookIdAndUserIdNotAndStatusIn(21L, 11L, ReservationStatus.ACTIVE))
                .thenReturn(true);

        assertThatThrownBy(() -> loanService.renewLoan(borrowerPrincipal, 7L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("loan.book_reserved"));
        assertThat(loan.getRenewals()).isZero();
        assertThat(loan.getDueAt()).isEqualTo(NOW.plusDays(11));
    }

    @Test
    @DisplayName("un usuario no puede devolver el préstamo de otro")
    void returnLoan_forbiddenForOtherPatron() {
        Loan loan = Loan.open(borrower, book, NOW.minusDays(3), NOW.plusDays(11));
        when(loanRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(loan));
        JwtAuthenticationPrincipal stranger = new JwtAuthenticationPrincipal(12L, "otro@example.com", UserRole.USUARIO);

        assertThatThrownBy(() -> loanService.returnLoan(stranger, 7L))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("loan.forbidden"));
        assertThat(loan.isReturned()).isFalse();
    }

    private static <T> void assignId(Class<T> type, T target, Long id) {
        try {
            java.lang.reflect.Field idField = type.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(target, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
