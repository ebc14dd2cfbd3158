package com.biblioteca.backend.modules.reservation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.reservation.application.ReservationService;
import com.biblioteca.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

class ReservationIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private ReservationService reservationService;

    private LibraryUser ana;
    private LibraryUser beto;
    private LibraryUser carla;

    @BeforeEach
    void setUp() {
        ana = testUserFactory.createPatron("ana@example.com", DEFAULT_PASSWORD);
        beto = testUserFactory.createPatron("beto@example.com", DEFAULT_PASSWORD);
        carla = testUserFactory.createPatron("carla@example.com", DEFAULT_PASSWORD);
        testUserFactory.createLibrarian("biblio@example.com", DEFAULT_PASSWORD);
        testUserFactory.createAdmin("admin@example.com", DEFAULT_PASSWORD);
    }

    @Test
    void reservationIsOnlyAcceptedForExhaustedBooks() throws Exception {
        Book onShelf = testUserFactory.createBook("Ficciones", 1, 1);
        Book exhausted = testUserFactory.createBook("El Aleph", 1, 0);
        String token = login("ana@example.com", DEFAULT_PASSWORD);

        reserve(token, onShelf.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("reservation.not_required"));

        reserve(token, exhausted.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.estado").value("pendiente"))
                .andExpect(jsonPath("$.prioridad").value(1));

        reserve(token, exhausted.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("reservation.duplicate"));
    }

    @Test
    void bookUnderMaintenanceCannotBeReserved() throws Exception {
        Book book = testUserFactory.createBook("Rayuela", 1, 1);
        mockMvc.perform(put("/api/libros/{id}", book.getId())
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"estado\": \"en mantenimiento\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.estado").value("en mantenimiento"));

        reserve(login("ana@example.com", DEFAULT_PASSWORD), book.getId())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("reservation.book_in_maintenance"));
    }

    @Test
    void onlyOwnerOrAdminDeletesAndQueueIsRenumbered() throws Exception {
        Book book = testUserFactory.createBook("Pedro Páramo", 1, 0);
        String anaToken = login("ana@example.com", DEFAULT_PASSWORD);
        String betoToken = login("beto@example.com", DEFAULT_PASSWORD);
        String carlaToken = login("carla@example.com", DEFAULT_PASSWORD);

        long anaReservation = idOf(reserve(anaToken, book.getId()));
        long betoReservation = idOf(reserve(betoToken, book.getId()));
        reserve(carlaToken, book.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.prioridad").value(3));

        mockMvc.perform(delete("/api/reservas/{id}", betoReservation)
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("reservation.forbidden"));

        mockMvc.perform(delete("/api/reservas/{id}", betoReservation)
                        .header("Authorization", bearer(carlaToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/reservas/{id}", betoReservation)
                        .header("Authorization", bearer(betoToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/reservas/mis-reservas").header("Authorization", bearer(carlaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].prioridad").value(2));

        mockMvc.perform(delete("/api/reservas/{id}", anaReservation)
                        .header("Authorization", bearer(login("admin@example.com", DEFAULT_PASSWORD))))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/reservas")
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD)))
                        .param("libro", String.valueOf(book.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].usuario").value(carla.getId()))
                .andExpect(jsonPath("$[0].prioridad").value(1));
    }

    @Test
    void patronListsOnlyOwnReservations() throws Exception {
        Book book = testUserFactory.createBook("La ciudad y los perros", 1, 0);
        reserve(login("beto@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        String anaToken = login("ana@example.com", DEFAULT_PASSWORD);
        reserve(anaToken, book.getId()).andExpect(status().isCreated());

        mockMvc.perform(get("/api/reservas").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].usuario").value(ana.getId()))
                .andExpect(jsonPath("$[0].prioridad").value(2));

        mockMvc.perform(get("/api/reservas")
                        .header("Authorization", bearer(anaToken))
                        .param("estado", "desconocido"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_parameter"));
    }

    @Test
    void notifyAvailabilityFollowsPriorityUpToAvailableCopies() throws Exception {
        Book book = testUserFactory.createBook("Conversación en La Catedral", 2, 0);
        reserve(login("ana@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        reserve(login("beto@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        reserve(login("carla@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        String librarianToken = login("biblio@example.com", DEFAULT_PASSWORD);

        mockMvc.perform(post("/api/reservas/notificar-disponibilidad")
                        .header("Authorization", bearer(login("ana@example.com", DEFAULT_PASSWORD))))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/reservas/notificar-disponibilidad")
                        .header("Authorization", bearer(librarianToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(book.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificadas").value(0));

        mockMvc.perform(put("/api/libros/{id}", book.getId())
                        .header("Authorization", bearer(librarianToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"copiasDisponibles\": 2}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/reservas/notificar-disponibilidad")
                        .header("Authorization", bearer(librarianToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificadas").value(2))
                .andExpect(jsonPath("$.reservas[*].usuario", contains(ana.getId().intValue(), beto.getId().intValue())))
                .andExpect(jsonPath("$.reservas[0].estado").value("notificada"))
                .andExpect(jsonPath("$.reservas[0].fechaExpiracion").isNotEmpty());
    }

    @Test
    void repeatedNotificationDoesNotPromiseHeldCopiesAgain() throws Exception {
        Book book = testUserFactory.createBook("Los de abajo", 1, 0);
        reserve(login("ana@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        reserve(login("beto@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        String librarianToken = login("biblio@example.com", DEFAULT_PASSWORD);

        mockMvc.perform(put("/api/libros/{id}", book.getId())
                        .header("Authorization", bearer(librarianToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"copiasDisponibles\": 1}"))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/reservas/notificar-disponibilidad")
                        .header("Authorization", bearer(librarianToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificadas").value(1));
        mockMvc.perform(post("/api/reservas/notificar-disponibilidad")
                        .header("Authorization", bearer(librarianToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notificadas").value(0));

        mockMvc.perform(get("/api/reservas")
                        .header("Authorization", bearer(librarianToken))
                        .param("libro", String.valueOf(book.getId()))
                        .param("estado", "notificada"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].usuario").value(ana.getId()));
    }

    @Test
    void heldCopyIsOnlyLentToNotifiedReservation() throws Exception {
        Book book = testUserFactory.createBook("Hijo de hombre", 1, 0);
        String anaToken = login("ana@example.com", DEFAULT_PASSWORD);
        reserve(anaToken, book.getId()).andExpect(status().isCreated());

        mockMvc.perform(put("/api/libros/{id}", book.getId())
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"copiasDisponibles\": 1}"))
                .andExpect(status().isOk());
        assertThat(reservationService.notifyAvailability(book.getId()).notificadas()).isEqualTo(1);

        String carlaToken = login("carla@example.com", DEFAULT_PASSWORD);
        mockMvc.perform(post("/api/prestamos")
                        .header("Authorization", bearer(carlaToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(book.getId())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("loan.book_reserved"));

        reserve(carlaToken, book.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.prioridad").value(2));

        mockMvc.perform(post("/api/prestamos")
                        .header("Authorization", bearer(anaToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(book.getId())))
                .andExpect(status().isCreated());
    }

    @Test
    void returnedCopyGoesToFirstInQueueAndLoanCompletesReservation() throws Exception {
        Book book = testUserFactory.createBook("Crónica de una muerte anunciada", 1, 1);
        String carlaToken = login("carla@example.com", DEFAULT_PASSWORD);
        long loanId = idOf(mockMvc.perform(post("/api/prestamos")
                        .header("Authorization", bearer(carlaToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(book.getId())))
                .andExpect(status().isCreated()));

        String anaToken = login("ana@example.com", DEFAULT_PASSWORD);
        reserve(anaToken, book.getId()).andExpect(status().isCreated());

        mockMvc.perform(put("/api/prestamos/{id}/renovar", loanId)
                        .header("Authorization", bearer(carlaToken)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("loan.book_reserved"));

        mockMvc.perform(put("/api/prestamos/{id}/devolver", loanId)
                        .header("Authorization", bearer(carlaToken)))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/reservas/mis-reservas").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].estado").value("notificada"));

        mockMvc.perform(post("/api/prestamos")
                        .header("Authorization", bearer(anaToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(book.getId())))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/reservas/mis-reservas").header("Authorization", bearer(anaToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].estado").value("completada"));
    }

    @Test
    void expiredHoldPassesToNextPendingReservation() throws Exception {
        Book book = testUserFactory.createBook("La casa verde", 1, 0);
        reserve(login("ana@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());
        reserve(login("beto@example.com", DEFAULT_PASSWORD), book.getId()).andExpect(status().isCreated());

        mockMvc.perform(put("/api/libros/{id}", book.getId())
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"copiasDisponibles\": 1}"))
                .andExpect(status().isOk());
        assertThat(reservationService.notifyAvailability(book.getId()).notificadas()).isEqualTo(1);

        clock.advance(Duration.ofHours(49));
        assertThat(reservationService.expireNotifiedReservations()).isEqualTo(1);

        mockMvc.perform(get("/api/reservas")
                        .header("Authorization", bearer(login("biblio@example.com", DEFAULT_PASSWORD)))
                        .param("libro", String.valueOf(book.getId()))
                        .param("estado", "notificada"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].usuario").value(beto.getId()))
                .andExpect(jsonPath("$[0].prioridad").value(1));
    }

    private ResultActions reserve(String token, Long bookId) throws Exception {
        return mockMvc.perform(post("/api/reservas")
                .header("Authorization", bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"libro\": %d}".formatted(bookId)));
    }

    private long idOf(ResultActions actions) throws Exception {
        return readJson(actions.andReturn()).path("id").asLong();
    }
}
