package com.biblioteca.backend.modules.loan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;

import com.biblioteca.backend.modules.catalog.domain.Book;
import com.biblioteca.backend.modules.loan.application.LibraryMaintenanceScheduler;
import com.biblioteca.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;

class LibraryMaintenanceSchedulerTest extends AbstractIntegrationTest {

    @Autowired
    private LibraryMaintenanceScheduler scheduler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void nightlyRunFlagsOverdueLoansAndReleasesExpiredHolds() throws Exception {
        testUserFactory.createPatron("ana@example.com", DEFAULT_PASSWORD);
        testUserFactory.createPatron("beto@example.com", DEFAULT_PASSWORD);
        Book lent = testUserFactory.createBook("Los ríos profundos", 1, 1);
        Book held = testUserFactory.createBook("El zorro de arriba", 1, 0);

        String anaToken = login("ana@example.com", DEFAULT_PASSWORD);
        mockMvc.perform(post("/api/prestamos")
                        .header("Authorization", bearer(anaToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(lent.getId())))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/reservas")
                        .header("Authorization", bearer(login("beto@example.com", DEFAULT_PASSWORD)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"libro\": %d}".formatted(held.getId())))
                .andExpect(status().isCreated());
        jdbcTemplate.update("UPDATE reservation SET status = 'notificada', notified_at = reserved_at, "
                + "expires_at = reserved_at + INTERVAL '48' HOUR WHERE book_id = ?", held.getId());

        clock.advance(Duration.ofDays(15));
        scheduler.runNightlyMaintenance();

        assertThat(jdbcTemplate.queryForObject("SELECT status FROM loan WHERE book_id = ?", String.class, lent.getId()))
                .isEqualTo("vencido");
        assertThat(jdbcTemplate.queryForObject("SELECT status FROM reservation WHERE book_id = ?", String.class, held.getId()))
                .isEqualTo("cancelada");

        scheduler.runNightlyMaintenance();
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM loan WHERE status = 'vencido'", Integer.class))
                .isEqualTo(1);
    }
}
