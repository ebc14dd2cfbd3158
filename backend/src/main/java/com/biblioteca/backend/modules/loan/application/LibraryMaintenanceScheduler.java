package com.biblioteca.backend.modules.loan.application;

import com.biblioteca.backend.modules.reservation.application.ReservationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Nightly housekeeping: overdue loans and expired reservation holds.
 */
@Service
public class LibraryMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(LibraryMaintenanceScheduler.class);

    private final LoanService loanService;
    private final ReservationService reservationService;

    public LibraryMaintenanceScheduler(LoanService loanService, ReservationService reservationService) {
        this.loanService = loanService;
        this.reservationService = reservationService;
    }

    @Scheduled(cron = "${biblioteca.maintenance.cron:0 0 2 * * *}")
    @Transactional
    public void runNightlyMaintenance() {
        int overdue = loanService.markOverdueLoans();
        int expired = reservationService.expireNotifiedReservations();
        if (overdue > 0 || expired > 0) {
            log.info("[Batch][maintenance] loans marked overdue={} reservations expired={}", overdue, expired);
        } else {
            log.debug("[Batch][maintenance] nothing to update");
        }
    }
}
