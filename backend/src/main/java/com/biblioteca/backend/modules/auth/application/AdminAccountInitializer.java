package com.biblioteca.backend.modules.auth.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;

import com.biblioteca.backend.global.config.BibliotecaProperties;
import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.modules.auth.domain.UserRole;
import com.biblioteca.backend.modules.auth.infrastructure.persistence.LibraryUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first admin account from {@code biblioteca.bootstrap.admin.*} so a fresh database can be
 * administered. Registration only ever creates {@code usuario} accounts.
 */
@Component
public class AdminAccountInitializer {

    private static final Logger log = LoggerFactory.getLogger(AdminAccountInitializer.class);
    private static final String BOOTSTRAP_IDENTITY_PREFIX = "ADMIN-";

    private final BibliotecaProperties properties;
    private final LibraryUserRepository libraryUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public AdminAccountInitializer(
            BibliotecaProperties properties,
            LibraryUserRepository libraryUserRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.properties = properties;
        this.libraryUserRepository = libraryUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureAdminAccount() {
        BibliotecaProperties.Admin admin = properties.getBootstrap().getAdmin();
        if (!StringUtils.hasText(admin.getCorreo()) || !StringUtils.hasText(admin.getPassword())) {
            return;
        }
        if (libraryUserRepository.existsByRole(UserRole.ADMIN)) {
            return;
        }
        String email = AuthService.normalizeEmail(admin.getCorreo());
        if (libraryUserRepository.existsByEmailIgnoreCase(email)) {
            log.warn("Bootstrap admin skipped: {} already belongs to a non-admin account", email);
            return;
        }

        LibraryUser user = new LibraryUser();
        user.setFirstName(admin.getNombre());
        user.setLastName(admin.getApellido());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(admin.getPassword()));
        user.setAge(18);
        user.setIdentityNumber(BOOTSTRAP_IDENTITY_PREFIX + email);
        user.setPhone("N/A");
        user.setRole(UserRole.ADMIN);
        user.setActive(true);
        user.setFines(BigDecimal.ZERO.setScale(2));
        user.setRegisteredAt(OffsetDateTime.now(clock));
        libraryUserRepository.save(user);
        log.info("Bootstrap admin account created for {}", email);
    }
}
