package com.biblioteca.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.biblioteca.backend.modules.auth.domain.LibraryUser;
import com.biblioteca.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;

class PasswordEncoderTest extends AbstractIntegrationTest {

    @Autowired
    PasswordEncoder passwordEncoder;

    @Test
    void storedHashIsBcryptAndMatchesRawPassword() {
        LibraryUser user = testUserFactory.createPatron("hash@example.com", "clave-segura");

        assertThat(user.getPasswordHash()).startsWith("$2");
        assertThat(user.getPasswordHash()).doesNotContain("clave-segura");
        assertThat(passwordEncoder.matches("clave-segura", user.getPasswordHash())).isTrue();
        assertThat(passwordEncoder.matches("otra-clave", user.getPasswordHash())).isFalse();
    }
}
