package com.biblioteca.backend.global.config;

import java.util.Optional;

import com.biblioteca.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public class BibliotecaAuditorAware implements AuditorAware<Long> {

    @Override
    @NonNull
    public Optional<Long> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof JwtAuthenticationPrincipal jwtPrincipal) {
            return Optional.ofNullable(jwtPrincipal.userId());
        }

        return Optional.empty();
    }
}
