package com.biblioteca.backend.global.security;

import com.biblioteca.backend.modules.auth.domain.UserRole;

public record JwtAuthenticationPrincipal(Long userId, String correo, UserRole role) {

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isStaff() {
        return role.isStaff();
    }
}
