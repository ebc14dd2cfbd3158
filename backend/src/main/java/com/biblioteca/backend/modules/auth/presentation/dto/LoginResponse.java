package com.biblioteca.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(
        String token,
        String tokenType,
        long expiresIn,
        OffsetDateTime issuedAt,
        UserResponse usuario
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";
}
