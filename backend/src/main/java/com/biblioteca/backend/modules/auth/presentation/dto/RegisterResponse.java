package com.biblioteca.backend.modules.auth.presentation.dto;

public record RegisterResponse(String mensaje, UserResponse usuario) {
}
