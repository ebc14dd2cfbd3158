package com.biblioteca.backend.modules.admin.presentation.dto;

import java.util.List;

import com.biblioteca.backend.modules.auth.presentation.dto.UserResponse;

public record AdminUsersResponse(
        List<UserResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
