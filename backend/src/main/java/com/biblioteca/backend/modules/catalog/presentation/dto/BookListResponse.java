package com.biblioteca.backend.modules.catalog.presentation.dto;

import java.util.List;

public record BookListResponse(
        List<BookResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
