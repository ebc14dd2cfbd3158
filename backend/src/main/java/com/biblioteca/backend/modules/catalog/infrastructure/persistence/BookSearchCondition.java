package com.biblioteca.backend.modules.catalog.infrastructure.persistence;

/**
 * Catalog filters. {@code category} matches exactly, {@code author} and {@code title} as substrings,
 * all case-insensitively. {@code available} null means "any".
 */
public record BookSearchCondition(
        String category,
        String author,
        String title,
        Boolean available
) {
}
