package com.biblioteca.backend.modules.loan.infrastructure.persistence;

public record UserOverdueCountView(Long userId, Long overdueCount) {
}
