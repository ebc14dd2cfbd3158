package com.biblioteca.backend.modules.loan.infrastructure.persistence;

public record BookLoanCountView(Long bookId, String title, String author, Long loanCount) {
}
