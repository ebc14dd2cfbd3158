package com.biblioteca.backend.modules.catalog.infrastructure.persistence;

import com.biblioteca.backend.modules.catalog.domain.Book;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface BookRepositoryCustom {

    Page<Book> searchBooks(BookSearchCondition condition, Pageable pageable);
}
