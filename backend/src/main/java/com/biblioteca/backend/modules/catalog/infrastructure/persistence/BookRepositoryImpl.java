package com.biblioteca.backend.modules.catalog.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import com.biblioteca.backend.global.jpa.LikePatterns;
import com.biblioteca.backend.modules.catalog.domain.Book;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class BookRepositoryImpl implements BookRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Book> searchBooks(BookSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (StringUtils.hasText(condition.category())) {
            whereClauses.add("lower(b.category) = :category");
            params.put("category", condition.category().trim().toLowerCase(Locale.ROOT));
        }
        if (StringUtils.hasText(condition.author())) {
            whereClauses.add("lower(b.author) like :author escape '\\'");
            params.put("author", LikePatterns.containing(condition.author()));
        }
        if (StringUtils.hasText(condition.title())) {
            whereClauses.add("lower(b.title) like :title escape '\\'");
            params.put("title", LikePatterns.containing(condition.title()));
        }
        if (condition.available() != null) {
            whereClauses.add(condition.available() ? "b.availableCopies > 0" : "b.availableCopies = 0");
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);

        TypedQuery<Long> countQuery = entityManager.createQuery("select count(b) from Book b" + whereJpql, Long.class);
        params.forEach(countQuery::setParameter);
        long total = countQuery.getSingleResult();

        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<Book> dataQuery = entityManager.createQuery(
                "select b from Book b" + whereJpql + " order by b.title, b.id", Book.class);
        params.forEach(dataQuery::setParameter);
        dataQuery.setFirstResult((int) pageable.getOffset());
        dataQuery.setMaxResults(pageable.getPageSize());

        return new PageImpl<>(dataQuery.getResultList(), pageable, total);
    }
}
