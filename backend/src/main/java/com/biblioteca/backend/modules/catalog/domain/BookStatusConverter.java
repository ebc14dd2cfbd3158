package com.biblioteca.backend.modules.catalog.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class BookStatusConverter implements AttributeConverter<BookStatus, String> {

    @Override
    public String convertToDatabaseColumn(BookStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public BookStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : BookStatus.fromCode(dbData);
    }
}
