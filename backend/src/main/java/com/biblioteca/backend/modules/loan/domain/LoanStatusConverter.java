package com.biblioteca.backend.modules.loan.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class LoanStatusConverter implements AttributeConverter<LoanStatus, String> {

    @Override
    public String convertToDatabaseColumn(LoanStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public LoanStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : LoanStatus.fromCode(dbData);
    }
}
