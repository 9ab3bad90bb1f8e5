package com.rfidattendance.infrastructure.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalDate;

/**
 * Guarda fechas como texto ISO (yyyy-MM-dd), que SQLite ordena correctamente.
 */
@Converter(autoApply = true)
public class LocalDateTextConverter implements AttributeConverter<LocalDate, String> {

    @Override
    public String convertToDatabaseColumn(LocalDate attribute) {
        return attribute == null ? null : attribute.toString();
    }

    @Override
    public LocalDate convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : LocalDate.parse(dbData.trim());
    }
}
