package com.rfidattendance.infrastructure.persistence.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Guarda la hora de clase como HH:mm.
 */
@Converter(autoApply = true)
public class LocalTimeTextConverter implements AttributeConverter<LocalTime, String> {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    @Override
    public String convertToDatabaseColumn(LocalTime attribute) {
        return attribute == null ? null : attribute.format(FORMAT);
    }

    @Override
    public LocalTime convertToEntityAttribute(String dbData) {
        return dbData == null || dbData.isBlank() ? null : LocalTime.parse(dbData.trim(), FORMAT);
    }
}
