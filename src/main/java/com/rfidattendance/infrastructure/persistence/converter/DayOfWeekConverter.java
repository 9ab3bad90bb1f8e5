package com.rfidattendance.infrastructure.persistence.converter;

import com.rfidattendance.domain.model.Weekdays;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;

/**
 * Guarda el día de la semana con su nombre inglés ("Monday").
 */
@Converter(autoApply = true)
public class DayOfWeekConverter implements AttributeConverter<DayOfWeek, String> {

    @Override
    public String convertToDatabaseColumn(DayOfWeek attribute) {
        return attribute == null ? null : Weekdays.label(attribute);
    }

    @Override
    public DayOfWeek convertToEntityAttribute(String dbData) {
        return dbData == null ? null : Weekdays.parse(dbData);
    }
}
