package com.rfidattendance.domain.model;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Conversión entre {@link DayOfWeek} y el nombre inglés que se guarda en la base
 * de datos ("Monday" ... "Sunday"). Nunca depende del locale del sistema.
 */
public final class Weekdays {

    private Weekdays() {
    }

    public static String label(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    /**
     * @throws IllegalArgumentException si el texto no es un día en inglés
     */
    public static DayOfWeek parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (DayOfWeek day : DayOfWeek.values()) {
                if (label(day).equalsIgnoreCase(trimmed)) {
                    return day;
                }
            }
        }
        throw new IllegalArgumentException("Día de la semana desconocido: " + value);
    }
}
