package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Grupo (sección) que se repite una vez por semana en un día y hora fijos.
 */
@Value
@Builder(toBuilder = true)
public class ClassGroup {

    Long id;

    String name;

    /** Technique o Normal */
    GroupCategory category;

    /** Beginner, Intermediate o Advanced */
    GroupLevel level;

    /** Día de la semana de la clase, independiente del locale */
    DayOfWeek weekday;

    /** Hora de inicio de la clase */
    LocalTime startTime;

    /**
     * Verifica si el grupo tiene clase en el día indicado.
     *
     * @param day Día de la semana a comparar
     * @return true si coincide con la recurrencia del grupo
     */
    public boolean meetsOn(DayOfWeek day) {
        return weekday == day;
    }
}
