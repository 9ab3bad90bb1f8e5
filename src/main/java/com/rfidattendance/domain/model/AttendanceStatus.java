package com.rfidattendance.domain.model;

/**
 * Estado de asistencia de un participante en una sesión.
 */
public enum AttendanceStatus {
    PRESENT,
    ABSENT;

    /**
     * Devuelve el estado contrario.
     */
    public AttendanceStatus toggled() {
        return this == PRESENT ? ABSENT : PRESENT;
    }
}
