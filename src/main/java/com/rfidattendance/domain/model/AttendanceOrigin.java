package com.rfidattendance.domain.model;

/**
 * Origen de un registro de asistencia.
 */
public enum AttendanceOrigin {

    /** Lectura de tarjeta procesada por el resolvedor de toques */
    AUTOMATIC,

    /** Corrección administrativa */
    MANUAL
}
