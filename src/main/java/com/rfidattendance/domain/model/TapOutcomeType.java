package com.rfidattendance.domain.model;

/**
 * Tipos posibles de resultado de un toque de tarjeta.
 * Cada valor corresponde exactamente a una variante de {@link TapOutcome}.
 */
public enum TapOutcomeType {

    /** Token con formato inválido, rechazado antes de consultar el almacén */
    INVALID_TOKEN,

    /** Ningún participante tiene ese token: se requiere registro */
    UNKNOWN_TOKEN,

    /** Participante sin grupos asignados: se requiere asignación */
    NO_ENROLLMENT,

    /** Asistencia registrada en al menos un grupo de hoy */
    RECORDED,

    /** Todos los grupos de hoy ya tenían registro */
    DUPLICATE
}
