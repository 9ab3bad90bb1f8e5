package com.rfidattendance.domain.model;

/**
 * Estado de una sesión de clase.
 */
public enum SessionStatus {

    /** Creada por el primer toque del día, admite registros */
    OPEN,

    /** Cerrada por el operador o por el mantenimiento nocturno */
    CLOSED
}
