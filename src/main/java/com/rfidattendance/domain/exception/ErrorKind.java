package com.rfidattendance.domain.exception;

/**
 * Clasificación de los errores que cruzan la frontera del núcleo.
 */
public enum ErrorKind {

    INVALID_TOKEN,

    NOT_FOUND,

    /** Violación de una restricción UNIQUE o PRIMARY KEY */
    UNIQUENESS_VIOLATION,

    /** Violación de una clave foránea */
    REFERENTIAL_INTEGRITY,

    /** Base de datos bloqueada, inaccesible o fallo al confirmar */
    STORE_UNAVAILABLE,

    AUTH_LOCKOUT,

    /** Operación administrativa sin sesión desbloqueada */
    AUTH_REQUIRED
}
