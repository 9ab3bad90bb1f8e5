package com.rfidattendance.domain.exception;

import lombok.Getter;

/**
 * Excepción lanzada por el núcleo de asistencia.
 * Siempre lleva un {@link ErrorKind} para que la capa de presentación
 * pueda decidir la respuesta sin inspeccionar mensajes.
 */
@Getter
public class AttendanceException extends RuntimeException {

    private final ErrorKind kind;

    public AttendanceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AttendanceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Token con formato inválido.
     */
    public static AttendanceException invalidToken(String token, String reason) {
        return new AttendanceException(ErrorKind.INVALID_TOKEN,
                String.format("Token inválido '%s': %s", token, reason));
    }

    /**
     * La entidad solicitada no existe.
     */
    public static AttendanceException notFound(String entity, Object id) {
        return new AttendanceException(ErrorKind.NOT_FOUND,
                String.format("%s no encontrado: %s", entity, id));
    }

    /**
     * El token ya pertenece a otro participante.
     */
    public static AttendanceException tokenAlreadyAssigned(String token) {
        return new AttendanceException(ErrorKind.UNIQUENESS_VIOLATION,
                "El token ya está asignado a otro participante: " + token);
    }

    public static AttendanceException uniquenessViolation(String detail, Throwable cause) {
        return new AttendanceException(ErrorKind.UNIQUENESS_VIOLATION,
                "Registro duplicado: " + detail, cause);
    }

    public static AttendanceException referentialIntegrity(String detail, Throwable cause) {
        return new AttendanceException(ErrorKind.REFERENTIAL_INTEGRITY,
                "Referencia inválida: " + detail, cause);
    }

    /**
     * La base de datos no está disponible (bloqueada, sin disco, fallo de commit).
     */
    public static AttendanceException storeUnavailable(String operation, Throwable cause) {
        return new AttendanceException(ErrorKind.STORE_UNAVAILABLE,
                "Base de datos no disponible durante: " + operation, cause);
    }

    public static AttendanceException lockedOut() {
        return new AttendanceException(ErrorKind.AUTH_LOCKOUT,
                "Demasiados intentos fallidos, reinicie el flujo de autenticación");
    }

    public static AttendanceException authRequired() {
        return new AttendanceException(ErrorKind.AUTH_REQUIRED,
                "Se requiere autenticación de administrador");
    }
}
