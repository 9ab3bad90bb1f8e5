package com.rfidattendance.domain.model;

/**
 * Resultado de verificar la credencial del administrador.
 */
public enum AuthResult {

    /** Credencial correcta */
    GRANTED,

    /** Credencial incorrecta, quedan intentos */
    DENIED,

    /** Se agotaron los intentos: hay que reiniciar el flujo */
    LOCKED_OUT;

    public boolean isGranted() {
        return this == GRANTED;
    }
}
