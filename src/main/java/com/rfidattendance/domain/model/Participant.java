package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Modelo de dominio que representa a un participante (alumno).
 * Es una instantánea inmutable: modificarla no afecta al almacén.
 */
@Value
@Builder(toBuilder = true)
public class Participant {

    /** Identificador interno */
    Long id;

    /** Token de la tarjeta (10 dígitos). Nulo hasta la primera lectura asignada */
    String token;

    /** Nombre mostrado en pantalla */
    String displayName;

    /** Marcado como inactivo por ausencias consecutivas */
    boolean inactive;

    /** Fecha y hora de alta */
    LocalDateTime createdAt;

    /**
     * Indica si el participante tiene una tarjeta asignada.
     *
     * @return true si el token no es nulo
     */
    public boolean hasToken() {
        return token != null;
    }
}
