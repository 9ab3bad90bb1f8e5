package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Fila de una lista de alumnos externa.
 */
@Value
@Builder
public class RosterRow {

    String displayName;

    /** Puede ser nulo: alumnos que nunca pasaron su tarjeta */
    String token;

    /** Sesiones con asistencia en la hoja de origen */
    int attendedSessions;

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
