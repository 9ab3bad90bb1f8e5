package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Valores ajustables por el operador, cargados de la tabla settings al arrancar.
 * Inmutable: cada cambio produce una nueva instancia.
 */
@Value
@Builder(toBuilder = true)
public class OperatorSettings {

    /** Hash almacenado de la credencial; vacío si aún no se configuró */
    String adminCredential;

    /** Ausencias consecutivas a partir de las cuales se marca inactivo */
    int inactivityThreshold;

    String language;

    /** Mínimo de sesiones asistidas para importar alumnos sin tarjeta */
    int rosterImportMinSessions;

    public boolean isCredentialConfigured() {
        return adminCredential != null && !adminCredential.isEmpty();
    }
}
