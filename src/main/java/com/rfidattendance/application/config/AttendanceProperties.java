package com.rfidattendance.application.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Parámetros estáticos del motor de asistencia (prefijo {@code attendance}).
 * Los valores que el operador cambia en caliente viven en la tabla settings.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Dígitos exactos de un token válido */
    private int tokenLength = 10;

    /** Iteraciones PBKDF2 para nuevas credenciales */
    private int credentialIterations = 260_000;

    /** Fallos permitidos antes del bloqueo */
    private int maxFailedAttempts = 5;

    /** Umbral usado si la tabla settings no trae uno válido */
    private int defaultInactivityThreshold = 3;

    /** Tiempo máximo para publicar el resumen en la hoja de cálculo */
    private long pushTimeoutSeconds = 30;
}
