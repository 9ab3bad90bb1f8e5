package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Resumen generado al cerrar una sesión.
 */
@Value
@Builder
public class SessionSummary {

    Long sessionId;
    String groupName;
    LocalDate date;

    /** Inscritos activos (los inactivos no cuentan) */
    int totalEnrolled;
    int presentCount;
    int absentCount;

    /** Nombres de los participantes ausentes */
    List<String> absentParticipants;
}
