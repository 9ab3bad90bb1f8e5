package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Hecho de asistencia de un participante en una sesión.
 * Único por (sesión, participante).
 */
@Value
@Builder(toBuilder = true)
public class AttendanceRecord {

    Long id;

    Long sessionId;

    Long participantId;

    AttendanceStatus status;

    /** AUTOMATIC si vino de una lectura de tarjeta, MANUAL si fue el operador */
    AttendanceOrigin origin;

    LocalDateTime recordedAt;

    public boolean isPresent() {
        return status == AttendanceStatus.PRESENT;
    }
}
