package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Ocurrencia concreta de un grupo en una fecha. Única por (grupo, fecha).
 */
@Value
@Builder(toBuilder = true)
public class ClassSession {

    Long id;

    Long groupId;

    /** Fecha de calendario de la sesión */
    LocalDate date;

    LocalDateTime startAt;

    /** Nulo mientras la sesión está abierta */
    LocalDateTime endAt;

    SessionStatus status;

    public boolean isOpen() {
        return status == SessionStatus.OPEN;
    }
}
