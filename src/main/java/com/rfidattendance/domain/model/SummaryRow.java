package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Total de asistencias de un participante sobre las sesiones de sus grupos.
 */
@Value
@Builder
public class SummaryRow {

    Long participantId;
    String displayName;
    String token;
    boolean inactive;
    int attended;
    int totalSessions;

    public double getAttendanceRate() {
        return totalSessions == 0 ? 0.0 : (double) attended / totalSessions;
    }
}
