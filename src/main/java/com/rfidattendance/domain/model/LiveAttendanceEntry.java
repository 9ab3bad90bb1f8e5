package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Estado en vivo de un inscrito dentro de una sesión.
 */
@Value
@Builder
public class LiveAttendanceEntry {

    Long participantId;
    String displayName;
    String token;

    /** Nulo si todavía no hay registro */
    AttendanceStatus status;

    /** Nulo si todavía no hay registro */
    AttendanceOrigin origin;

    public boolean isRecorded() {
        return status != null;
    }
}
