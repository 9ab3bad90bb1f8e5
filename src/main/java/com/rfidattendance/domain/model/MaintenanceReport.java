package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Resultado de una ejecución del mantenimiento nocturno.
 */
@Value
@Builder
public class MaintenanceReport {

    LocalDateTime executedAt;
    int sessionsClosed;
    int newlyInactive;
    int reactivated;
}
