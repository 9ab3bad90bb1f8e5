package com.rfidattendance.application.service;

import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Correcciones de asistencia hechas por el operador.
 * Nunca pasan por el lector: no importa el día de la semana ni los registros previos,
 * y el origen siempre queda como MANUAL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualAttendanceService {

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final SessionLifecycleManager sessionManager;
    private final Clock clock;

    /**
     * Fija el estado de un participante en la sesión del grupo en esa fecha,
     * creando la sesión si hace falta.
     *
     * @return Registro resultante
     */
    public AttendanceRecord setAttendance(Long participantId, Long groupId, LocalDate date, AttendanceStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("El estado de asistencia es obligatorio");
        }
        return transactions.execute("fijar asistencia", () -> {
            store.requireParticipant(participantId);
            ClassSession session = sessionManager.resolveInCurrentTransaction(groupId, date);
            return upsert(session.getId(), participantId, status);
        });
    }

    /**
     * Marca presente a un participante en una sesión existente.
     */
    public AttendanceRecord markPresentManually(Long sessionId, Long participantId) {
        return transactions.execute("marcar presente", () -> {
            store.requireSession(sessionId);
            store.requireParticipant(participantId);
            return upsert(sessionId, participantId, AttendanceStatus.PRESENT);
        });
    }

    /**
     * Alterna presente/ausente. Sin registro previo, el resultado es presente.
     */
    public AttendanceRecord toggleAttendance(Long sessionId, Long participantId) {
        return transactions.execute("alternar asistencia", () -> {
            store.requireSession(sessionId);
            store.requireParticipant(participantId);
            AttendanceStatus next = store.findRecord(sessionId, participantId)
                    .map(r -> r.getStatus().toggled())
                    .orElse(AttendanceStatus.PRESENT);
            return upsert(sessionId, participantId, next);
        });
    }

    private AttendanceRecord upsert(Long sessionId, Long participantId, AttendanceStatus status) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<AttendanceRecord> existing = store.findRecord(sessionId, participantId);
        if (existing.isEmpty()) {
            log.info("Asistencia manual {}: participante {} en sesión {}", status, participantId, sessionId);
            return store.insertRecord(sessionId, participantId, status, AttendanceOrigin.MANUAL, now);
        }
        AttendanceRecord record = existing.get();
        if (record.getStatus() == status) {
            return record;
        }
        log.info("Asistencia corregida {} -> {}: participante {} en sesión {}",
                record.getStatus(), status, participantId, sessionId);
        return store.transitionRecord(record.getId(), status, now);
    }
}
