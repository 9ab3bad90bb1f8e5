package com.rfidattendance.application.service;

import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.LiveAttendanceEntry;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SessionSummary;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ciclo de vida de las sesiones: creación bajo demanda, cierre y vista en vivo.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleManager {

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final Clock clock;

    /**
     * Devuelve la sesión del grupo en la fecha, creándola si no existe.
     * Llamarlo N veces deja exactamente una fila.
     *
     * @param groupId Grupo existente
     * @param date    Fecha de la sesión
     * @return Sesión almacenada
     */
    public ClassSession resolveSession(Long groupId, LocalDate date) {
        return transactions.execute("resolver sesión", () -> resolveInCurrentTransaction(groupId, date));
    }

    /**
     * Variante para llamadores que ya abrieron una transacción.
     */
    ClassSession resolveInCurrentTransaction(Long groupId, LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("La fecha de la sesión es obligatoria");
        }
        store.requireGroup(groupId);
        return store.findSession(groupId, date)
                .orElseGet(() -> store.insertSessionIfAbsent(groupId, date, LocalDateTime.now(clock)));
    }

    /**
     * Cierra la sesión: los inscritos activos sin asistencia quedan ausentes
     * (origen MANUAL) y se fija la hora de fin. Cerrar dos veces no reescribe nada.
     *
     * @return Resumen de la sesión
     */
    public SessionSummary closeSession(Long sessionId) {
        return transactions.execute("cerrar sesión", () -> closeInCurrentTransaction(sessionId));
    }

    SessionSummary closeInCurrentTransaction(Long sessionId) {
        ClassSession session = store.requireSession(sessionId);
        if (!session.isOpen()) {
            log.debug("La sesión {} ya estaba cerrada", sessionId);
            return summarize(session);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Map<Long, AttendanceRecord> records = recordsByParticipant(sessionId);
        int markedAbsent = 0;
        for (Participant participant : store.enrolledParticipants(session.getGroupId())) {
            if (participant.isInactive() || records.containsKey(participant.getId())) {
                continue;
            }
            store.insertRecord(sessionId, participant.getId(), AttendanceStatus.ABSENT,
                    AttendanceOrigin.MANUAL, now);
            markedAbsent++;
        }

        ClassSession closed = store.closeSession(sessionId, now);
        log.info("Sesión {} cerrada ({} ausentes añadidos)", sessionId, markedAbsent);
        return summarize(closed);
    }

    /**
     * Estado de cada inscrito en la sesión, incluidos los que aún no tienen registro.
     */
    public List<LiveAttendanceEntry> liveAttendance(Long sessionId) {
        return transactions.execute("asistencia en vivo", () -> {
            ClassSession session = store.requireSession(sessionId);
            Map<Long, AttendanceRecord> records = recordsByParticipant(sessionId);

            List<LiveAttendanceEntry> entries = new ArrayList<>();
            for (Participant participant : store.enrolledParticipants(session.getGroupId())) {
                AttendanceRecord record = records.get(participant.getId());
                entries.add(LiveAttendanceEntry.builder()
                        .participantId(participant.getId())
                        .displayName(participant.getDisplayName())
                        .token(participant.getToken())
                        .status(record != null ? record.getStatus() : null)
                        .origin(record != null ? record.getOrigin() : null)
                        .build());
            }
            return entries;
        });
    }

    public List<ClassSession> sessionsOn(LocalDate date) {
        return transactions.execute("sesiones del día", () -> store.sessionsOn(date));
    }

    private SessionSummary summarize(ClassSession session) {
        ClassGroup group = store.requireGroup(session.getGroupId());
        Map<Long, AttendanceRecord> records = recordsByParticipant(session.getId());

        // Inscritos y presentes cuentan a todos; los ausentes sólo a los activos
        List<Participant> enrolled = store.enrolledParticipants(group.getId());
        int present = 0;
        List<String> absentNames = new ArrayList<>();
        for (Participant participant : enrolled) {
            AttendanceRecord record = records.get(participant.getId());
            if (record != null && record.isPresent()) {
                present++;
            } else if (!participant.isInactive()) {
                absentNames.add(participant.getDisplayName());
            }
        }

        return SessionSummary.builder()
                .sessionId(session.getId())
                .groupName(group.getName())
                .date(session.getDate())
                .totalEnrolled(enrolled.size())
                .presentCount(present)
                .absentCount(absentNames.size())
                .absentParticipants(List.copyOf(absentNames))
                .build();
    }

    private Map<Long, AttendanceRecord> recordsByParticipant(Long sessionId) {
        return store.recordsOfSession(sessionId).stream()
                .collect(Collectors.toMap(AttendanceRecord::getParticipantId, Function.identity()));
    }
}
