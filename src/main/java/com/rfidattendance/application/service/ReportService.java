package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.DailyReportDto;
import com.rfidattendance.application.dto.LiveAttendanceDto;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.LiveAttendanceEntry;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SummaryRow;
import com.rfidattendance.domain.model.Weekdays;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Informes de asistencia de sólo lectura.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final SessionLifecycleManager sessionManager;

    /**
     * Total de asistencias de cada participante sobre las sesiones de sus grupos.
     */
    public List<SummaryRow> participantSummaries() {
        return transactions.execute("resumen por participante", () -> store.listParticipants().stream()
                .map(this::summarize)
                .collect(Collectors.toList()));
    }

    /**
     * Estado de cada inscrito del grupo en la fecha. Si no hubo sesión, todos
     * figuran sin registro.
     */
    public DailyReportDto dailyReport(Long groupId, LocalDate date) {
        ClassGroup group = transactions.execute("informe diario", () -> store.requireGroup(groupId));
        Optional<ClassSession> session = transactions.execute("informe diario",
                () -> store.findSession(groupId, date));

        List<LiveAttendanceEntry> entries = session
                .map(s -> sessionManager.liveAttendance(s.getId()))
                .orElseGet(() -> transactions.execute("informe diario", () -> notRecorded(groupId)));

        List<LiveAttendanceDto> participants = entries.stream()
                .map(LiveAttendanceDto::fromDomain)
                .collect(Collectors.toList());
        int present = (int) entries.stream().filter(e -> e.getStatus() == AttendanceStatus.PRESENT).count();
        int noRecord = (int) entries.stream().filter(e -> !e.isRecorded()).count();

        return DailyReportDto.builder()
                .groupName(group.getName())
                .date(date.toString())
                .weekday(Weekdays.label(date.getDayOfWeek()))
                .sessionHeld(session.isPresent())
                .totalEnrolled(entries.size())
                .presentCount(present)
                .absentCount(entries.size() - present - noRecord)
                .noRecordCount(noRecord)
                .participants(participants)
                .build();
    }

    private List<LiveAttendanceEntry> notRecorded(Long groupId) {
        List<LiveAttendanceEntry> entries = new ArrayList<>();
        for (Participant participant : store.enrolledParticipants(groupId)) {
            entries.add(LiveAttendanceEntry.builder()
                    .participantId(participant.getId())
                    .displayName(participant.getDisplayName())
                    .token(participant.getToken())
                    .build());
        }
        return entries;
    }

    /**
     * Resumen de un participante para llamadores que ya abrieron una transacción.
     */
    SummaryRow summaryInCurrentTransaction(Participant participant) {
        return summarize(participant);
    }

    private SummaryRow summarize(Participant participant) {
        Set<Long> groupIds = store.groupsOf(participant.getId()).stream()
                .map(ClassGroup::getId)
                .collect(Collectors.toSet());
        Set<Long> sessionIds = store.sessionsForGroups(groupIds).stream()
                .map(ClassSession::getId)
                .collect(Collectors.toSet());
        int attended = (int) store.recordsOfParticipant(participant.getId()).stream()
                .filter(AttendanceRecord::isPresent)
                .filter(r -> sessionIds.contains(r.getSessionId()))
                .count();

        return SummaryRow.builder()
                .participantId(participant.getId())
                .displayName(participant.getDisplayName())
                .token(participant.getToken())
                .inactive(participant.isInactive())
                .attended(attended)
                .totalSessions(sessionIds.size())
                .build();
    }
}
