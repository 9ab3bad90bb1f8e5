package com.rfidattendance.application.service;

import com.rfidattendance.application.config.AttendanceProperties;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SummaryRow;
import com.rfidattendance.domain.model.TapOutcome;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Convierte un token leído en un resultado tipado y hace las escrituras
 * correspondientes en una única transacción.
 */
@Service
@Slf4j
public class TapResolver {

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final SessionLifecycleManager sessionManager;
    private final InactivityEvaluator inactivityEvaluator;
    private final SettingsService settingsService;
    private final ReportService reportService;
    private final Clock clock;
    private final int tokenLength;

    public TapResolver(AttendanceStore store, StoreTransactions transactions,
                       SessionLifecycleManager sessionManager, InactivityEvaluator inactivityEvaluator,
                       SettingsService settingsService, ReportService reportService, Clock clock,
                       AttendanceProperties properties) {
        this.store = store;
        this.transactions = transactions;
        this.sessionManager = sessionManager;
        this.inactivityEvaluator = inactivityEvaluator;
        this.settingsService = settingsService;
        this.reportService = reportService;
        this.clock = clock;
        this.tokenLength = properties.getTokenLength();
    }

    /**
     * Procesa un toque de tarjeta.
     *
     * @param rawToken Token tal como llegó del lector o de la API
     * @return Resultado del toque
     */
    public TapOutcome resolveTap(String rawToken) {
        String token = rawToken == null ? "" : rawToken.trim();
        Optional<String> problem = validateToken(token);
        if (problem.isPresent()) {
            log.warn("Token rechazado '{}': {}", token, problem.get());
            return new TapOutcome.InvalidToken(token, problem.get());
        }

        TapOutcome outcome = transactions.execute("procesar toque", () -> resolveValidToken(token));
        log.info("Toque {} -> {}", token, outcome.type());
        return outcome;
    }

    /**
     * Comprobación estructural del token: exactamente N dígitos.
     *
     * @return Motivo del rechazo, vacío si es válido
     */
    public Optional<String> validateToken(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.of("token vacío");
        }
        if (token.length() != tokenLength) {
            return Optional.of("se esperaban " + tokenLength + " dígitos, llegaron " + token.length());
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.of("sólo se admiten dígitos");
            }
        }
        return Optional.empty();
    }

    private TapOutcome resolveValidToken(String token) {
        Optional<Participant> found = store.findParticipantByToken(token);
        if (found.isEmpty()) {
            return new TapOutcome.UnknownToken(token);
        }
        Participant participant = found.get();
        if (!store.hasEnrollments(participant.getId())) {
            return new TapOutcome.NoEnrollment(token, participant);
        }

        LocalDate today = LocalDate.now(clock);
        DayOfWeek weekday = today.getDayOfWeek();
        List<ClassGroup> todaysGroups = store.groupsOn(participant.getId(), weekday);
        if (todaysGroups.isEmpty()) {
            log.debug("Participante {} sin grupos el {}", participant.getId(), weekday);
            SummaryRow tally = reportService.summaryInCurrentTransaction(participant);
            return new TapOutcome.Recorded(token, participant, List.of(), List.of(), participant.isInactive(),
                    tally.getAttended(), tally.getTotalSessions());
        }

        List<String> recorded = new ArrayList<>();
        List<String> satisfied = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);
        for (ClassGroup group : todaysGroups) {
            ClassSession session = sessionManager.resolveInCurrentTransaction(group.getId(), today);
            if (store.findRecord(session.getId(), participant.getId()).isPresent()) {
                satisfied.add(group.getName());
                continue;
            }
            store.insertRecord(session.getId(), participant.getId(), AttendanceStatus.PRESENT,
                    AttendanceOrigin.AUTOMATIC, now);
            recorded.add(group.getName());
        }

        if (recorded.isEmpty()) {
            SummaryRow tally = reportService.summaryInCurrentTransaction(participant);
            return new TapOutcome.Duplicate(token, participant, satisfied,
                    tally.getAttended(), tally.getTotalSessions());
        }

        // Asistir puede reactivar al participante
        inactivityEvaluator.recomputeInCurrentTransaction(participant.getId(),
                settingsService.current().getInactivityThreshold());
        SummaryRow tally = reportService.summaryInCurrentTransaction(participant);
        return new TapOutcome.Recorded(token, participant, recorded, satisfied, participant.isInactive(),
                tally.getAttended(), tally.getTotalSessions());
    }
}
