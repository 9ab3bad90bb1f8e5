package com.rfidattendance.application.service;

import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.InactivityChange;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recalcula la bandera de inactividad a partir de las ausencias consecutivas
 * más recientes. Cada recálculo es completo y determinista.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InactivityEvaluator {

    private final AttendanceStore store;
    private final StoreTransactions transactions;

    /**
     * Recalcula la bandera de todos los participantes en una sola transacción.
     *
     * @param threshold Ausencias consecutivas para marcar inactivo (0 o más)
     * @return Cambios producidos
     */
    public InactivityChange recomputeAll(int threshold) {
        requireValidThreshold(threshold);
        InactivityChange change = transactions.execute("recalcular inactividad", () -> {
            InactivityChange total = InactivityChange.NONE;
            for (Participant participant : store.listParticipants()) {
                total = total.plus(apply(participant, threshold));
            }
            return total;
        });
        log.info("Inactividad recalculada (umbral {}): {} nuevos inactivos, {} reactivados",
                threshold, change.newlyInactive(), change.reactivated());
        return change;
    }

    /**
     * Recalcula la bandera de un participante.
     */
    public InactivityChange recomputeFor(Long participantId, int threshold) {
        requireValidThreshold(threshold);
        return transactions.execute("recalcular inactividad de participante",
                () -> recomputeInCurrentTransaction(participantId, threshold));
    }

    InactivityChange recomputeInCurrentTransaction(Long participantId, int threshold) {
        return apply(store.requireParticipant(participantId), threshold);
    }

    /**
     * Cuenta las sesiones finales (de la más reciente hacia atrás) sin asistencia.
     * Un participante sin inscripciones devuelve 0.
     */
    public int trailingAbsences(Long participantId) {
        return transactions.execute("contar ausencias", () -> countTrailingAbsences(participantId));
    }

    private InactivityChange apply(Participant participant, int threshold) {
        boolean inactive = store.hasEnrollments(participant.getId())
                && countTrailingAbsences(participant.getId()) >= threshold;
        if (inactive == participant.isInactive()) {
            return InactivityChange.NONE;
        }
        store.setInactive(participant.getId(), inactive);
        log.debug("Participante {} marcado como {}", participant.getId(), inactive ? "inactivo" : "activo");
        return inactive ? new InactivityChange(1, 0) : new InactivityChange(0, 1);
    }

    private int countTrailingAbsences(Long participantId) {
        Set<Long> groupIds = store.groupsOf(participantId).stream()
                .map(ClassGroup::getId)
                .collect(Collectors.toSet());
        if (groupIds.isEmpty()) {
            return 0;
        }

        Set<Long> attendedSessions = store.recordsOfParticipant(participantId).stream()
                .filter(AttendanceRecord::isPresent)
                .map(AttendanceRecord::getSessionId)
                .collect(Collectors.toSet());

        List<ClassSession> sessions = store.sessionsForGroups(groupIds);
        int run = 0;
        for (ClassSession session : sessions) {
            if (attendedSessions.contains(session.getId())) {
                break;
            }
            run++;
        }
        return run;
    }

    private void requireValidThreshold(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("El umbral de inactividad no puede ser negativo: " + threshold);
        }
    }
}
