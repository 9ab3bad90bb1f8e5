package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.ParticipantDto;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del servicio de registro de participantes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationServiceImpl implements RegistrationService {

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final SessionLifecycleManager sessionManager;
    private final TapResolver tapResolver;
    private final Clock clock;

    @Override
    public List<ParticipantDto> getAllParticipants() {
        return transactions.execute("listar participantes", () -> store.listParticipants().stream()
                .map(p -> ParticipantDto.fromDomain(p, store.groupsOf(p.getId())))
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<ParticipantDto> findByToken(String token) {
        return transactions.execute("buscar participante", () -> store.findParticipantByToken(token)
                .map(p -> ParticipantDto.fromDomain(p, store.groupsOf(p.getId()))));
    }

    @Override
    public ParticipantDto getParticipant(Long participantId) {
        return transactions.execute("consultar participante", () -> toDto(participantId));
    }

    @Override
    public ParticipantDto register(String displayName, String token, List<Long> groupIds) {
        log.info("Registrando nuevo participante: {} - {}", token, displayName);
        requireValidToken(token);

        ParticipantDto registered = transactions.execute("registrar participante", () -> {
            Participant participant = store.createParticipant(displayName, token);
            enrollAndMarkToday(participant.getId(), groupIds);
            return toDto(participant.getId());
        });

        log.info("Participante registrado exitosamente: id={}, grupos={}", registered.getId(), registered.getGroups());
        return registered;
    }

    @Override
    public ParticipantDto assignGroups(Long participantId, List<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            throw new IllegalArgumentException("Debe indicar al menos un grupo");
        }
        return transactions.execute("asignar grupos", () -> {
            store.requireParticipant(participantId);
            enrollAndMarkToday(participantId, groupIds);
            log.info("Participante {} asignado a grupos {}", participantId, groupIds);
            return toDto(participantId);
        });
    }

    @Override
    public ParticipantDto unenroll(Long participantId, Long groupId) {
        return transactions.execute("quitar inscripción", () -> {
            store.requireParticipant(participantId);
            store.unenroll(participantId, groupId);
            return toDto(participantId);
        });
    }

    @Override
    public ParticipantDto rename(Long participantId, String displayName) {
        return transactions.execute("renombrar participante", () -> {
            store.renameParticipant(participantId, displayName);
            return toDto(participantId);
        });
    }

    @Override
    public ParticipantDto changeToken(Long participantId, String token, boolean transfer) {
        if (token == null) {
            throw new IllegalArgumentException("El token es obligatorio");
        }
        requireValidToken(token);
        return transactions.execute("cambiar token", () -> {
            if (transfer) {
                store.transferToken(participantId, token);
            } else {
                store.reassignToken(participantId, token);
            }
            return toDto(participantId);
        });
    }

    @Override
    public ParticipantDto clearToken(Long participantId) {
        return transactions.execute("quitar token", () -> {
            store.clearToken(participantId);
            return toDto(participantId);
        });
    }

    @Override
    public void deleteParticipant(Long participantId) {
        log.info("Eliminando participante: {}", participantId);
        transactions.run("eliminar participante", () -> store.deleteParticipant(participantId));
    }

    @Override
    public long getParticipantCount() {
        return transactions.execute("contar participantes", () -> (long) store.listParticipants().size());
    }

    /**
     * Inscribe en cada grupo y marca presente en los que tienen clase hoy,
     * como si la tarjeta se hubiera pasado después del registro.
     */
    private void enrollAndMarkToday(Long participantId, List<Long> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            return;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> marked = new ArrayList<>();
        for (Long groupId : new LinkedHashSet<>(groupIds)) {
            ClassGroup group = store.requireGroup(groupId);
            store.enroll(participantId, groupId);
            if (!group.meetsOn(today.getDayOfWeek())) {
                continue;
            }
            ClassSession session = sessionManager.resolveInCurrentTransaction(groupId, today);
            if (store.findRecord(session.getId(), participantId).isEmpty()) {
                store.insertRecord(session.getId(), participantId, AttendanceStatus.PRESENT,
                        AttendanceOrigin.AUTOMATIC, now);
                marked.add(group.getName());
            }
        }
        if (!marked.isEmpty()) {
            log.info("Participante {} marcado presente en {}", participantId, marked);
        }
    }

    private void requireValidToken(String token) {
        if (token == null) {
            return;
        }
        tapResolver.validateToken(token.trim()).ifPresent(reason -> {
            throw AttendanceException.invalidToken(token, reason);
        });
    }

    private ParticipantDto toDto(Long participantId) {
        Participant participant = store.requireParticipant(participantId);
        return ParticipantDto.fromDomain(participant, store.groupsOf(participantId));
    }
}
