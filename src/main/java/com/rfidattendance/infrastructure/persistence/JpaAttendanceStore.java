package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SessionStatus;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.converter.LocalDateTimeTextConverter;
import com.rfidattendance.infrastructure.persistence.entity.AttendanceRecordEntity;
import com.rfidattendance.infrastructure.persistence.entity.ClassGroupEntity;
import com.rfidattendance.infrastructure.persistence.entity.ClassSessionEntity;
import com.rfidattendance.infrastructure.persistence.entity.EnrollmentEntity;
import com.rfidattendance.infrastructure.persistence.entity.EnrollmentId;
import com.rfidattendance.infrastructure.persistence.entity.ParticipantEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementación del puerto AttendanceStore usando JPA sobre SQLite.
 * Las entidades nunca salen de esta clase: se convierten a modelos de dominio.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAttendanceStore implements AttendanceStore {

    private final JpaParticipantRepository participantRepository;
    private final JpaClassGroupRepository groupRepository;
    private final JpaEnrollmentRepository enrollmentRepository;
    private final JpaClassSessionRepository sessionRepository;
    private final JpaAttendanceRecordRepository recordRepository;
    private final Clock clock;

    // ---- Participantes ----

    @Override
    @Transactional
    public Participant createParticipant(String displayName, String token) {
        String name = requireText(displayName, "El nombre del participante");
        String normalized = normalizeToken(token);
        if (normalized != null && participantRepository.findByToken(normalized).isPresent()) {
            throw AttendanceException.tokenAlreadyAssigned(normalized);
        }

        ParticipantEntity saved = participantRepository.saveAndFlush(ParticipantEntity.builder()
                .displayName(name)
                .token(normalized)
                .inactive(false)
                .createdAt(LocalDateTime.now(clock))
                .build());
        log.info("Participante creado: id={}, nombre={}", saved.getId(), saved.getDisplayName());
        return toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Participant> findParticipant(Long participantId) {
        return participantRepository.findById(participantId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Participant> findParticipantByToken(String token) {
        String normalized = normalizeToken(token);
        if (normalized == null) {
            return Optional.empty();
        }
        return participantRepository.findByToken(normalized).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Participant requireParticipant(Long participantId) {
        return toDomain(participantEntity(participantId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Participant> listParticipants() {
        return participantRepository.findAllByOrderByDisplayNameAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public Participant renameParticipant(Long participantId, String displayName) {
        ParticipantEntity entity = participantEntity(participantId);
        entity.setDisplayName(requireText(displayName, "El nombre del participante"));
        return toDomain(participantRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public Participant reassignToken(Long participantId, String token) {
        participantEntity(participantId);
        String normalized = requireText(normalizeToken(token), "El token");
        if (participantRepository.existsByTokenAndIdNot(normalized, participantId)) {
            throw AttendanceException.tokenAlreadyAssigned(normalized);
        }
        participantRepository.updateToken(participantId, normalized);
        log.info("Token reasignado al participante {}", participantId);
        return toDomain(participantEntity(participantId));
    }

    @Override
    @Transactional
    public Participant transferToken(Long participantId, String token) {
        participantEntity(participantId);
        String normalized = requireText(normalizeToken(token), "El token");
        // Primero se libera el token, luego se asigna
        int cleared = participantRepository.clearTokenFromOthers(normalized, participantId);
        participantRepository.updateToken(participantId, normalized);
        log.info("Token transferido al participante {} (liberado de {} participante(s))", participantId, cleared);
        return toDomain(participantEntity(participantId));
    }

    @Override
    @Transactional
    public Participant clearToken(Long participantId) {
        participantEntity(participantId);
        participantRepository.updateToken(participantId, null);
        return toDomain(participantEntity(participantId));
    }

    @Override
    @Transactional
    public void setInactive(Long participantId, boolean inactive) {
        if (participantRepository.updateInactive(participantId, inactive) == 0) {
            throw AttendanceException.notFound("Participante", participantId);
        }
    }

    @Override
    @Transactional
    public void deleteParticipant(Long participantId) {
        participantEntity(participantId);
        int records = recordRepository.deleteAllOfParticipant(participantId);
        int enrollments = enrollmentRepository.deleteAllOfParticipant(participantId);
        participantRepository.deleteById(participantId);
        participantRepository.flush();
        log.info("Participante {} eliminado ({} registros, {} inscripciones)", participantId, records, enrollments);
    }

    // ---- Grupos ----

    @Override
    @Transactional
    public ClassGroup createGroup(ClassGroup group) {
        validateGroup(group);
        ClassGroupEntity saved = groupRepository.saveAndFlush(ClassGroupEntity.builder()
                .name(group.getName().trim())
                .category(group.getCategory())
                .level(group.getLevel())
                .weekday(group.getWeekday())
                .startTime(group.getStartTime())
                .build());
        log.info("Grupo creado: id={}, nombre={}, día={}", saved.getId(), saved.getName(), saved.getWeekday());
        return toDomain(saved);
    }

    @Override
    @Transactional
    public ClassGroup updateGroup(ClassGroup group) {
        validateGroup(group);
        ClassGroupEntity entity = groupEntity(group.getId());
        entity.setName(group.getName().trim());
        entity.setCategory(group.getCategory());
        entity.setLevel(group.getLevel());
        entity.setWeekday(group.getWeekday());
        entity.setStartTime(group.getStartTime());
        return toDomain(groupRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ClassGroup> findGroup(Long groupId) {
        return groupRepository.findById(groupId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public ClassGroup requireGroup(Long groupId) {
        return toDomain(groupEntity(groupId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassGroup> listGroups() {
        return groupRepository.findAllByOrderByNameAsc().stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void deleteGroup(Long groupId) {
        groupEntity(groupId);
        // Orden obligatorio con foreign_keys=ON
        int records = recordRepository.deleteAllOfGroup(groupId);
        int sessions = sessionRepository.deleteAllOfGroup(groupId);
        int enrollments = enrollmentRepository.deleteAllOfGroup(groupId);
        groupRepository.deleteById(groupId);
        groupRepository.flush();
        log.info("Grupo {} eliminado ({} registros, {} sesiones, {} inscripciones)",
                groupId, records, sessions, enrollments);
    }

    // ---- Inscripciones ----

    @Override
    @Transactional
    public void enroll(Long participantId, Long groupId) {
        participantEntity(participantId);
        groupEntity(groupId);
        EnrollmentId id = new EnrollmentId(participantId, groupId);
        if (!enrollmentRepository.existsById(id)) {
            enrollmentRepository.saveAndFlush(new EnrollmentEntity(participantId, groupId));
            log.debug("Participante {} inscrito en grupo {}", participantId, groupId);
        }
    }

    @Override
    @Transactional
    public void unenroll(Long participantId, Long groupId) {
        EnrollmentId id = new EnrollmentId(participantId, groupId);
        if (enrollmentRepository.existsById(id)) {
            enrollmentRepository.deleteById(id);
            enrollmentRepository.flush();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassGroup> groupsOf(Long participantId) {
        return groupRepository.findByParticipant(participantId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassGroup> groupsOn(Long participantId, DayOfWeek weekday) {
        return groupRepository.findByParticipantAndWeekday(participantId, weekday).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Participant> enrolledParticipants(Long groupId) {
        return participantRepository.findEnrolledIn(groupId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasEnrollments(Long participantId) {
        return enrollmentRepository.existsByParticipantId(participantId);
    }

    // ---- Sesiones ----

    @Override
    @Transactional(readOnly = true)
    public Optional<ClassSession> findSession(Long groupId, LocalDate date) {
        return sessionRepository.findByGroupIdAndSessionDate(groupId, date).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public ClassSession requireSession(Long sessionId) {
        return toDomain(sessionEntity(sessionId));
    }

    @Override
    @Transactional
    public ClassSession insertSessionIfAbsent(Long groupId, LocalDate date, LocalDateTime startAt) {
        int inserted = sessionRepository.insertIfAbsent(groupId, date.toString(),
                startAt.format(LocalDateTimeTextConverter.FORMAT));
        ClassSessionEntity stored = sessionRepository.findByGroupIdAndSessionDate(groupId, date)
                .orElseThrow(() -> AttendanceException.notFound("Sesión del grupo " + groupId, date));
        if (inserted > 0) {
            log.info("Sesión creada: id={}, grupo={}, fecha={}", stored.getId(), groupId, date);
        }
        return toDomain(stored);
    }

    @Override
    @Transactional
    public ClassSession closeSession(Long sessionId, LocalDateTime endAt) {
        ClassSessionEntity entity = sessionEntity(sessionId);
        entity.setStatus(SessionStatus.CLOSED);
        entity.setEndAt(endAt);
        return toDomain(sessionRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassSession> sessionsForGroups(Collection<Long> groupIds) {
        if (groupIds.isEmpty()) {
            return List.of();
        }
        return sessionRepository.findByGroupsNewestFirst(groupIds).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassSession> openSessionsBefore(LocalDate date) {
        return sessionRepository.findByStatusAndSessionDateBeforeOrderBySessionDateAsc(SessionStatus.OPEN, date)
                .stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassSession> sessionsOn(LocalDate date) {
        return sessionRepository.findBySessionDateOrderByStartAtAsc(date).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    // ---- Registros de asistencia ----

    @Override
    @Transactional(readOnly = true)
    public Optional<AttendanceRecord> findRecord(Long sessionId, Long participantId) {
        return recordRepository.findBySessionIdAndParticipantId(sessionId, participantId).map(this::toDomain);
    }

    @Override
    @Transactional
    public AttendanceRecord insertRecord(Long sessionId, Long participantId, AttendanceStatus status,
                                         AttendanceOrigin origin, LocalDateTime recordedAt) {
        AttendanceRecordEntity saved = recordRepository.saveAndFlush(AttendanceRecordEntity.builder()
                .sessionId(sessionId)
                .participantId(participantId)
                .status(status)
                .origin(origin)
                .recordedAt(recordedAt)
                .build());
        log.debug("Registro {} {} para participante {} en sesión {}", status, origin, participantId, sessionId);
        return toDomain(saved);
    }

    @Override
    @Transactional
    public AttendanceRecord transitionRecord(Long recordId, AttendanceStatus status, LocalDateTime recordedAt) {
        AttendanceRecordEntity entity = recordRepository.findById(recordId)
                .orElseThrow(() -> AttendanceException.notFound("Registro de asistencia", recordId));
        entity.setStatus(status);
        entity.setOrigin(AttendanceOrigin.MANUAL);
        entity.setRecordedAt(recordedAt);
        return toDomain(recordRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttendanceRecord> recordsOfSession(Long sessionId) {
        return recordRepository.findBySessionIdOrderByRecordedAtAsc(sessionId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttendanceRecord> recordsOfParticipant(Long participantId) {
        return recordRepository.findByParticipantId(participantId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    // ---- Conversión y utilidades ----

    private ParticipantEntity participantEntity(Long id) {
        return participantRepository.findById(id)
                .orElseThrow(() -> AttendanceException.notFound("Participante", id));
    }

    private ClassGroupEntity groupEntity(Long id) {
        if (id == null) {
            throw AttendanceException.notFound("Grupo", null);
        }
        return groupRepository.findById(id)
                .orElseThrow(() -> AttendanceException.notFound("Grupo", id));
    }

    private ClassSessionEntity sessionEntity(Long id) {
        return sessionRepository.findById(id)
                .orElseThrow(() -> AttendanceException.notFound("Sesión", id));
    }

    private void validateGroup(ClassGroup group) {
        requireText(group.getName(), "El nombre del grupo");
        if (group.getCategory() == null || group.getLevel() == null
                || group.getWeekday() == null || group.getStartTime() == null) {
            throw new IllegalArgumentException("El grupo requiere categoría, nivel, día y hora");
        }
    }

    private String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " no puede estar vacío");
        }
        return value.trim();
    }

    /**
     * Normaliza el token (sin espacios). Vacío equivale a nulo.
     */
    private String normalizeToken(String token) {
        if (token == null) {
            return null;
        }
        String trimmed = token.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Participant toDomain(ParticipantEntity entity) {
        return Participant.builder()
                .id(entity.getId())
                .token(entity.getToken())
                .displayName(entity.getDisplayName())
                .inactive(Boolean.TRUE.equals(entity.getInactive()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private ClassGroup toDomain(ClassGroupEntity entity) {
        return ClassGroup.builder()
                .id(entity.getId())
                .name(entity.getName())
                .category(entity.getCategory())
                .level(entity.getLevel())
                .weekday(entity.getWeekday())
                .startTime(entity.getStartTime())
                .build();
    }

    private ClassSession toDomain(ClassSessionEntity entity) {
        return ClassSession.builder()
                .id(entity.getId())
                .groupId(entity.getGroupId())
                .date(entity.getSessionDate())
                .startAt(entity.getStartAt())
                .endAt(entity.getEndAt())
                .status(entity.getStatus())
                .build();
    }

    private AttendanceRecord toDomain(AttendanceRecordEntity entity) {
        return AttendanceRecord.builder()
                .id(entity.getId())
                .sessionId(entity.getSessionId())
                .participantId(entity.getParticipantId())
                .status(entity.getStatus())
                .origin(entity.getOrigin())
                .recordedAt(entity.getRecordedAt())
                .build();
    }
}
