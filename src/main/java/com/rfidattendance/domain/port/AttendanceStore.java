package com.rfidattendance.domain.port;

import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) del almacén de asistencia.
 * Cada operación que modifica datos es atómica: o se confirma completa o no
 * deja rastro. Todo lo que devuelve son instantáneas inmutables.
 */
public interface AttendanceStore {

    // ---- Participantes ----

    /**
     * Crea un participante.
     *
     * @param displayName Nombre visible, no vacío
     * @param token       Token de la tarjeta, puede ser nulo
     * @return Participante creado con su id
     */
    Participant createParticipant(String displayName, String token);

    Optional<Participant> findParticipant(Long participantId);

    Optional<Participant> findParticipantByToken(String token);

    /**
     * Igual que {@link #findParticipant(Long)} pero lanza NOT_FOUND si no existe.
     */
    Participant requireParticipant(Long participantId);

    List<Participant> listParticipants();

    Participant renameParticipant(Long participantId, String displayName);

    /**
     * Asigna un token nuevo. Falla con UNIQUENESS_VIOLATION si otro participante lo tiene.
     */
    Participant reassignToken(Long participantId, String token);

    /**
     * Asigna un token quitándoselo antes a quien lo tuviera.
     */
    Participant transferToken(Long participantId, String token);

    Participant clearToken(Long participantId);

    void setInactive(Long participantId, boolean inactive);

    /**
     * Borra el participante con sus registros de asistencia e inscripciones.
     */
    void deleteParticipant(Long participantId);

    // ---- Grupos ----

    ClassGroup createGroup(ClassGroup group);

    ClassGroup updateGroup(ClassGroup group);

    Optional<ClassGroup> findGroup(Long groupId);

    ClassGroup requireGroup(Long groupId);

    List<ClassGroup> listGroups();

    /**
     * Borra el grupo en cascada: registros de sus sesiones, sesiones,
     * inscripciones y finalmente el grupo.
     */
    void deleteGroup(Long groupId);

    // ---- Inscripciones ----

    /**
     * Inscribe al participante. Inscribirlo dos veces no tiene efecto.
     */
    void enroll(Long participantId, Long groupId);

    void unenroll(Long participantId, Long groupId);

    List<ClassGroup> groupsOf(Long participantId);

    /**
     * Grupos del participante que tienen clase el día indicado.
     */
    List<ClassGroup> groupsOn(Long participantId, DayOfWeek weekday);

    List<Participant> enrolledParticipants(Long groupId);

    boolean hasEnrollments(Long participantId);

    // ---- Sesiones ----

    Optional<ClassSession> findSession(Long groupId, LocalDate date);

    ClassSession requireSession(Long sessionId);

    /**
     * Inserta una sesión abierta para (grupo, fecha) si no existe y devuelve
     * la que quede almacenada, sea la nueva o la previa.
     */
    ClassSession insertSessionIfAbsent(Long groupId, LocalDate date, LocalDateTime startAt);

    ClassSession closeSession(Long sessionId, LocalDateTime endAt);

    /**
     * Sesiones de los grupos indicados, de la más reciente a la más antigua.
     */
    List<ClassSession> sessionsForGroups(Collection<Long> groupIds);

    List<ClassSession> openSessionsBefore(LocalDate date);

    List<ClassSession> sessionsOn(LocalDate date);

    // ---- Registros de asistencia ----

    Optional<AttendanceRecord> findRecord(Long sessionId, Long participantId);

    AttendanceRecord insertRecord(Long sessionId, Long participantId, AttendanceStatus status,
                                  AttendanceOrigin origin, LocalDateTime recordedAt);

    /**
     * Cambia el estado de un registro existente. El origen pasa a MANUAL.
     */
    AttendanceRecord transitionRecord(Long recordId, AttendanceStatus status, LocalDateTime recordedAt);

    List<AttendanceRecord> recordsOfSession(Long sessionId);

    List<AttendanceRecord> recordsOfParticipant(Long participantId);
}
