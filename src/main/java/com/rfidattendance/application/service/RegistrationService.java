package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.ParticipantDto;

import java.util.List;
import java.util.Optional;

/**
 * Servicio para el alta y mantenimiento de participantes.
 * Atiende las llamadas de la interfaz tras un toque UNKNOWN_TOKEN o NO_ENROLLMENT.
 */
public interface RegistrationService {

    /**
     * Obtiene todos los participantes.
     *
     * @return Lista de DTOs de participantes
     */
    List<ParticipantDto> getAllParticipants();

    /**
     * Busca un participante por el token de su tarjeta.
     *
     * @param token Token de la tarjeta
     * @return Optional con el DTO si existe
     */
    Optional<ParticipantDto> findByToken(String token);

    ParticipantDto getParticipant(Long participantId);

    /**
     * Registra un participante nuevo, lo inscribe en los grupos indicados y lo
     * marca presente en los que tienen clase hoy.
     *
     * @param displayName Nombre visible
     * @param token       Token de la tarjeta, puede ser nulo
     * @param groupIds    Grupos a asignar
     * @return DTO del participante registrado
     */
    ParticipantDto register(String displayName, String token, List<Long> groupIds);

    /**
     * Inscribe a un participante existente y lo marca presente en los grupos de hoy.
     *
     * @param participantId Participante
     * @param groupIds      Grupos a asignar
     * @return DTO actualizado
     */
    ParticipantDto assignGroups(Long participantId, List<Long> groupIds);

    ParticipantDto unenroll(Long participantId, Long groupId);

    ParticipantDto rename(Long participantId, String displayName);

    /**
     * Cambia el token del participante.
     *
     * @param transfer si es true, se lo quita a quien lo tenga; si es false, falla
     *                 con UNIQUENESS_VIOLATION cuando ya está asignado
     */
    ParticipantDto changeToken(Long participantId, String token, boolean transfer);

    ParticipantDto clearToken(Long participantId);

    /**
     * Elimina el participante con sus registros e inscripciones.
     */
    void deleteParticipant(Long participantId);

    long getParticipantCount();
}
