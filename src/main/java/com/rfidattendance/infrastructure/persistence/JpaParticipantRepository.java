package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.infrastructure.persistence.entity.ParticipantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con participants.
 */
@Repository
public interface JpaParticipantRepository extends JpaRepository<ParticipantEntity, Long> {

    /**
     * Busca un participante por el token de su tarjeta.
     *
     * @param token Token normalizado
     * @return Optional con el participante si existe
     */
    Optional<ParticipantEntity> findByToken(String token);

    boolean existsByTokenAndIdNot(String token, Long id);

    List<ParticipantEntity> findAllByOrderByDisplayNameAsc();

    @Query("SELECT p FROM ParticipantEntity p WHERE p.id IN "
            + "(SELECT e.participantId FROM EnrollmentEntity e WHERE e.groupId = :groupId) "
            + "ORDER BY p.displayName")
    List<ParticipantEntity> findEnrolledIn(@Param("groupId") Long groupId);

    /**
     * Quita el token a cualquier otro participante que lo tenga.
     * Se ejecuta antes de asignarlo para no violar UNIQUE(token) en ningún momento.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipantEntity p SET p.token = NULL WHERE p.token = :token AND p.id <> :id")
    int clearTokenFromOthers(@Param("token") String token, @Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipantEntity p SET p.token = :token WHERE p.id = :id")
    int updateToken(@Param("id") Long id, @Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ParticipantEntity p SET p.inactive = :inactive WHERE p.id = :id")
    int updateInactive(@Param("id") Long id, @Param("inactive") Boolean inactive);
}
