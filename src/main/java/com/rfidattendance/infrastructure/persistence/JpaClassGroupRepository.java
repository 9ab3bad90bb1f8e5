package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.infrastructure.persistence.entity.ClassGroupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Repositorio JPA para operaciones con class_groups.
 */
@Repository
public interface JpaClassGroupRepository extends JpaRepository<ClassGroupEntity, Long> {

    List<ClassGroupEntity> findAllByOrderByNameAsc();

    /**
     * Grupos en los que está inscrito un participante.
     */
    @Query("SELECT g FROM ClassGroupEntity g WHERE g.id IN "
            + "(SELECT e.groupId FROM EnrollmentEntity e WHERE e.participantId = :participantId) "
            + "ORDER BY g.startTime, g.name")
    List<ClassGroupEntity> findByParticipant(@Param("participantId") Long participantId);

    /**
     * Grupos del participante que tienen clase el día indicado.
     */
    @Query("SELECT g FROM ClassGroupEntity g WHERE g.weekday = :weekday AND g.id IN "
            + "(SELECT e.groupId FROM EnrollmentEntity e WHERE e.participantId = :participantId) "
            + "ORDER BY g.startTime, g.name")
    List<ClassGroupEntity> findByParticipantAndWeekday(@Param("participantId") Long participantId,
                                                       @Param("weekday") DayOfWeek weekday);
}
