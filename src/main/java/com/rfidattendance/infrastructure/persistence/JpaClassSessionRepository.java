package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.domain.model.SessionStatus;
import com.rfidattendance.infrastructure.persistence.entity.ClassSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con class_sessions.
 */
@Repository
public interface JpaClassSessionRepository extends JpaRepository<ClassSessionEntity, Long> {

    Optional<ClassSessionEntity> findByGroupIdAndSessionDate(Long groupId, LocalDate sessionDate);

    /**
     * Inserta la sesión sólo si no existe otra para (grupo, fecha).
     * La restricción UNIQUE decide: quien pierde no inserta nada y relee la fila existente.
     *
     * @return 1 si se insertó, 0 si ya existía
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "INSERT INTO class_sessions (group_id, session_date, start_at, status) "
            + "VALUES (:groupId, :sessionDate, :startAt, 'OPEN') "
            + "ON CONFLICT (group_id, session_date) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("groupId") Long groupId,
                       @Param("sessionDate") String sessionDate,
                       @Param("startAt") String startAt);

    /**
     * Sesiones de varios grupos, de la más reciente a la más antigua.
     */
    @Query("SELECT s FROM ClassSessionEntity s WHERE s.groupId IN :groupIds "
            + "ORDER BY s.sessionDate DESC, s.id DESC")
    List<ClassSessionEntity> findByGroupsNewestFirst(@Param("groupIds") Collection<Long> groupIds);

    List<ClassSessionEntity> findByStatusAndSessionDateBeforeOrderBySessionDateAsc(SessionStatus status,
                                                                                   LocalDate date);

    List<ClassSessionEntity> findBySessionDateOrderByStartAtAsc(LocalDate date);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ClassSessionEntity s WHERE s.groupId = :groupId")
    int deleteAllOfGroup(@Param("groupId") Long groupId);
}
