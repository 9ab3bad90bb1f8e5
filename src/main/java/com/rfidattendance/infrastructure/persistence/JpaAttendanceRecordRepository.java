package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.infrastructure.persistence.entity.AttendanceRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con attendance_records.
 */
@Repository
public interface JpaAttendanceRecordRepository extends JpaRepository<AttendanceRecordEntity, Long> {

    Optional<AttendanceRecordEntity> findBySessionIdAndParticipantId(Long sessionId, Long participantId);

    List<AttendanceRecordEntity> findBySessionIdOrderByRecordedAtAsc(Long sessionId);

    List<AttendanceRecordEntity> findByParticipantId(Long participantId);

    /**
     * Borra los registros de todas las sesiones de un grupo.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AttendanceRecordEntity r WHERE r.sessionId IN "
            + "(SELECT s.id FROM ClassSessionEntity s WHERE s.groupId = :groupId)")
    int deleteAllOfGroup(@Param("groupId") Long groupId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AttendanceRecordEntity r WHERE r.participantId = :participantId")
    int deleteAllOfParticipant(@Param("participantId") Long participantId);
}
