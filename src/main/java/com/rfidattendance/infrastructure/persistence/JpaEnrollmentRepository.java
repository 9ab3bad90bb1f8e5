package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.infrastructure.persistence.entity.EnrollmentEntity;
import com.rfidattendance.infrastructure.persistence.entity.EnrollmentId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repositorio JPA para operaciones con enrollments.
 */
@Repository
public interface JpaEnrollmentRepository extends JpaRepository<EnrollmentEntity, EnrollmentId> {

    boolean existsByParticipantId(Long participantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EnrollmentEntity e WHERE e.groupId = :groupId")
    int deleteAllOfGroup(@Param("groupId") Long groupId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EnrollmentEntity e WHERE e.participantId = :participantId")
    int deleteAllOfParticipant(@Param("participantId") Long participantId);
}
