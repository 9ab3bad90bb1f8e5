package com.rfidattendance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entidad JPA que mapea a la tabla enrollments.
 */
@Entity
@Table(name = "enrollments")
@IdClass(EnrollmentId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentEntity {

    @Id
    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Id
    @Column(name = "group_id", nullable = false)
    private Long groupId;
}
