package com.rfidattendance.infrastructure.persistence.entity;

import com.rfidattendance.domain.model.SessionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla class_sessions.
 */
@Entity
@Table(name = "class_sessions",
        uniqueConstraints = @UniqueConstraint(columnNames = { "group_id", "session_date" }))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "group_id", nullable = false)
    private Long groupId;

    @Column(name = "session_date", nullable = false, length = 10)
    private LocalDate sessionDate;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at")
    private LocalDateTime endAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private SessionStatus status;
}
