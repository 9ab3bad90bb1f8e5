package com.rfidattendance.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla participants.
 */
@Entity
@Table(name = "participants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", unique = true, length = 32)
    private String token;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "inactive", nullable = false)
    private Boolean inactive;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
