package com.rfidattendance.infrastructure.persistence.entity;

import com.rfidattendance.domain.model.GroupCategory;
import com.rfidattendance.domain.model.GroupLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Entidad JPA que mapea a la tabla class_groups.
 */
@Entity
@Table(name = "class_groups")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassGroupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private GroupCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 20)
    private GroupLevel level;

    @Column(name = "weekday", nullable = false, length = 10)
    private DayOfWeek weekday;

    @Column(name = "start_time", nullable = false, length = 5)
    private LocalTime startTime;
}
