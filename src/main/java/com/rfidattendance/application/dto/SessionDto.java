package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.ClassSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO de una sesión.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private Long id;
    private Long groupId;
    private String date;
    private String startTime;
    private String endTime;
    private String status;

    public static SessionDto fromDomain(ClassSession session) {
        return SessionDto.builder()
                .id(session.getId())
                .groupId(session.getGroupId())
                .date(session.getDate().toString())
                .startTime(session.getStartAt() != null ? session.getStartAt().format(TIME_FORMAT) : null)
                .endTime(session.getEndAt() != null ? session.getEndAt().format(TIME_FORMAT) : null)
                .status(session.getStatus().name())
                .build();
    }
}
