package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.AttendanceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;

/**
 * DTO de un registro de asistencia.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecordDto {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");

    private Long id;
    private Long sessionId;
    private Long participantId;
    private String status;
    private String origin;
    private String recordedAt;

    public static AttendanceRecordDto fromDomain(AttendanceRecord record) {
        return AttendanceRecordDto.builder()
                .id(record.getId())
                .sessionId(record.getSessionId())
                .participantId(record.getParticipantId())
                .status(record.getStatus().name())
                .origin(record.getOrigin().name())
                .recordedAt(record.getRecordedAt().format(TIMESTAMP_FORMAT))
                .build();
    }
}
