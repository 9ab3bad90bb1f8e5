package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.SessionSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO del resumen de cierre de sesión.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {

    private Long sessionId;
    private String groupName;
    private String date;
    private int totalEnrolled;
    private int presentCount;
    private int absentCount;
    private List<String> absentParticipants;

    public static SessionSummaryDto fromDomain(SessionSummary summary) {
        return SessionSummaryDto.builder()
                .sessionId(summary.getSessionId())
                .groupName(summary.getGroupName())
                .date(summary.getDate().toString())
                .totalEnrolled(summary.getTotalEnrolled())
                .presentCount(summary.getPresentCount())
                .absentCount(summary.getAbsentCount())
                .absentParticipants(summary.getAbsentParticipants())
                .build();
    }
}
