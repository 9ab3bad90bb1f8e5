package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.SummaryRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * DTO de una fila del informe de asistencia.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRowDto {

    private Long participantId;
    private String displayName;
    private String token;
    private boolean inactive;
    private int attended;
    private int totalSessions;
    private String rate;

    public static ReportRowDto fromDomain(SummaryRow row) {
        return ReportRowDto.builder()
                .participantId(row.getParticipantId())
                .displayName(row.getDisplayName())
                .token(row.getToken())
                .inactive(row.isInactive())
                .attended(row.getAttended())
                .totalSessions(row.getTotalSessions())
                .rate(String.format(Locale.ROOT, "%.0f%%", row.getAttendanceRate() * 100))
                .build();
    }
}
