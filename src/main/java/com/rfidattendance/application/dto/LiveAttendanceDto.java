package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.LiveAttendanceEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO de la vista en vivo de una sesión.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveAttendanceDto {

    private Long participantId;
    private String displayName;
    private String token;
    private String status;
    private String origin;
    private String statusClass;

    public static LiveAttendanceDto fromDomain(LiveAttendanceEntry entry) {
        String status = entry.isRecorded() ? entry.getStatus().name() : "NOT_RECORDED";
        String statusClass = !entry.isRecorded() ? "secondary"
                : switch (entry.getStatus()) {
                    case PRESENT -> "success";
                    case ABSENT -> "danger";
                };

        return LiveAttendanceDto.builder()
                .participantId(entry.getParticipantId())
                .displayName(entry.getDisplayName())
                .token(entry.getToken())
                .status(status)
                .origin(entry.getOrigin() != null ? entry.getOrigin().name() : null)
                .statusClass(statusClass)
                .build();
    }
}
