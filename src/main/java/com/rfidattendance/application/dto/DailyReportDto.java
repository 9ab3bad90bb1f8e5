package com.rfidattendance.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Informe de un grupo en una fecha concreta.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyReportDto {

    private String groupName;
    private String date;
    private String weekday;
    private boolean sessionHeld;
    private int totalEnrolled;
    private int presentCount;
    private int absentCount;
    private int noRecordCount;
    private List<LiveAttendanceDto> participants;
}
