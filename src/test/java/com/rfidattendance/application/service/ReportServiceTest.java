package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.application.dto.DailyReportDto;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SummaryRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportService.
 */
class ReportServiceTest extends IntegrationTestBase {

    @Autowired
    private ReportService reportService;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    @Test
    @DisplayName("Should count attended sessions over the sessions of the participant's groups")
    void testParticipantSummaries() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        Participant idle = createParticipant("Y", null);
        enroll(participant, group);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(),
                TODAY.minusWeeks(1), AttendanceStatus.PRESENT);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY, AttendanceStatus.ABSENT);

        List<SummaryRow> rows = reportService.participantSummaries();

        SummaryRow x = rows.stream().filter(r -> r.getParticipantId().equals(participant.getId())).findFirst().orElseThrow();
        SummaryRow y = rows.stream().filter(r -> r.getParticipantId().equals(idle.getId())).findFirst().orElseThrow();
        assertEquals(1, x.getAttended());
        assertEquals(2, x.getTotalSessions());
        assertEquals(0.5, x.getAttendanceRate(), 1e-9);
        assertEquals(0, y.getTotalSessions());
        assertEquals(0.0, y.getAttendanceRate(), 1e-9);
    }

    @Test
    @DisplayName("Should list everyone as not recorded when no session was held")
    void testDailyReportWithoutSession() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        enroll(createParticipant("X", "0000000001"), group);

        DailyReportDto report = reportService.dailyReport(group.getId(), TODAY);

        assertFalse(report.isSessionHeld());
        assertEquals("Monday", report.getWeekday());
        assertEquals(1, report.getNoRecordCount());
        assertEquals(0, report.getPresentCount());
    }

    @Test
    @DisplayName("Should count present, absent and missing participants")
    void testDailyReport() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant present = createParticipant("P", "0000000001");
        Participant absent = createParticipant("Q", "0000000002");
        enroll(present, group);
        enroll(absent, group);
        enroll(createParticipant("R", "0000000003"), group);
        manualAttendanceService.setAttendance(present.getId(), group.getId(), TODAY, AttendanceStatus.PRESENT);
        manualAttendanceService.setAttendance(absent.getId(), group.getId(), TODAY, AttendanceStatus.ABSENT);

        DailyReportDto report = reportService.dailyReport(group.getId(), TODAY);

        assertTrue(report.isSessionHeld());
        assertEquals(3, report.getTotalEnrolled());
        assertEquals(1, report.getPresentCount());
        assertEquals(1, report.getAbsentCount());
        assertEquals(1, report.getNoRecordCount());
    }
}
