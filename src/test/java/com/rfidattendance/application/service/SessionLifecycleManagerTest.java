package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.exception.ErrorKind;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.LiveAttendanceEntry;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.SessionStatus;
import com.rfidattendance.domain.model.SessionSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SessionLifecycleManager.
 */
class SessionLifecycleManagerTest extends IntegrationTestBase {

    @Autowired
    private SessionLifecycleManager sessionManager;

    @Autowired
    private TapResolver tapResolver;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    @Test
    @DisplayName("Should keep exactly one session per group and date")
    void testResolveIsIdempotent() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);

        ClassSession first = sessionManager.resolveSession(group.getId(), TODAY);
        for (int i = 0; i < 4; i++) {
            assertEquals(first.getId(), sessionManager.resolveSession(group.getId(), TODAY).getId());
        }

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM class_sessions WHERE group_id = ?", Integer.class, group.getId());
        assertEquals(1, rows);
        assertEquals(SessionStatus.OPEN, first.getStatus());
        assertEquals(TODAY, first.getDate());
    }

    @Test
    @DisplayName("Should create sessions for any date, not only the group weekday")
    void testResolveOtherDate() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);

        ClassSession session = sessionManager.resolveSession(group.getId(), TODAY.plusDays(2));

        assertEquals(TODAY.plusDays(2), session.getDate());
    }

    @Test
    @DisplayName("Should fail with NOT_FOUND for an unknown group")
    void testResolveUnknownGroup() {
        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> sessionManager.resolveSession(987654L, TODAY));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    @DisplayName("Should mark missing active participants absent when closing")
    void testCloseSession() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant present = createParticipant("Present", "0000000001");
        Participant missing = createParticipant("Missing", "0000000002");
        Participant inactive = createParticipant("Inactive", "0000000003");
        enroll(present, group);
        enroll(missing, group);
        enroll(inactive, group);
        transactions.run("test", () -> store.setInactive(inactive.getId(), true));
        tapResolver.resolveTap("0000000001");
        ClassSession session = sessionManager.resolveSession(group.getId(), TODAY);

        SessionSummary summary = sessionManager.closeSession(session.getId());

        assertEquals("A", summary.getGroupName());
        assertEquals(3, summary.getTotalEnrolled());
        assertEquals(1, summary.getPresentCount());
        assertEquals(1, summary.getAbsentCount());
        assertEquals(List.of("Missing"), summary.getAbsentParticipants());

        AttendanceRecord absent = transactions.execute("test",
                () -> store.findRecord(session.getId(), missing.getId())).orElseThrow();
        assertEquals(AttendanceStatus.ABSENT, absent.getStatus());
        assertEquals(AttendanceOrigin.MANUAL, absent.getOrigin());
        assertTrue(transactions.execute("test", () -> store.findRecord(session.getId(), inactive.getId())).isEmpty());

        ClassSession closed = transactions.execute("test", () -> store.requireSession(session.getId()));
        assertEquals(SessionStatus.CLOSED, closed.getStatus());
        assertNotNull(closed.getEndAt());
    }

    @Test
    @DisplayName("Should count an inactive participant who attended as present")
    void testCloseSessionCountsInactiveAttendee() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant returning = createParticipant("Returning", "0000000001");
        Participant dormant = createParticipant("Dormant", "0000000002");
        enroll(returning, group);
        enroll(dormant, group);
        transactions.run("test", () -> {
            store.setInactive(returning.getId(), true);
            store.setInactive(dormant.getId(), true);
        });
        ClassSession session = sessionManager.resolveSession(group.getId(), TODAY);
        manualAttendanceService.markPresentManually(session.getId(), returning.getId());

        SessionSummary summary = sessionManager.closeSession(session.getId());

        assertEquals(2, summary.getTotalEnrolled());
        assertEquals(1, summary.getPresentCount());
        assertEquals(0, summary.getAbsentCount());
        assertTrue(summary.getAbsentParticipants().isEmpty());
    }

    @Test
    @DisplayName("Should not rewrite anything when closing twice")
    void testCloseTwice() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant missing = createParticipant("Missing", "0000000002");
        enroll(missing, group);
        ClassSession session = sessionManager.resolveSession(group.getId(), TODAY);

        sessionManager.closeSession(session.getId());
        SessionSummary again = sessionManager.closeSession(session.getId());

        assertEquals(1, again.getAbsentCount());
        assertEquals(1, transactions.execute("test", () -> store.recordsOfSession(session.getId())).size());
    }

    @Test
    @DisplayName("Should list every enrolled participant in the live view")
    void testLiveAttendance() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant tapped = createParticipant("Tapped", "0000000001");
        Participant waiting = createParticipant("Waiting", "0000000002");
        enroll(tapped, group);
        enroll(waiting, group);
        tapResolver.resolveTap("0000000001");
        ClassSession session = sessionManager.resolveSession(group.getId(), TODAY);

        List<LiveAttendanceEntry> entries = sessionManager.liveAttendance(session.getId());

        assertEquals(2, entries.size());
        LiveAttendanceEntry first = entries.stream()
                .filter(e -> e.getParticipantId().equals(tapped.getId())).findFirst().orElseThrow();
        LiveAttendanceEntry second = entries.stream()
                .filter(e -> e.getParticipantId().equals(waiting.getId())).findFirst().orElseThrow();
        assertTrue(first.isRecorded());
        assertEquals(AttendanceStatus.PRESENT, first.getStatus());
        assertFalse(second.isRecorded());
    }
}
