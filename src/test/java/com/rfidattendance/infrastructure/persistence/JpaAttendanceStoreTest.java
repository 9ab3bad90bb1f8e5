package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.application.service.ManualAttendanceService;
import com.rfidattendance.application.service.SessionLifecycleManager;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.exception.ErrorKind;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JpaAttendanceStore against the SQLite schema.
 */
class JpaAttendanceStoreTest extends IntegrationTestBase {

    @Autowired
    private SessionLifecycleManager sessionManager;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    private int count(String table) {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows == null ? 0 : rows;
    }

    @Test
    @DisplayName("Should delete a group with its enrollments, sessions and records")
    void testDeleteGroupCascades() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        ClassGroup other = createGroup("B", DayOfWeek.TUESDAY);
        List<Participant> members = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Participant p = createParticipant("P" + i, "000000000" + i);
            enroll(p, group);
            enroll(p, other);
            members.add(p);
        }
        List<Long> sessionIds = new ArrayList<>();
        for (int weeks = 0; weeks < 2; weeks++) {
            ClassSession session = sessionManager.resolveSession(group.getId(), TODAY.minusWeeks(weeks));
            sessionIds.add(session.getId());
            manualAttendanceService.setAttendance(members.get(0).getId(), group.getId(),
                    TODAY.minusWeeks(weeks), AttendanceStatus.PRESENT);
        }
        sessionManager.resolveSession(other.getId(), TODAY.plusDays(1));

        transactions.run("test", () -> store.deleteGroup(group.getId()));

        for (Long sessionId : sessionIds) {
            AttendanceException ex = assertThrows(AttendanceException.class,
                    () -> transactions.execute("test", () -> store.requireSession(sessionId)));
            assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
        }
        assertEquals(0, count("attendance_records"));
        assertEquals(1, count("class_sessions"));
        assertEquals(3, count("enrollments"));
        assertTrue(transactions.execute("test", () -> store.findGroup(group.getId())).isEmpty());
        assertEquals(3, count("participants"));
    }

    @Test
    @DisplayName("Should delete a participant with enrollments and records")
    void testDeleteParticipantCascades() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        enroll(participant, group);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY, AttendanceStatus.PRESENT);

        transactions.run("test", () -> store.deleteParticipant(participant.getId()));

        assertEquals(0, count("participants"));
        assertEquals(0, count("enrollments"));
        assertEquals(0, count("attendance_records"));
        assertEquals(1, count("class_sessions"));
    }

    @Test
    @DisplayName("Should refuse a token held by someone else unless transferred")
    void testTokenReassignAndTransfer() {
        Participant holder = createParticipant("Holder", "0000000001");
        Participant other = createParticipant("Other", "0000000002");

        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> transactions.execute("test", () -> store.reassignToken(other.getId(), "0000000001")));
        assertEquals(ErrorKind.UNIQUENESS_VIOLATION, ex.getKind());

        Participant updated = transactions.execute("test", () -> store.transferToken(other.getId(), "0000000001"));

        assertEquals("0000000001", updated.getToken());
        assertNull(reload(holder).getToken());
        assertEquals(other.getId(),
                transactions.execute("test", () -> store.findParticipantByToken("0000000001")).orElseThrow().getId());
    }

    @Test
    @DisplayName("Should reject a duplicate token on creation")
    void testDuplicateTokenOnCreate() {
        createParticipant("First", "0000000001");

        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> createParticipant("Second", "0000000001"));
        assertEquals(ErrorKind.UNIQUENESS_VIOLATION, ex.getKind());
    }

    @Test
    @DisplayName("Should allow several participants without a token")
    void testParticipantsWithoutToken() {
        createParticipant("First", null);
        createParticipant("Second", "  ");

        assertEquals(2, count("participants"));
        assertEquals(2, count("participants WHERE token IS NULL"));
    }

    @Test
    @DisplayName("Should keep enrollment idempotent and fail for unknown groups")
    void testEnroll() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");

        enroll(participant, group);
        enroll(participant, group);

        assertEquals(1, count("enrollments"));
        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> transactions.run("test", () -> store.enroll(participant.getId(), 424242L)));
        assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    @DisplayName("Should reject groups with a blank name")
    void testInvalidGroup() {
        assertThrows(IllegalArgumentException.class, () -> createGroup(" ", DayOfWeek.MONDAY));
    }

    @Test
    @DisplayName("Should store weekday and start time as readable text")
    void testTextColumns() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        sessionManager.resolveSession(group.getId(), TODAY);

        assertEquals("Monday", jdbcTemplate.queryForObject(
                "SELECT weekday FROM class_groups WHERE id = ?", String.class, group.getId()));
        assertEquals("18:00", jdbcTemplate.queryForObject(
                "SELECT start_time FROM class_groups WHERE id = ?", String.class, group.getId()));
        assertEquals("2026-10-19", jdbcTemplate.queryForObject(
                "SELECT session_date FROM class_sessions WHERE group_id = ?", String.class, group.getId()));
    }
}
