package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.TapOutcome;
import com.rfidattendance.domain.model.TapOutcomeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TapResolver.
 */
class TapResolverTest extends IntegrationTestBase {

    private static final String TOKEN = "0001234567";

    @Autowired
    private TapResolver tapResolver;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    @Test
    @DisplayName("Should record the first tap and report the second as duplicate")
    void testRecordedThenDuplicate() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);

        TapOutcome first = tapResolver.resolveTap(TOKEN);
        assertEquals(TapOutcomeType.RECORDED, first.type());
        TapOutcome.Recorded recorded = (TapOutcome.Recorded) first;
        assertEquals(List.of("A"), recorded.recordedGroups());
        assertTrue(recorded.alreadySatisfiedGroups().isEmpty());

        TapOutcome second = tapResolver.resolveTap(TOKEN);
        assertEquals(TapOutcomeType.DUPLICATE, second.type());
        assertEquals(List.of("A"), ((TapOutcome.Duplicate) second).satisfiedGroups());

        ClassSession session = transactions.execute("test", () -> store.findSession(group.getId(), TODAY)).orElseThrow();
        AttendanceRecord record = transactions.execute("test",
                () -> store.findRecord(session.getId(), participant.getId())).orElseThrow();
        assertEquals(AttendanceStatus.PRESENT, record.getStatus());
        assertEquals(AttendanceOrigin.AUTOMATIC, record.getOrigin());
    }

    @Test
    @DisplayName("Should not override a manual absence with a later tap")
    void testManualAbsencePreemptsTap() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);

        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY, AttendanceStatus.ABSENT);
        TapOutcome outcome = tapResolver.resolveTap(TOKEN);

        assertEquals(TapOutcomeType.DUPLICATE, outcome.type());
        assertEquals(List.of("A"), ((TapOutcome.Duplicate) outcome).satisfiedGroups());

        ClassSession session = transactions.execute("test", () -> store.findSession(group.getId(), TODAY)).orElseThrow();
        AttendanceRecord record = transactions.execute("test",
                () -> store.findRecord(session.getId(), participant.getId())).orElseThrow();
        assertEquals(AttendanceStatus.ABSENT, record.getStatus());
        assertEquals(AttendanceOrigin.MANUAL, record.getOrigin());
    }

    @Test
    @DisplayName("Should report unknown tokens without writing anything")
    void testUnknownToken() {
        TapOutcome outcome = tapResolver.resolveTap("9999999999");

        assertEquals(TapOutcomeType.UNKNOWN_TOKEN, outcome.type());
        assertEquals("9999999999", outcome.token());
        assertTrue(transactions.execute("test", () -> store.sessionsOn(TODAY)).isEmpty());
    }

    @Test
    @DisplayName("Should report participants without groups")
    void testNoEnrollment() {
        Participant participant = createParticipant("X", TOKEN);

        TapOutcome outcome = tapResolver.resolveTap(TOKEN);

        assertEquals(TapOutcomeType.NO_ENROLLMENT, outcome.type());
        assertEquals(participant.getId(), ((TapOutcome.NoEnrollment) outcome).participant().getId());
    }

    @Test
    @DisplayName("Should reject malformed tokens before touching the store")
    void testInvalidTokens() {
        assertEquals(TapOutcomeType.INVALID_TOKEN, tapResolver.resolveTap("").type());
        assertEquals(TapOutcomeType.INVALID_TOKEN, tapResolver.resolveTap(null).type());
        assertEquals(TapOutcomeType.INVALID_TOKEN, tapResolver.resolveTap("12345").type());
        assertEquals(TapOutcomeType.INVALID_TOKEN, tapResolver.resolveTap("12345ABCDE").type());
        assertEquals(TapOutcomeType.INVALID_TOKEN, tapResolver.resolveTap("00012345678").type());
    }

    @Test
    @DisplayName("Should trim surrounding whitespace from the token")
    void testTokenIsTrimmed() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);

        assertEquals(TapOutcomeType.RECORDED, tapResolver.resolveTap("  " + TOKEN + "\r\n").type());
    }

    @Test
    @DisplayName("Should validate token structure")
    void testValidateToken() {
        assertEquals(Optional.empty(), tapResolver.validateToken(TOKEN));
        assertTrue(tapResolver.validateToken("123").isPresent());
        assertTrue(tapResolver.validateToken("12345 6789").isPresent());
        assertTrue(tapResolver.validateToken("").isPresent());
    }

    @Test
    @DisplayName("Should record nothing when no group meets today")
    void testNoGroupToday() {
        ClassGroup group = createGroup("Tuesday group", DayOfWeek.TUESDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);

        TapOutcome outcome = tapResolver.resolveTap(TOKEN);

        assertEquals(TapOutcomeType.RECORDED, outcome.type());
        assertTrue(((TapOutcome.Recorded) outcome).nothingScheduledToday());
        assertTrue(transactions.execute("test", () -> store.findSession(group.getId(), TODAY)).isEmpty());
    }

    @Test
    @DisplayName("Should record only the groups not yet satisfied today")
    void testPartiallySatisfied() {
        ClassGroup a = createGroup("A", DayOfWeek.MONDAY);
        ClassGroup b = createGroup("B", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, a);
        enroll(participant, b);
        manualAttendanceService.setAttendance(participant.getId(), a.getId(), TODAY, AttendanceStatus.PRESENT);

        TapOutcome outcome = tapResolver.resolveTap(TOKEN);

        assertEquals(TapOutcomeType.RECORDED, outcome.type());
        TapOutcome.Recorded recorded = (TapOutcome.Recorded) outcome;
        assertEquals(List.of("B"), recorded.recordedGroups());
        assertEquals(List.of("A"), recorded.alreadySatisfiedGroups());
    }

    @Test
    @DisplayName("Should warn about an inactive participant and reactivate them")
    void testTapReactivatesInactiveParticipant() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);
        transactions.run("test", () -> store.setInactive(participant.getId(), true));

        TapOutcome outcome = tapResolver.resolveTap(TOKEN);

        assertEquals(TapOutcomeType.RECORDED, outcome.type());
        assertTrue(((TapOutcome.Recorded) outcome).inactiveWarning());
        assertFalse(reload(participant).isInactive());
    }

    @Test
    @DisplayName("Should match today's weekday whatever the default locale")
    void testWeekdayIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("es", "ES"));
        try {
            ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
            Participant participant = createParticipant("X", TOKEN);
            enroll(participant, group);

            TapOutcome outcome = tapResolver.resolveTap(TOKEN);

            assertEquals(TapOutcomeType.RECORDED, outcome.type());
            assertEquals(List.of("A"), ((TapOutcome.Recorded) outcome).recordedGroups());
            assertEquals("Monday", jdbcTemplate.queryForObject(
                    "SELECT weekday FROM class_groups WHERE id = ?", String.class, group.getId()));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Should report attended and total sessions with each tap")
    void testTapCarriesAttendanceTally() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", TOKEN);
        enroll(participant, group);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY.minusWeeks(2),
                AttendanceStatus.PRESENT);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY.minusWeeks(1),
                AttendanceStatus.ABSENT);

        TapOutcome.Recorded recorded = (TapOutcome.Recorded) tapResolver.resolveTap(TOKEN);
        assertEquals(2, recorded.attendedSessions());
        assertEquals(3, recorded.totalSessions());

        TapOutcome.Duplicate duplicate = (TapOutcome.Duplicate) tapResolver.resolveTap(TOKEN);
        assertEquals(2, duplicate.attendedSessions());
        assertEquals(3, duplicate.totalSessions());
    }
}
