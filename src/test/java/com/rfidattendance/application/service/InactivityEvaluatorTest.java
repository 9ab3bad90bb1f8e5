package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.InactivityChange;
import com.rfidattendance.domain.model.Participant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InactivityEvaluator.
 */
class InactivityEvaluatorTest extends IntegrationTestBase {

    @Autowired
    private InactivityEvaluator inactivityEvaluator;

    @Autowired
    private SessionLifecycleManager sessionManager;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    @Test
    @DisplayName("Should never mark participants without enrollments inactive")
    void testZeroEnrollmentsNeverInactive() {
        Participant loner = createParticipant("Loner", "0000000001");

        InactivityChange change = inactivityEvaluator.recomputeAll(0);

        assertEquals(InactivityChange.NONE, change);
        assertFalse(reload(loner).isInactive());
        assertEquals(0, inactivityEvaluator.trailingAbsences(loner.getId()));
    }

    @Test
    @DisplayName("Should count absences from the most recent session backwards")
    void testTrailingAbsences() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        enroll(participant, group);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(),
                TODAY.minusWeeks(3), AttendanceStatus.PRESENT);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(),
                TODAY.minusWeeks(2), AttendanceStatus.ABSENT);
        sessionManager.resolveSession(group.getId(), TODAY.minusWeeks(1));

        assertEquals(2, inactivityEvaluator.trailingAbsences(participant.getId()));
    }

    @Test
    @DisplayName("Should mark inactive at the threshold and reactivate after attending")
    void testMarkAndReactivate() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        Participant regular = createParticipant("Regular", "0000000002");
        enroll(participant, group);
        enroll(regular, group);
        for (int weeks = 3; weeks >= 1; weeks--) {
            sessionManager.resolveSession(group.getId(), TODAY.minusWeeks(weeks));
            manualAttendanceService.setAttendance(regular.getId(), group.getId(),
                    TODAY.minusWeeks(weeks), AttendanceStatus.PRESENT);
        }

        InactivityChange change = inactivityEvaluator.recomputeAll(3);

        assertEquals(new InactivityChange(1, 0), change);
        assertTrue(reload(participant).isInactive());
        assertFalse(reload(regular).isInactive());

        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY, AttendanceStatus.PRESENT);
        assertEquals(new InactivityChange(0, 1), inactivityEvaluator.recomputeAll(3));
        assertFalse(reload(participant).isInactive());
    }

    @Test
    @DisplayName("Should stay active below the threshold")
    void testBelowThreshold() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        enroll(participant, group);
        sessionManager.resolveSession(group.getId(), TODAY.minusWeeks(2));
        sessionManager.resolveSession(group.getId(), TODAY.minusWeeks(1));

        inactivityEvaluator.recomputeAll(3);

        assertFalse(reload(participant).isInactive());
    }

    @Test
    @DisplayName("Should mark every enrolled participant inactive with threshold zero")
    void testThresholdZero() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        enroll(participant, group);

        inactivityEvaluator.recomputeFor(participant.getId(), 0);

        assertTrue(reload(participant).isInactive());
    }

    @Test
    @DisplayName("Should reject a negative threshold")
    void testNegativeThreshold() {
        assertThrows(IllegalArgumentException.class, () -> inactivityEvaluator.recomputeAll(-1));
    }
}
