package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.application.dto.ParticipantDto;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.exception.ErrorKind;
import com.rfidattendance.domain.model.AttendanceOrigin;
import com.rfidattendance.domain.model.AttendanceRecord;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.TapOutcomeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.DayOfWeek;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RegistrationService.
 */
class RegistrationServiceTest extends IntegrationTestBase {

    @Autowired
    private RegistrationService registrationService;

    @Autowired
    private TapResolver tapResolver;

    @Test
    @DisplayName("Should register, enroll and mark present for today's groups")
    void testRegisterMarksToday() {
        ClassGroup monday = createGroup("Monday", DayOfWeek.MONDAY);
        ClassGroup friday = createGroup("Friday", DayOfWeek.FRIDAY);

        ParticipantDto registered = registrationService.register("New", "0000000009",
                List.of(monday.getId(), friday.getId()));

        assertEquals("New", registered.getDisplayName());
        assertEquals(2, registered.getGroups().size());
        ClassSession session = transactions.execute("test", () -> store.findSession(monday.getId(), TODAY)).orElseThrow();
        AttendanceRecord record = transactions.execute("test",
                () -> store.findRecord(session.getId(), registered.getId())).orElseThrow();
        assertEquals(AttendanceOrigin.AUTOMATIC, record.getOrigin());
        assertTrue(transactions.execute("test", () -> store.findSession(friday.getId(), TODAY)).isEmpty());

        assertEquals(TapOutcomeType.DUPLICATE, tapResolver.resolveTap("0000000009").type());
    }

    @Test
    @DisplayName("Should reject malformed tokens at registration")
    void testRegisterInvalidToken() {
        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> registrationService.register("New", "12AB", List.of()));
        assertEquals(ErrorKind.INVALID_TOKEN, ex.getKind());
        assertEquals(0, registrationService.getParticipantCount());
    }

    @Test
    @DisplayName("Should roll back the participant when a group does not exist")
    void testRegisterRollsBack() {
        assertThrows(AttendanceException.class,
                () -> registrationService.register("New", "0000000009", List.of(31337L)));
        assertTrue(registrationService.findByToken("0000000009").isEmpty());
    }

    @Test
    @DisplayName("Should assign groups to a participant who had none")
    void testAssignGroups() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        ParticipantDto registered = registrationService.register("New", "0000000009", List.of());
        assertEquals(TapOutcomeType.NO_ENROLLMENT, tapResolver.resolveTap("0000000009").type());

        ParticipantDto updated = registrationService.assignGroups(registered.getId(), List.of(group.getId()));

        assertEquals(List.of("A"), updated.getGroups());
        assertEquals(TapOutcomeType.DUPLICATE, tapResolver.resolveTap("0000000009").type());
    }

    @Test
    @DisplayName("Should change the token with or without transfer")
    void testChangeToken() {
        ParticipantDto first = registrationService.register("First", "0000000001", List.of());
        ParticipantDto second = registrationService.register("Second", "0000000002", List.of());

        AttendanceException ex = assertThrows(AttendanceException.class,
                () -> registrationService.changeToken(second.getId(), "0000000001", false));
        assertEquals(ErrorKind.UNIQUENESS_VIOLATION, ex.getKind());

        ParticipantDto moved = registrationService.changeToken(second.getId(), "0000000001", true);
        assertEquals("0000000001", moved.getToken());
        assertNull(registrationService.getParticipant(first.getId()).getToken());
    }
}
