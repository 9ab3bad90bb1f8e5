package com.rfidattendance;

import com.rfidattendance.application.service.Authenticator;
import com.rfidattendance.application.service.SettingsService;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.GroupCategory;
import com.rfidattendance.domain.model.GroupLevel;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;

/**
 * Shared setup for tests running against the SQLite store:
 * empty tables, default settings, fixed clock.
 */
@SpringBootTest(classes = { RfidAttendanceApplication.class, FixedClockConfig.class })
public abstract class IntegrationTestBase {

    protected static final LocalDate TODAY = LocalDate.ofInstant(FixedClockConfig.NOW, ZoneOffset.UTC);

    @Autowired
    protected AttendanceStore store;

    @Autowired
    protected StoreTransactions transactions;

    @Autowired
    protected SettingsService settingsService;

    @Autowired
    protected Authenticator authenticator;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetDatabase() {
        // Foreign-key order
        jdbcTemplate.update("DELETE FROM attendance_records");
        jdbcTemplate.update("DELETE FROM class_sessions");
        jdbcTemplate.update("DELETE FROM enrollments");
        jdbcTemplate.update("DELETE FROM class_groups");
        jdbcTemplate.update("DELETE FROM participants");
        jdbcTemplate.update("UPDATE settings SET setting_value = '' WHERE setting_key = 'admin_credential'");
        jdbcTemplate.update("UPDATE settings SET setting_value = '3' WHERE setting_key = 'inactivity_threshold'");
        jdbcTemplate.update("UPDATE settings SET setting_value = 'en' WHERE setting_key = 'language'");
        jdbcTemplate.update("UPDATE settings SET setting_value = '1' WHERE setting_key = 'roster_import_min_sessions'");
        settingsService.reload();
        authenticator.restartFlow();
    }

    protected ClassGroup createGroup(String name, DayOfWeek weekday) {
        return transactions.execute("test", () -> store.createGroup(ClassGroup.builder()
                .name(name)
                .category(GroupCategory.NORMAL)
                .level(GroupLevel.BEGINNER)
                .weekday(weekday)
                .startTime(LocalTime.of(18, 0))
                .build()));
    }

    protected Participant createParticipant(String name, String token) {
        return transactions.execute("test", () -> store.createParticipant(name, token));
    }

    protected void enroll(Participant participant, ClassGroup group) {
        transactions.run("test", () -> store.enroll(participant.getId(), group.getId()));
    }

    protected Participant reload(Participant participant) {
        return transactions.execute("test", () -> store.requireParticipant(participant.getId()));
    }
}
