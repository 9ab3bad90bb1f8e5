package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.application.config.AttendanceProperties;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.model.SummaryRow;
import com.rfidattendance.domain.port.SpreadsheetPort;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SummaryPushService.
 */
class SummaryPushServiceTest extends IntegrationTestBase {

    @Autowired
    private SummaryPushService summaryPushService;

    @Autowired
    private ReportService reportService;

    @Autowired
    private ManualAttendanceService manualAttendanceService;

    private SummaryPushService serviceWith(Function<List<SummaryRow>, PushResult> push, long timeoutSeconds) {
        AttendanceProperties properties = new AttendanceProperties();
        properties.setPushTimeoutSeconds(timeoutSeconds);
        SpreadsheetPort port = new SpreadsheetPort() {
            @Override
            public PushResult pushSummary(List<SummaryRow> rows) {
                return push.apply(rows);
            }

            @Override
            public ImportPreview importRoster(List<RosterRow> rows, int minSessions) {
                throw new UnsupportedOperationException();
            }
        };
        return new SummaryPushService(reportService, port, properties);
    }

    @Test
    @DisplayName("Should export one row per participant")
    void testPushSummary() {
        ClassGroup group = createGroup("A", DayOfWeek.MONDAY);
        Participant participant = createParticipant("X", "0000000001");
        createParticipant("Y", "0000000002");
        enroll(participant, group);
        manualAttendanceService.setAttendance(participant.getId(), group.getId(), TODAY, AttendanceStatus.PRESENT);

        PushResult result = summaryPushService.pushSummary();

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(2, result.getRowsWritten());
        assertTrue(Files.exists(Path.of(result.getDestination())));
    }

    @Test
    @DisplayName("Should report a failed push instead of throwing")
    void testPushFailure() {
        SummaryPushService service = serviceWith(rows -> {
            throw new IllegalStateException("sheet offline");
        }, 5);
        try {
            PushResult result = service.pushSummary();

            assertFalse(result.isSuccess());
            assertTrue(result.getMessage().contains("sheet offline"));
        } finally {
            service.shutdown();
        }
    }

    @Test
    @DisplayName("Should give up when the push exceeds the timeout")
    void testPushTimeout() {
        SummaryPushService service = serviceWith(rows -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return PushResult.ok(rows.size(), "late");
        }, 1);
        try {
            long start = System.nanoTime();
            PushResult result = service.pushSummary();

            assertFalse(result.isSuccess());
            assertTrue(System.nanoTime() - start < 4_000_000_000L);
        } finally {
            service.shutdown();
        }
    }

    @Test
    @DisplayName("Should push again after a timed-out push that ignores interruption")
    void testPushRecoversAfterTimeout() {
        AtomicBoolean slow = new AtomicBoolean(true);
        SummaryPushService service = serviceWith(rows -> {
            if (slow.get()) {
                long deadline = System.nanoTime() + 6_000_000_000L;
                while (System.nanoTime() < deadline) {
                    try {
                        Thread.sleep(100);
                    } catch (InterruptedException e) {
                        // sigue bloqueado, como un destino que no responde
                    }
                }
            }
            return PushResult.ok(rows.size(), "sheet");
        }, 1);
        try {
            PushResult first = service.pushSummary();
            assertFalse(first.isSuccess());

            slow.set(false);
            long start = System.nanoTime();
            PushResult second = service.pushSummary();

            assertTrue(second.isSuccess(), second.getMessage());
            assertTrue(System.nanoTime() - start < 1_000_000_000L);
        } finally {
            service.shutdown();
        }
    }
}
