package com.rfidattendance.infrastructure.file;

import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.model.SummaryRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvSpreadsheetAdapter.
 */
class CsvSpreadsheetAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T21:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path exportDir;

    private CsvSpreadsheetAdapter adapter() {
        return new CsvSpreadsheetAdapter(exportDir.toString(), CLOCK);
    }

    @Test
    @DisplayName("Should write the summary as a timestamped CSV file")
    void testPushSummary() throws IOException {
        List<SummaryRow> rows = List.of(
                SummaryRow.builder().participantId(1L).displayName("Ana").token("0000000001")
                        .attended(3).totalSessions(4).inactive(false).build(),
                SummaryRow.builder().participantId(2L).displayName("Bruno, Jr").token(null)
                        .attended(0).totalSessions(4).inactive(true).build());

        PushResult result = adapter().pushSummary(rows);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getRowsWritten());
        Path written = exportDir.resolve("attendance_summary_2026-10-19_211530.csv");
        assertEquals(written.toString(), result.getDestination());
        List<String> lines = Files.readAllLines(written, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).contains("participant_id"));
        assertTrue(lines.get(1).contains("\"Ana\""));
        assertTrue(lines.get(2).contains("\"Bruno, Jr\""));
        try (var files = Files.list(exportDir)) {
            assertTrue(files.noneMatch(p -> p.toString().endsWith(".tmp")));
        }
    }

    @Test
    @DisplayName("Should include rows with a token or enough attended sessions")
    void testImportRoster() {
        List<RosterRow> rows = List.of(
                RosterRow.builder().displayName("With token").token("0000000001").attendedSessions(0).build(),
                RosterRow.builder().displayName("Regular").attendedSessions(2).build(),
                RosterRow.builder().displayName("Once").attendedSessions(1).build());

        ImportPreview preview = adapter().importRoster(rows, 2);

        assertEquals(2, preview.getMinSessions());
        assertEquals(3, preview.getTotalRows());
        assertEquals(List.of("With token", "Regular"),
                preview.getIncluded().stream().map(RosterRow::getDisplayName).toList());
        assertEquals("Once", preview.getExcluded().get(0).getDisplayName());
    }
}
