package com.rfidattendance.application.service;

import com.rfidattendance.IntegrationTestBase;
import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.ImportResult;
import com.rfidattendance.domain.model.RosterRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RosterImportService.
 */
class RosterImportServiceTest extends IntegrationTestBase {

    private static final String ROSTER = "name,rfid,D_2026_10_05,D_2026_10_12\n"
            + "Ana,0000000001,0,0\n"
            + "Bruno,,1,1\n"
            + "Carla,,1,0\n"
            + "Dario,,0,0\n";

    @Autowired
    private RosterImportService rosterImportService;

    @Test
    @DisplayName("Should classify rows with the configured minimum of sessions")
    void testPreview() {
        settingsService.updateRosterImportMinSessions(2);

        ImportPreview preview = rosterImportService.preview(new StringReader(ROSTER), "roster.csv");

        assertEquals(2, preview.getMinSessions());
        assertEquals(List.of("Ana", "Bruno"), names(preview.getIncluded()));
        assertEquals(List.of("Carla", "Dario"), names(preview.getExcluded()));
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM participants", Integer.class));
    }

    @Test
    @DisplayName("Should create included rows and skip known names or held tokens")
    void testCommit() {
        createParticipant("ana", "0000000099");
        createParticipant("Holder", "0000000002");
        ImportPreview preview = rosterImportService.preview(new StringReader(ROSTER
                + "Eva,0000000002,0,0\n"
                + "Fede,0000000003,0,0\n"), "roster.csv");

        ImportResult result = rosterImportService.commit(preview.getIncluded());

        assertEquals(3, result.getImported());
        assertEquals(List.of("Ana", "Eva"), result.getSkipped());
        assertTrue(transactions.execute("test", () -> store.findParticipantByToken("0000000003")).isPresent());
        assertEquals(5, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM participants", Integer.class));
    }

    @Test
    @DisplayName("Should skip repeated names inside the same import")
    void testCommitDeduplicatesBatch() {
        List<RosterRow> rows = List.of(
                RosterRow.builder().displayName("Ana").attendedSessions(3).build(),
                RosterRow.builder().displayName("ANA ").attendedSessions(3).build());

        ImportResult result = rosterImportService.commit(rows);

        assertEquals(1, result.getImported());
        assertEquals(1, result.getSkippedCount());
    }

    private static List<String> names(List<RosterRow> rows) {
        return rows.stream().map(RosterRow::getDisplayName).toList();
    }
}
