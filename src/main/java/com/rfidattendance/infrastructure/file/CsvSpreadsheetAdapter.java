package com.rfidattendance.infrastructure.file;

import com.opencsv.CSVWriter;
import com.rfidattendance.domain.exception.CsvProcessingException;
import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.model.SummaryRow;
import com.rfidattendance.domain.port.SpreadsheetPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Implementación del puerto SpreadsheetPort sobre archivos CSV.
 * El resumen se escribe en un archivo temporal y se mueve al nombre final,
 * para que quien lo lea nunca vea un archivo a medias.
 */
@Component
@Slf4j
public class CsvSpreadsheetAdapter implements SpreadsheetPort {

    private static final String[] SUMMARY_HEADER = { "participant_id", "name", "rfid", "attended",
            "total_sessions", "inactive" };
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final Path exportDir;
    private final Clock clock;

    public CsvSpreadsheetAdapter(@Value("${csv.export-path:./exports}") String exportPath, Clock clock) {
        this.exportDir = Paths.get(exportPath);
        this.clock = clock;
    }

    @Override
    public PushResult pushSummary(List<SummaryRow> rows) {
        Path target = exportDir.resolve("attendance_summary_"
                + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".csv");
        Path temp = exportDir.resolve(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(exportDir);
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 CSVWriter writer = new CSVWriter(out)) {
                writer.writeNext(SUMMARY_HEADER);
                for (SummaryRow row : rows) {
                    writer.writeNext(new String[] {
                            String.valueOf(row.getParticipantId()),
                            row.getDisplayName(),
                            row.getToken() != null ? row.getToken() : "",
                            String.valueOf(row.getAttended()),
                            String.valueOf(row.getTotalSessions()),
                            row.isInactive() ? "1" : "0"
                    });
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw CsvProcessingException.cannotWrite(target.toString(), e);
        }

        log.info("Resumen exportado: {} filas en {}", rows.size(), target.toAbsolutePath());
        return PushResult.ok(rows.size(), target.toString());
    }

    @Override
    public ImportPreview importRoster(List<RosterRow> rows, int minSessions) {
        List<RosterRow> included = new ArrayList<>();
        List<RosterRow> excluded = new ArrayList<>();
        for (RosterRow row : rows) {
            // Sin tarjeta nunca podrán pasar por el lector: se exige un mínimo de asistencias
            if (row.hasToken() || row.getAttendedSessions() >= minSessions) {
                included.add(row);
            } else {
                excluded.add(row);
            }
        }

        log.info("Vista previa de importación: {} incluidas, {} descartadas (mínimo {})",
                included.size(), excluded.size(), minSessions);
        return ImportPreview.builder()
                .minSessions(minSessions)
                .included(List.copyOf(included))
                .excluded(List.copyOf(excluded))
                .build();
    }

    public Path getExportDir() {
        return exportDir;
    }
}
