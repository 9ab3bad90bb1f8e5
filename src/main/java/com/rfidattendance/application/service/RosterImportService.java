package com.rfidattendance.application.service;

import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.ImportResult;
import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.domain.port.SpreadsheetPort;
import com.rfidattendance.infrastructure.file.CsvRosterReader;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Importa participantes desde una lista de alumnos externa en dos pasos:
 * vista previa y confirmación.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RosterImportService {

    private final CsvRosterReader rosterReader;
    private final SpreadsheetPort spreadsheetPort;
    private final SettingsService settingsService;
    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final TapResolver tapResolver;

    /**
     * Lee la lista y la clasifica con el mínimo de sesiones configurado.
     * No escribe nada.
     */
    public ImportPreview preview(Reader source, String sourceName) {
        List<RosterRow> rows = rosterReader.read(source, sourceName);
        int minSessions = settingsService.current().getRosterImportMinSessions();
        ImportPreview preview = spreadsheetPort.importRoster(rows, minSessions);
        log.info("Vista previa de {}: {} incluidas, {} descartadas (mínimo {} sesiones)",
                sourceName, preview.getIncluded().size(), preview.getExcluded().size(), minSessions);
        return preview;
    }

    /**
     * Crea los participantes incluidos en una sola transacción. Se omiten las
     * filas cuyo nombre ya existe (sin distinguir mayúsculas), cuyo token ya
     * tiene otro participante o cuyo token no es válido.
     */
    public ImportResult commit(List<RosterRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return ImportResult.builder().imported(0).skipped(List.of()).build();
        }

        ImportResult result = transactions.execute("importar alumnos", () -> {
            Set<String> knownNames = new HashSet<>();
            Set<String> heldTokens = new HashSet<>();
            for (Participant existing : store.listParticipants()) {
                knownNames.add(nameKey(existing.getDisplayName()));
                if (existing.hasToken()) {
                    heldTokens.add(existing.getToken());
                }
            }

            int imported = 0;
            List<String> skipped = new ArrayList<>();
            for (RosterRow row : rows) {
                String name = row.getDisplayName() == null ? "" : row.getDisplayName().trim();
                String token = row.hasToken() ? row.getToken().trim() : null;
                if (name.isEmpty() || knownNames.contains(nameKey(name))) {
                    skipped.add(name);
                    continue;
                }
                if (token != null && (heldTokens.contains(token) || tapResolver.validateToken(token).isPresent())) {
                    log.debug("Fila {} omitida: token {} ocupado o no válido", name, token);
                    skipped.add(name);
                    continue;
                }
                store.createParticipant(name, token);
                knownNames.add(nameKey(name));
                if (token != null) {
                    heldTokens.add(token);
                }
                imported++;
            }
            return ImportResult.builder().imported(imported).skipped(List.copyOf(skipped)).build();
        });

        log.info("Importación completada: {} creados, {} omitidos", result.getImported(), result.getSkippedCount());
        return result;
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
