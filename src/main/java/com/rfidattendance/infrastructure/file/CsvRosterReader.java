package com.rfidattendance.infrastructure.file;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.rfidattendance.domain.exception.CsvProcessingException;
import com.rfidattendance.domain.model.RosterRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lee una lista de alumnos exportada de la hoja de cálculo antigua.
 *
 * Columnas: {@code name} (o {@code first_name} + {@code last_name}),
 * {@code rfid} opcional, y una columna {@code D_YYYY_MM_DD} por sesión,
 * donde cualquier valor distinto de vacío o "0" cuenta como asistencia.
 */
@Component
@Slf4j
public class CsvRosterReader {

    private static final String DATE_COLUMN_PREFIX = "d_";

    /**
     * @param source     Contenido CSV
     * @param sourceName Nombre para logs y mensajes de error
     * @return Filas leídas, sin las filas en blanco
     */
    public List<RosterRow> read(Reader source, String sourceName) {
        List<String[]> lines;
        try (CSVReader reader = new CSVReader(source)) {
            lines = reader.readAll();
        } catch (IOException | CsvException e) {
            throw CsvProcessingException.cannotRead(sourceName, e);
        }
        if (lines.isEmpty()) {
            return List.of();
        }

        Header header = Header.parse(lines.get(0), sourceName);
        List<RosterRow> rows = new ArrayList<>();
        // Saltar header
        for (int i = 1; i < lines.size(); i++) {
            String[] fields = lines.get(i);
            String name = header.nameOf(fields);
            if (name.isEmpty()) {
                continue;
            }
            String token = header.tokenIndex >= 0 ? cell(fields, header.tokenIndex) : "";
            rows.add(RosterRow.builder()
                    .displayName(name)
                    .token(token.isEmpty() ? null : token)
                    .attendedSessions(header.countAttended(fields))
                    .build());
        }

        log.info("Leídas {} filas de {} ({} columnas de sesión)", rows.size(), sourceName,
                header.dateColumns.size());
        return rows;
    }

    private static String cell(String[] fields, int index) {
        return index < fields.length && fields[index] != null ? fields[index].trim() : "";
    }

    /**
     * Posiciones de las columnas relevantes.
     */
    private static final class Header {

        private int nameIndex = -1;
        private int firstNameIndex = -1;
        private int lastNameIndex = -1;
        private int tokenIndex = -1;
        private final List<Integer> dateColumns = new ArrayList<>();

        static Header parse(String[] columns, String sourceName) {
            Header header = new Header();
            for (int i = 0; i < columns.length; i++) {
                String column = columns[i] == null ? "" : columns[i].trim().toLowerCase(Locale.ROOT);
                switch (column) {
                    case "name" -> header.nameIndex = i;
                    case "first_name" -> header.firstNameIndex = i;
                    case "last_name" -> header.lastNameIndex = i;
                    case "rfid" -> header.tokenIndex = i;
                    default -> {
                        if (column.startsWith(DATE_COLUMN_PREFIX) && column.length() >= 8) {
                            header.dateColumns.add(i);
                        }
                    }
                }
            }
            boolean splitNames = header.firstNameIndex >= 0 && header.lastNameIndex >= 0;
            if (!splitNames && header.nameIndex < 0) {
                throw CsvProcessingException.missingColumns(sourceName, "'name' o 'first_name' + 'last_name'");
            }
            return header;
        }

        String nameOf(String[] fields) {
            if (firstNameIndex >= 0 && lastNameIndex >= 0) {
                return (cell(fields, firstNameIndex) + " " + cell(fields, lastNameIndex)).trim();
            }
            return cell(fields, nameIndex);
        }

        int countAttended(String[] fields) {
            int count = 0;
            for (int index : dateColumns) {
                String value = cell(fields, index);
                if (!value.isEmpty() && !"0".equals(value)) {
                    count++;
                }
            }
            return count;
        }
    }
}
