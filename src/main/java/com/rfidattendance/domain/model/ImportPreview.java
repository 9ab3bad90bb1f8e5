package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Vista previa de una importación de alumnos: filas incluidas y descartadas.
 */
@Value
@Builder
public class ImportPreview {

    int minSessions;
    List<RosterRow> included;
    List<RosterRow> excluded;

    public int getTotalRows() {
        return included.size() + excluded.size();
    }
}
