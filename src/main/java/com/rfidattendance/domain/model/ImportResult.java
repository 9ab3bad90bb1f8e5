package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Resultado de confirmar una importación de alumnos.
 */
@Value
@Builder
public class ImportResult {

    int imported;
    List<String> skipped;

    public int getSkippedCount() {
        return skipped.size();
    }
}
