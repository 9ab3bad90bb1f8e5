package com.rfidattendance.domain.model;

import java.util.Arrays;

/**
 * Tipo de grupo.
 */
public enum GroupCategory {
    TECHNIQUE("Technique"),
    NORMAL("Normal");

    private final String label;

    GroupCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Interpreta la etiqueta ignorando mayúsculas.
     *
     * @throws IllegalArgumentException si no pertenece al vocabulario
     */
    public static GroupCategory fromLabel(String value) {
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Categoría desconocida: " + value));
    }
}
