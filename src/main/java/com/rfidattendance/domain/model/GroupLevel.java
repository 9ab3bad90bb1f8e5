package com.rfidattendance.domain.model;

import java.util.Arrays;

/**
 * Nivel del grupo.
 */
public enum GroupLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    ADVANCED("Advanced");

    private final String label;

    GroupLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static GroupLevel fromLabel(String value) {
        return Arrays.stream(values())
                .filter(l -> l.label.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Nivel desconocido: " + value));
    }
}
