package com.rfidattendance.domain.model;

/**
 * Cambios de bandera producidos por un recálculo de inactividad.
 */
public record InactivityChange(int newlyInactive, int reactivated) {

    public static final InactivityChange NONE = new InactivityChange(0, 0);

    public InactivityChange plus(InactivityChange other) {
        return new InactivityChange(newlyInactive + other.newlyInactive, reactivated + other.reactivated);
    }

    public int total() {
        return newlyInactive + reactivated;
    }
}
