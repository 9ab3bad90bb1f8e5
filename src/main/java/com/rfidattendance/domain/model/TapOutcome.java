package com.rfidattendance.domain.model;

import java.util.List;

/**
 * Resultado cerrado de procesar un toque de tarjeta.
 * Los llamadores hacen {@code switch} sobre {@link #type()}, que es exhaustivo.
 */
public sealed interface TapOutcome
        permits TapOutcome.InvalidToken, TapOutcome.UnknownToken, TapOutcome.NoEnrollment,
        TapOutcome.Recorded, TapOutcome.Duplicate {

    TapOutcomeType type();

    /** Token tal como se recibió (normalizado) */
    String token();

    record InvalidToken(String token, String reason) implements TapOutcome {
        @Override
        public TapOutcomeType type() {
            return TapOutcomeType.INVALID_TOKEN;
        }
    }

    record UnknownToken(String token) implements TapOutcome {
        @Override
        public TapOutcomeType type() {
            return TapOutcomeType.UNKNOWN_TOKEN;
        }
    }

    record NoEnrollment(String token, Participant participant) implements TapOutcome {
        @Override
        public TapOutcomeType type() {
            return TapOutcomeType.NO_ENROLLMENT;
        }
    }

    /**
     * @param recordedGroups         grupos marcados como presentes en este toque
     * @param alreadySatisfiedGroups grupos de hoy que ya tenían registro
     * @param inactiveWarning        el participante estaba marcado como inactivo al tocar; se
     *                               toma antes del recálculo que sigue al toque, así que el aviso
     *                               aparece aunque esta misma asistencia lo reactive
     * @param attendedSessions       sesiones con presencia, contando este toque
     * @param totalSessions          sesiones de todos sus grupos hasta hoy
     */
    record Recorded(String token, Participant participant, List<String> recordedGroups,
                    List<String> alreadySatisfiedGroups, boolean inactiveWarning,
                    int attendedSessions, int totalSessions) implements TapOutcome {

        public Recorded {
            recordedGroups = List.copyOf(recordedGroups);
            alreadySatisfiedGroups = List.copyOf(alreadySatisfiedGroups);
        }

        @Override
        public TapOutcomeType type() {
            return TapOutcomeType.RECORDED;
        }

        /**
         * El participante no tiene ningún grupo programado para hoy.
         */
        public boolean nothingScheduledToday() {
            return recordedGroups.isEmpty() && alreadySatisfiedGroups.isEmpty();
        }
    }

    record Duplicate(String token, Participant participant, List<String> satisfiedGroups,
                     int attendedSessions, int totalSessions) implements TapOutcome {

        public Duplicate {
            satisfiedGroups = List.copyOf(satisfiedGroups);
        }

        @Override
        public TapOutcomeType type() {
            return TapOutcomeType.DUPLICATE;
        }
    }
}
