package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.Participant;
import com.rfidattendance.domain.model.TapOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * DTO para enviar el resultado de un toque a la pantalla y al WebSocket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TapResultDto {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private String type;
    private String token;
    private Long participantId;
    private String displayName;
    private List<String> recordedGroups;
    private List<String> alreadySatisfiedGroups;
    private boolean inactiveWarning;
    private Integer attendedSessions;
    private Integer totalSessions;
    private String message;
    private String statusClass;
    private String time;

    /**
     * Crea un DTO desde el resultado del resolvedor.
     */
    public static TapResultDto fromDomain(TapOutcome outcome, LocalDateTime at) {
        TapResultDto.TapResultDtoBuilder builder = TapResultDto.builder()
                .type(outcome.type().name())
                .token(outcome.token())
                .recordedGroups(List.of())
                .alreadySatisfiedGroups(List.of())
                .time(at.format(TIME_FORMAT));

        switch (outcome.type()) {
            case INVALID_TOKEN -> {
                TapOutcome.InvalidToken invalid = (TapOutcome.InvalidToken) outcome;
                builder.message("Tarjeta no válida: " + invalid.reason()).statusClass("danger");
            }
            case UNKNOWN_TOKEN -> builder.message("Tarjeta no registrada").statusClass("warning");
            case NO_ENROLLMENT -> {
                TapOutcome.NoEnrollment none = (TapOutcome.NoEnrollment) outcome;
                withParticipant(builder, none.participant());
                builder.message(none.participant().getDisplayName() + " no tiene grupos asignados")
                        .statusClass("warning");
            }
            case RECORDED -> {
                TapOutcome.Recorded recorded = (TapOutcome.Recorded) outcome;
                withParticipant(builder, recorded.participant());
                builder.recordedGroups(recorded.recordedGroups())
                        .alreadySatisfiedGroups(recorded.alreadySatisfiedGroups())
                        .inactiveWarning(recorded.inactiveWarning())
                        .attendedSessions(recorded.attendedSessions())
                        .totalSessions(recorded.totalSessions())
                        .statusClass("success")
                        .message(recorded.nothingScheduledToday()
                                ? recorded.participant().getDisplayName() + " no tiene clase hoy"
                                : "Asistencia registrada: " + String.join(", ", recorded.recordedGroups()));
            }
            case DUPLICATE -> {
                TapOutcome.Duplicate duplicate = (TapOutcome.Duplicate) outcome;
                withParticipant(builder, duplicate.participant());
                builder.alreadySatisfiedGroups(duplicate.satisfiedGroups())
                        .attendedSessions(duplicate.attendedSessions())
                        .totalSessions(duplicate.totalSessions())
                        .statusClass("info")
                        .message("Asistencia ya registrada: " + String.join(", ", duplicate.satisfiedGroups()));
            }
        }
        return builder.build();
    }

    private static void withParticipant(TapResultDto.TapResultDtoBuilder builder, Participant participant) {
        builder.participantId(participant.getId()).displayName(participant.getDisplayName());
    }
}
