package com.rfidattendance.application.dto;

import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.Participant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DTO para transferencia de datos de un participante.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantDto {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private Long id;
    private String token;
    private String displayName;
    private boolean inactive;
    private String createdAt;
    private List<String> groups;

    /**
     * Convierte un modelo de dominio a DTO.
     */
    public static ParticipantDto fromDomain(Participant participant) {
        return fromDomain(participant, List.of());
    }

    public static ParticipantDto fromDomain(Participant participant, List<ClassGroup> groups) {
        return ParticipantDto.builder()
                .id(participant.getId())
                .token(participant.getToken())
                .displayName(participant.getDisplayName())
                .inactive(participant.isInactive())
                .createdAt(participant.getCreatedAt() != null
                        ? participant.getCreatedAt().format(DATE_FORMAT)
                        : "N/A")
                .groups(groups.stream().map(ClassGroup::getName).collect(Collectors.toList()))
                .build();
    }
}
