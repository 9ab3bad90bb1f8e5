package com.rfidattendance.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO para el estado de la captura por lector serial.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReaderStatusDto {

    private boolean active;
    private String portName;
    private String startTime;
    private long tapCount;
    private String statusMessage;

    /**
     * Crea un DTO para lector detenido.
     */
    public static ReaderStatusDto inactive() {
        return ReaderStatusDto.builder()
                .active(false)
                .statusMessage("Lector detenido")
                .build();
    }
}
