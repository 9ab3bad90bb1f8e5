package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resultado de enviar el resumen de asistencia a la hoja de cálculo.
 */
@Value
@Builder
public class PushResult {

    boolean success;
    int rowsWritten;

    /** Destino escrito (ruta o identificador), nulo si falló */
    String destination;

    String message;

    public static PushResult ok(int rows, String destination) {
        return PushResult.builder()
                .success(true)
                .rowsWritten(rows)
                .destination(destination)
                .message("Resumen enviado: " + rows + " filas")
                .build();
    }

    public static PushResult failed(String message) {
        return PushResult.builder()
                .success(false)
                .message(message)
                .build();
    }
}
