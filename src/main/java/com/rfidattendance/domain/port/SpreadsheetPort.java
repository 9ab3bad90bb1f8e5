package com.rfidattendance.domain.port;

import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.model.SummaryRow;

import java.util.List;

/**
 * Puerto hacia la hoja de cálculo externa.
 * Las implementaciones no acceden al almacén: trabajan sólo con las filas recibidas.
 */
public interface SpreadsheetPort {

    /**
     * Publica el resumen de asistencia.
     *
     * @param rows Filas ya leídas del almacén
     * @return Resultado del envío
     */
    PushResult pushSummary(List<SummaryRow> rows);

    /**
     * Clasifica las filas de una lista de alumnos. Una fila se incluye si trae
     * token o si su número de sesiones asistidas alcanza el mínimo.
     *
     * @param rows        Filas leídas de la hoja
     * @param minSessions Mínimo de sesiones para filas sin token
     * @return Vista previa de la importación
     */
    ImportPreview importRoster(List<RosterRow> rows, int minSessions);
}
