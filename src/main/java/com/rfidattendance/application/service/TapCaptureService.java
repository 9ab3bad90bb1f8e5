package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.ReaderStatusDto;
import com.rfidattendance.application.dto.TapResultDto;
import com.rfidattendance.domain.model.SerialPortInfo;

import java.util.List;

/**
 * Entrada de toques: lector serial y API.
 * Ambos caminos terminan en el mismo {@link TapResolver}.
 */
public interface TapCaptureService {

    /**
     * Obtiene la lista de puertos seriales disponibles.
     *
     * @return Lista de información de puertos
     */
    List<SerialPortInfo> getAvailablePorts();

    /**
     * Empieza a escuchar el lector en el puerto indicado.
     *
     * @param portName Nombre del puerto COM
     * @throws IllegalStateException si ya hay una captura activa
     */
    void startCapture(String portName);

    /**
     * Detiene la captura actual.
     */
    void stopCapture();

    ReaderStatusDto getReaderStatus();

    /**
     * Procesa un token recibido, lo publica por WebSocket y lo guarda en el historial del día.
     *
     * @param token Token leído
     * @return Resultado del toque
     */
    TapResultDto processIncomingToken(String token);

    /**
     * Obtiene los últimos N resultados, los más recientes primero.
     */
    List<TapResultDto> getLatestResults(int limit);

    /**
     * Obtiene estadísticas del día.
     */
    DayStatsDto getDayStats();

    /**
     * DTO interno para estadísticas del día.
     */
    record DayStatsDto(
            long totalTaps,
            long recordedCount,
            long duplicateCount,
            long rejectedCount,
            String lastTapTime) {
    }
}
