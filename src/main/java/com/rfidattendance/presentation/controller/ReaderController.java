package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.ReaderStatusDto;
import com.rfidattendance.application.service.TapCaptureService;
import com.rfidattendance.domain.model.SerialPortInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Control del lector de tarjetas por puerto serial.
 */
@RestController
@RequestMapping("/api/reader")
@RequiredArgsConstructor
@Slf4j
public class ReaderController {

    private final TapCaptureService captureService;

    /**
     * Obtiene la lista de puertos disponibles.
     */
    @GetMapping("/ports")
    public ResponseEntity<List<SerialPortInfo>> getPorts() {
        List<SerialPortInfo> ports = captureService.getAvailablePorts();
        log.info("Puertos encontrados: {}", ports.size());
        return ResponseEntity.ok(ports);
    }

    /**
     * Inicia la captura en el puerto indicado.
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestParam String portName) {
        try {
            if (portName == null || portName.isBlank()) {
                throw new IllegalArgumentException("Debe seleccionar un puerto");
            }
            log.info("Solicitud para iniciar lector en {}", portName);
            captureService.startCapture(portName);
            return ApiResponses.ok("Lector iniciado correctamente", "status", captureService.getReaderStatus());
        } catch (Exception e) {
            return ApiResponses.failure("iniciar lector", e);
        }
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        try {
            captureService.stopCapture();
            return ResponseEntity.ok(ApiResponses.success("Lector detenido correctamente"));
        } catch (Exception e) {
            return ApiResponses.failure("detener lector", e);
        }
    }

    @GetMapping("/status")
    public ResponseEntity<ReaderStatusDto> getStatus() {
        return ResponseEntity.ok(captureService.getReaderStatus());
    }
}
