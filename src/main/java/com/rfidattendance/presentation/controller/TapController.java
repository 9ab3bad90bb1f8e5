package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.TapResultDto;
import com.rfidattendance.application.service.TapCaptureService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Entrada de toques por API (lectores de red o tecleo manual del token).
 */
@RestController
@RequestMapping("/api/taps")
@RequiredArgsConstructor
@Slf4j
public class TapController {

    private final TapCaptureService captureService;

    /**
     * Procesa un toque. Los tokens rechazados también responden 200 con el
     * tipo de resultado; sólo los fallos del almacén devuelven error.
     */
    @PostMapping
    public ResponseEntity<?> submitTap(@RequestParam String token) {
        try {
            TapResultDto result = captureService.processIncomingToken(token);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return ApiResponses.failure("procesar toque", e);
        }
    }

    @GetMapping("/latest")
    public ResponseEntity<List<TapResultDto>> getLatest(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(captureService.getLatestResults(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<TapCaptureService.DayStatsDto> getStats() {
        return ResponseEntity.ok(captureService.getDayStats());
    }
}
