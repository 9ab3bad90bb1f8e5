package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.ReportRowDto;
import com.rfidattendance.application.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Informes de asistencia.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;
    private final Clock clock;

    @GetMapping("/summary")
    public ResponseEntity<?> getSummary() {
        try {
            List<ReportRowDto> rows = reportService.participantSummaries().stream()
                    .map(ReportRowDto::fromDomain)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(rows);
        } catch (Exception e) {
            return ApiResponses.failure("generar resumen", e);
        }
    }

    /**
     * Informe de un grupo en una fecha (hoy si no se indica).
     */
    @GetMapping("/daily")
    public ResponseEntity<?> getDaily(
            @RequestParam Long groupId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        try {
            return ResponseEntity.ok(reportService.dailyReport(groupId, date != null ? date : LocalDate.now(clock)));
        } catch (Exception e) {
            return ApiResponses.failure("generar informe diario", e);
        }
    }
}
