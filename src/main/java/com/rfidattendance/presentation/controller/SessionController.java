package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.LiveAttendanceDto;
import com.rfidattendance.application.dto.SessionDto;
import com.rfidattendance.application.service.SessionLifecycleManager;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sesiones del día y vista en vivo de la asistencia.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionLifecycleManager sessionManager;
    private final Clock clock;

    /**
     * Sesiones de una fecha (hoy si no se indica).
     */
    @GetMapping
    public ResponseEntity<?> getSessions(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        try {
            LocalDate day = date != null ? date : LocalDate.now(clock);
            List<SessionDto> sessions = sessionManager.sessionsOn(day).stream()
                    .map(SessionDto::fromDomain)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(sessions);
        } catch (Exception e) {
            return ApiResponses.failure("listar sesiones", e);
        }
    }

    /**
     * Estado de cada inscrito en la sesión.
     */
    @GetMapping("/{id}/live")
    public ResponseEntity<?> getLiveAttendance(@PathVariable Long id) {
        try {
            List<LiveAttendanceDto> entries = sessionManager.liveAttendance(id).stream()
                    .map(LiveAttendanceDto::fromDomain)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(entries);
        } catch (Exception e) {
            return ApiResponses.failure("consultar asistencia en vivo", e);
        }
    }
}
