package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.AttendanceRecordDto;
import com.rfidattendance.application.dto.GroupDto;
import com.rfidattendance.application.dto.ParticipantDto;
import com.rfidattendance.application.dto.SessionDto;
import com.rfidattendance.application.dto.SessionSummaryDto;
import com.rfidattendance.application.scheduler.MaintenanceJob;
import com.rfidattendance.application.service.GroupService;
import com.rfidattendance.application.service.InactivityEvaluator;
import com.rfidattendance.application.service.ManualAttendanceService;
import com.rfidattendance.application.service.RegistrationService;
import com.rfidattendance.application.service.RosterImportService;
import com.rfidattendance.application.service.SessionLifecycleManager;
import com.rfidattendance.application.service.SettingsService;
import com.rfidattendance.application.service.SummaryPushService;
import com.rfidattendance.domain.model.AttendanceStatus;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.model.GroupCategory;
import com.rfidattendance.domain.model.GroupLevel;
import com.rfidattendance.domain.model.ImportPreview;
import com.rfidattendance.domain.model.ImportResult;
import com.rfidattendance.domain.model.InactivityChange;
import com.rfidattendance.domain.model.MaintenanceReport;
import com.rfidattendance.domain.model.OperatorSettings;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.RosterRow;
import com.rfidattendance.domain.model.SessionSummary;
import com.rfidattendance.domain.model.Weekdays;
import com.rfidattendance.presentation.websocket.AttendanceWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operaciones administrativas. Todas las rutas exigen una sesión
 * administrativa abierta (ver {@link AdminAccessInterceptor}).
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final GroupService groupService;
    private final RegistrationService registrationService;
    private final ManualAttendanceService manualAttendanceService;
    private final SessionLifecycleManager sessionManager;
    private final SettingsService settingsService;
    private final InactivityEvaluator inactivityEvaluator;
    private final RosterImportService rosterImportService;
    private final SummaryPushService summaryPushService;
    private final MaintenanceJob maintenanceJob;
    private final AttendanceWebSocketHandler webSocketHandler;

    // --- Grupos ---

    @PostMapping("/groups")
    public ResponseEntity<Map<String, Object>> createGroup(@RequestBody GroupRequest request) {
        try {
            GroupDto group = groupService.createGroup(request.toDomain(null));
            return ApiResponses.ok("Grupo creado", "group", group);
        } catch (Exception e) {
            return ApiResponses.failure("crear grupo", e);
        }
    }

    @PutMapping("/groups/{id}")
    public ResponseEntity<Map<String, Object>> updateGroup(@PathVariable Long id, @RequestBody GroupRequest request) {
        try {
            GroupDto group = groupService.updateGroup(request.toDomain(id));
            return ApiResponses.ok("Grupo actualizado", "group", group);
        } catch (Exception e) {
            return ApiResponses.failure("actualizar grupo", e);
        }
    }

    /**
     * Borra el grupo con sus sesiones, registros e inscripciones.
     */
    @DeleteMapping("/groups/{id}")
    public ResponseEntity<Map<String, Object>> deleteGroup(@PathVariable Long id) {
        try {
            groupService.deleteGroup(id);
            return ResponseEntity.ok(ApiResponses.success("Grupo eliminado"));
        } catch (Exception e) {
            return ApiResponses.failure("eliminar grupo", e);
        }
    }

    // --- Participantes ---

    @DeleteMapping("/participants/{id}")
    public ResponseEntity<Map<String, Object>> deleteParticipant(@PathVariable Long id) {
        try {
            registrationService.deleteParticipant(id);
            return ResponseEntity.ok(ApiResponses.success("Participante eliminado"));
        } catch (Exception e) {
            return ApiResponses.failure("eliminar participante", e);
        }
    }

    @PutMapping("/participants/{id}/name")
    public ResponseEntity<Map<String, Object>> rename(@PathVariable Long id, @RequestParam String displayName) {
        try {
            ParticipantDto participant = registrationService.rename(id, displayName);
            return ApiResponses.ok("Nombre actualizado", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("renombrar participante", e);
        }
    }

    /**
     * Cambia el token. Con {@code transfer=true} se lo quita a quien lo tenga.
     */
    @PutMapping("/participants/{id}/token")
    public ResponseEntity<Map<String, Object>> changeToken(@PathVariable Long id,
                                                           @RequestParam String token,
                                                           @RequestParam(defaultValue = "false") boolean transfer) {
        try {
            ParticipantDto participant = registrationService.changeToken(id, token.trim(), transfer);
            return ApiResponses.ok("Token actualizado", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("cambiar token", e);
        }
    }

    @DeleteMapping("/participants/{id}/token")
    public ResponseEntity<Map<String, Object>> clearToken(@PathVariable Long id) {
        try {
            ParticipantDto participant = registrationService.clearToken(id);
            return ApiResponses.ok("Token retirado", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("quitar token", e);
        }
    }

    @DeleteMapping("/participants/{id}/groups/{groupId}")
    public ResponseEntity<Map<String, Object>> unenroll(@PathVariable Long id, @PathVariable Long groupId) {
        try {
            ParticipantDto participant = registrationService.unenroll(id, groupId);
            return ApiResponses.ok("Inscripción eliminada", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("quitar inscripción", e);
        }
    }

    // --- Asistencia ---

    /**
     * Fija la asistencia de un participante en el grupo y fecha, creando la sesión si hace falta.
     */
    @PutMapping("/attendance")
    public ResponseEntity<Map<String, Object>> setAttendance(
            @RequestParam Long participantId,
            @RequestParam Long groupId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam String status) {
        try {
            AttendanceStatus parsed = parseStatus(status);
            AttendanceRecordDto record = AttendanceRecordDto.fromDomain(
                    manualAttendanceService.setAttendance(participantId, groupId, date, parsed));
            return ApiResponses.ok("Asistencia actualizada", "record", record);
        } catch (Exception e) {
            return ApiResponses.failure("fijar asistencia", e);
        }
    }

    @PostMapping("/sessions/{sessionId}/participants/{participantId}/present")
    public ResponseEntity<Map<String, Object>> markPresent(@PathVariable Long sessionId,
                                                           @PathVariable Long participantId) {
        try {
            AttendanceRecordDto record = AttendanceRecordDto.fromDomain(
                    manualAttendanceService.markPresentManually(sessionId, participantId));
            return ApiResponses.ok("Participante marcado presente", "record", record);
        } catch (Exception e) {
            return ApiResponses.failure("marcar presente", e);
        }
    }

    @PostMapping("/sessions/{sessionId}/participants/{participantId}/toggle")
    public ResponseEntity<Map<String, Object>> toggle(@PathVariable Long sessionId,
                                                      @PathVariable Long participantId) {
        try {
            AttendanceRecordDto record = AttendanceRecordDto.fromDomain(
                    manualAttendanceService.toggleAttendance(sessionId, participantId));
            return ApiResponses.ok("Asistencia alternada", "record", record);
        } catch (Exception e) {
            return ApiResponses.failure("alternar asistencia", e);
        }
    }

    // --- Sesiones ---

    @PostMapping("/sessions")
    public ResponseEntity<Map<String, Object>> resolveSession(
            @RequestParam Long groupId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        try {
            SessionDto session = SessionDto.fromDomain(sessionManager.resolveSession(groupId, date));
            return ApiResponses.ok("Sesión disponible", "session", session);
        } catch (Exception e) {
            return ApiResponses.failure("resolver sesión", e);
        }
    }

    /**
     * Cierra la sesión: los inscritos activos sin registro quedan ausentes.
     */
    @PostMapping("/sessions/{id}/close")
    public ResponseEntity<Map<String, Object>> closeSession(@PathVariable Long id) {
        try {
            SessionSummary summary = sessionManager.closeSession(id);
            SessionSummaryDto dto = SessionSummaryDto.fromDomain(summary);
            webSocketHandler.broadcastSessionClosed(dto);
            return ApiResponses.ok("Sesión cerrada", "summary", dto);
        } catch (Exception e) {
            return ApiResponses.failure("cerrar sesión", e);
        }
    }

    // --- Ajustes ---

    @GetMapping("/settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        return ResponseEntity.ok(settingsView(settingsService.current()));
    }

    @PutMapping("/settings")
    public ResponseEntity<Map<String, Object>> updateSettings(
            @RequestParam(required = false) Integer inactivityThreshold,
            @RequestParam(required = false) String language,
            @RequestParam(required = false) Integer rosterImportMinSessions) {
        try {
            if (inactivityThreshold != null) {
                settingsService.updateInactivityThreshold(inactivityThreshold);
            }
            if (language != null) {
                settingsService.updateLanguage(language);
            }
            if (rosterImportMinSessions != null) {
                settingsService.updateRosterImportMinSessions(rosterImportMinSessions);
            }
            Map<String, Object> response = settingsView(settingsService.current());
            response.put("success", true);
            response.put("message", "Ajustes guardados");
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ApiResponses.failure("guardar ajustes", e);
        }
    }

    /**
     * Recalcula la inactividad de todos con el umbral indicado o el configurado.
     */
    @PostMapping("/inactivity/recompute")
    public ResponseEntity<Map<String, Object>> recomputeInactivity(
            @RequestParam(required = false) Integer threshold) {
        try {
            int effective = threshold != null ? threshold : settingsService.current().getInactivityThreshold();
            InactivityChange change = inactivityEvaluator.recomputeAll(effective);
            Map<String, Object> response = ApiResponses.success("Inactividad recalculada");
            response.put("threshold", effective);
            response.put("newlyInactive", change.newlyInactive());
            response.put("reactivated", change.reactivated());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ApiResponses.failure("recalcular inactividad", e);
        }
    }

    // --- Hoja de cálculo ---

    /**
     * Lee una lista de alumnos en CSV y devuelve la vista previa sin escribir nada.
     */
    @PostMapping("/roster/preview")
    public ResponseEntity<Map<String, Object>> previewRoster(@RequestParam("file") MultipartFile file) {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "roster.csv";
            ImportPreview preview = rosterImportService.preview(reader, name);
            return ApiResponses.ok("Vista previa generada", "preview", preview);
        } catch (Exception e) {
            return ApiResponses.failure("leer lista de alumnos", e);
        }
    }

    @PostMapping("/roster/commit")
    public ResponseEntity<Map<String, Object>> commitRoster(@RequestBody List<RosterRowRequest> rows) {
        try {
            List<RosterRow> domainRows = rows.stream()
                    .map(RosterRowRequest::toDomain)
                    .collect(Collectors.toList());
            ImportResult result = rosterImportService.commit(domainRows);
            return ApiResponses.ok(result.getImported() + " participantes importados", "result", result);
        } catch (Exception e) {
            return ApiResponses.failure("importar alumnos", e);
        }
    }

    @PostMapping("/summary/push")
    public ResponseEntity<Map<String, Object>> pushSummary() {
        PushResult result = summaryPushService.pushSummary();
        Map<String, Object> response = new HashMap<>();
        response.put("success", result.isSuccess());
        response.put("message", result.getMessage());
        response.put("rowsWritten", result.getRowsWritten());
        response.put("destination", result.getDestination());
        return result.isSuccess()
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    // --- Mantenimiento ---

    @PostMapping("/maintenance/run")
    public ResponseEntity<Map<String, Object>> runMaintenance() {
        try {
            MaintenanceReport report = maintenanceJob.runMaintenance();
            return ApiResponses.ok("Mantenimiento completado", "report", report);
        } catch (Exception e) {
            return ApiResponses.failure("ejecutar mantenimiento", e);
        }
    }

    /**
     * Reprograma el mantenimiento nocturno a la hora indicada.
     */
    @PostMapping("/maintenance/schedule")
    public ResponseEntity<Map<String, Object>> reschedule(@RequestParam int hour, @RequestParam int minute) {
        try {
            String cron = maintenanceJob.reschedule(hour, minute);
            Map<String, Object> response = ApiResponses.success("Mantenimiento reprogramado");
            response.put("cron", cron);
            response.put("scheduledTime", maintenanceJob.getScheduledTimeDisplay());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ApiResponses.failure("reprogramar mantenimiento", e);
        }
    }

    @GetMapping("/maintenance/status")
    public ResponseEntity<Map<String, Object>> getMaintenanceStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("cron", maintenanceJob.getCurrentCronExpression());
        response.put("scheduledTime", maintenanceJob.getScheduledTimeDisplay());
        response.put("lastReport", maintenanceJob.getLastReport());
        response.put("lastRunSuccess", maintenanceJob.isLastRunSuccess());
        response.put("lastRunError", maintenanceJob.getLastRunError());
        return ResponseEntity.ok(response);
    }

    // --- Helpers ---

    private static Map<String, Object> settingsView(OperatorSettings settings) {
        Map<String, Object> view = new HashMap<>();
        view.put("inactivityThreshold", settings.getInactivityThreshold());
        view.put("language", settings.getLanguage());
        view.put("rosterImportMinSessions", settings.getRosterImportMinSessions());
        view.put("credentialConfigured", settings.isCredentialConfigured());
        return view;
    }

    private static AttendanceStatus parseStatus(String status) {
        try {
            return AttendanceStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Estado de asistencia no válido: " + status, e);
        }
    }

    public record GroupRequest(String name, String category, String level, String weekday, String startTime) {

        ClassGroup toDomain(Long id) {
            LocalTime time;
            try {
                time = LocalTime.parse(startTime == null ? "" : startTime.trim());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Hora no válida (HH:mm): " + startTime, e);
            }
            return ClassGroup.builder()
                    .id(id)
                    .name(name)
                    .category(GroupCategory.fromLabel(category))
                    .level(GroupLevel.fromLabel(level))
                    .weekday(Weekdays.parse(weekday))
                    .startTime(time)
                    .build();
        }
    }

    public record RosterRowRequest(String displayName, String token, int attendedSessions) {

        RosterRow toDomain() {
            return RosterRow.builder()
                    .displayName(displayName)
                    .token(token)
                    .attendedSessions(attendedSessions)
                    .build();
        }
    }
}
