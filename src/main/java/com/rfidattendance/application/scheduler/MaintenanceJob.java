package com.rfidattendance.application.scheduler;

import com.rfidattendance.application.dto.SessionSummaryDto;
import com.rfidattendance.application.service.InactivityEvaluator;
import com.rfidattendance.application.service.SessionLifecycleManager;
import com.rfidattendance.application.service.SettingsService;
import com.rfidattendance.domain.model.ClassSession;
import com.rfidattendance.domain.model.InactivityChange;
import com.rfidattendance.domain.model.MaintenanceReport;
import com.rfidattendance.domain.model.SessionSummary;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import com.rfidattendance.presentation.websocket.AttendanceWebSocketHandler;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Mantenimiento nocturno: cierra las sesiones que quedaron abiertas de días
 * anteriores y recalcula la inactividad de todos los participantes.
 * Soporta reprogramación del horario via API.
 */
@Component
@Slf4j
public class MaintenanceJob {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final AttendanceStore store;
    private final StoreTransactions transactions;
    private final SessionLifecycleManager sessionManager;
    private final InactivityEvaluator inactivityEvaluator;
    private final SettingsService settingsService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @Autowired
    @Lazy
    private AttendanceWebSocketHandler webSocketHandler;

    @Value("${maintenance.enabled:true}")
    private boolean enabled;

    @Value("${maintenance.cron.expression:0 30 23 * * *}")
    @Getter
    private String currentCronExpression;

    private ScheduledFuture<?> scheduledTask;

    // --- Tracking de la última ejecución ---
    @Getter
    private volatile MaintenanceReport lastReport;
    @Getter
    private volatile boolean lastRunSuccess;
    @Getter
    private volatile String lastRunError;
    @Getter
    private String scheduledTimeDisplay;

    public MaintenanceJob(AttendanceStore store,
            StoreTransactions transactions,
            SessionLifecycleManager sessionManager,
            InactivityEvaluator inactivityEvaluator,
            SettingsService settingsService,
            @Qualifier("taskScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.store = store;
        this.transactions = transactions;
        this.sessionManager = sessionManager;
        this.inactivityEvaluator = inactivityEvaluator;
        this.settingsService = settingsService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("Mantenimiento programado desactivado");
            scheduledTimeDisplay = cronToReadableTime(currentCronExpression);
            return;
        }
        scheduleTask(currentCronExpression);
    }

    /**
     * Programa o reprograma el mantenimiento con una nueva expresión cron.
     *
     * @param cronExpression Expresión cron de Spring (6 campos)
     */
    public synchronized void scheduleTask(String cronExpression) {
        if (!CronExpression.isValidExpression(cronExpression)) {
            throw new IllegalArgumentException("Expresión cron inválida: " + cronExpression);
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            log.info("Mantenimiento anterior cancelado");
        }

        this.currentCronExpression = cronExpression;
        this.scheduledTimeDisplay = cronToReadableTime(cronExpression);
        scheduledTask = taskScheduler.schedule(this::runScheduled, new CronTrigger(cronExpression));
        log.info("Mantenimiento programado: {} ({})", cronExpression, scheduledTimeDisplay);
    }

    /**
     * Reprograma el mantenimiento a una hora del día.
     *
     * @return La nueva expresión cron
     */
    public String reschedule(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Hora inválida: " + hour + ":" + minute);
        }
        String cron = String.format("0 %d %d * * *", minute, hour);
        scheduleTask(cron);
        return cron;
    }

    /**
     * Ejecución desde el planificador. Los errores quedan registrados en el
     * último resultado; no se propagan al hilo del planificador.
     */
    void runScheduled() {
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            log.error("Error fatal en mantenimiento: {}", e.getMessage(), e);
        }
    }

    /**
     * Ejecuta el mantenimiento completo.
     *
     * @return Resumen de la ejecución
     */
    public synchronized MaintenanceReport runMaintenance() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        log.info("=== INICIANDO MANTENIMIENTO ===");
        notifyStarted(startedAt);

        try {
            int closed = closeStaleSessions(startedAt.toLocalDate());
            InactivityChange change = inactivityEvaluator.recomputeAll(
                    settingsService.current().getInactivityThreshold());

            MaintenanceReport report = MaintenanceReport.builder()
                    .executedAt(startedAt)
                    .sessionsClosed(closed)
                    .newlyInactive(change.newlyInactive())
                    .reactivated(change.reactivated())
                    .build();
            updateLastRun(report, true, null);
            notifyCompleted(report, true);
            log.info("=== MANTENIMIENTO COMPLETADO: {} sesiones cerradas, {} inactivos, {} reactivados ===",
                    closed, change.newlyInactive(), change.reactivated());
            return report;
        } catch (RuntimeException e) {
            MaintenanceReport failed = MaintenanceReport.builder().executedAt(startedAt).build();
            updateLastRun(failed, false, e.getMessage());
            notifyCompleted(failed, false);
            throw e;
        }
    }

    private int closeStaleSessions(LocalDate today) {
        List<ClassSession> stale = transactions.execute("buscar sesiones abiertas",
                () -> store.openSessionsBefore(today));
        if (stale.isEmpty()) {
            log.info("No hay sesiones abiertas de días anteriores");
            return 0;
        }

        int closed = 0;
        for (ClassSession session : stale) {
            SessionSummary summary = sessionManager.closeSession(session.getId());
            closed++;
            log.info("Sesión {} del {} cerrada: {}/{} presentes", session.getId(), session.getDate(),
                    summary.getPresentCount(), summary.getTotalEnrolled());
            notifySessionClosed(summary);
        }
        return closed;
    }

    // --- Helpers ---

    private void updateLastRun(MaintenanceReport report, boolean success, String error) {
        this.lastReport = report;
        this.lastRunSuccess = success;
        this.lastRunError = error;
    }

    private void notifyStarted(LocalDateTime startedAt) {
        try {
            if (webSocketHandler != null) {
                webSocketHandler.broadcastMaintenanceStarted(startedAt.format(TIME_FORMAT));
            }
        } catch (RuntimeException e) {
            log.debug("No se pudo notificar inicio de mantenimiento: {}", e.getMessage());
        }
    }

    private void notifySessionClosed(SessionSummary summary) {
        try {
            if (webSocketHandler != null) {
                webSocketHandler.broadcastSessionClosed(SessionSummaryDto.fromDomain(summary));
            }
        } catch (RuntimeException e) {
            log.debug("No se pudo notificar cierre de sesión: {}", e.getMessage());
        }
    }

    private void notifyCompleted(MaintenanceReport report, boolean success) {
        try {
            if (webSocketHandler != null) {
                webSocketHandler.broadcastMaintenanceCompleted(report.getSessionsClosed(),
                        report.getNewlyInactive(), report.getReactivated(), success,
                        LocalDateTime.now(clock).format(TIME_FORMAT));
            }
        } catch (RuntimeException e) {
            log.debug("No se pudo notificar fin de mantenimiento: {}", e.getMessage());
        }
    }

    /**
     * Convierte una expresión cron a texto legible (e.g. "23:30").
     */
    private String cronToReadableTime(String cron) {
        String[] parts = cron.trim().split("\\s+");
        if (parts.length < 3) {
            return cron;
        }
        try {
            return String.format("%02d:%02d", Integer.parseInt(parts[2]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            log.debug("Cron sin hora fija: {}", cron);
            return cron;
        }
    }
}
