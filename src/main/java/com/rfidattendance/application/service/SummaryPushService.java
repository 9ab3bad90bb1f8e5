package com.rfidattendance.application.service;

import com.rfidattendance.application.config.AttendanceProperties;
import com.rfidattendance.domain.model.PushResult;
import com.rfidattendance.domain.model.SummaryRow;
import com.rfidattendance.domain.port.SpreadsheetPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publica el resumen de asistencia en la hoja de cálculo.
 * Las filas se leen en el hilo del llamador; el envío corre en un hilo aparte
 * con tiempo límite para que un destino lento no bloquee el motor.
 */
@Service
@Slf4j
public class SummaryPushService {

    private final ReportService reportService;
    private final SpreadsheetPort spreadsheetPort;
    private final long timeoutSeconds;
    private ExecutorService executor = newExecutor();

    public SummaryPushService(ReportService reportService, SpreadsheetPort spreadsheetPort,
                              AttendanceProperties properties) {
        this.reportService = reportService;
        this.spreadsheetPort = spreadsheetPort;
        this.timeoutSeconds = properties.getPushTimeoutSeconds();
    }

    /**
     * Envía el resumen actual. Nunca lanza: los fallos vuelven como resultado fallido.
     * Un envío que agota el tiempo se cancela y su hilo se descarta, de modo que
     * el siguiente envío no queda detrás de él.
     */
    public synchronized PushResult pushSummary() {
        List<SummaryRow> rows = List.copyOf(reportService.participantSummaries());
        log.info("Enviando resumen de {} participantes", rows.size());

        Future<PushResult> future = executor.submit(() -> spreadsheetPort.pushSummary(rows));
        try {
            PushResult result = future.get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("Resumen enviado: {}", result.getMessage());
            return result;
        } catch (TimeoutException e) {
            log.error("El envío del resumen superó {} s, se cancela", timeoutSeconds);
            future.cancel(true);
            replaceExecutor();
            return PushResult.failed("Tiempo de espera agotado tras " + timeoutSeconds + " s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Error enviando resumen: {}", cause.getMessage(), cause);
            return PushResult.failed("Error enviando resumen: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Envío del resumen interrumpido");
            return PushResult.failed("Envío del resumen interrumpido");
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        executor.shutdownNow();
    }

    private void replaceExecutor() {
        executor.shutdownNow();
        executor = newExecutor();
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "summary-push");
            thread.setDaemon(true);
            return thread;
        });
    }
}
