package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.ReaderStatusDto;
import com.rfidattendance.application.dto.TapResultDto;
import com.rfidattendance.domain.model.SerialPortInfo;
import com.rfidattendance.domain.model.TapOutcome;
import com.rfidattendance.domain.model.TapOutcomeType;
import com.rfidattendance.infrastructure.serial.CardReaderListener;
import com.rfidattendance.infrastructure.serial.SerialPortScanner;
import com.rfidattendance.presentation.websocket.AttendanceWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Implementación de la captura de toques.
 * Coordina el lector serial, el resolvedor y las notificaciones en tiempo real.
 */
@Service
@Slf4j
public class TapCaptureServiceImpl implements TapCaptureService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final SerialPortScanner portScanner;
    private final CardReaderListener readerListener;
    private final TapResolver tapResolver;
    private final AttendanceWebSocketHandler webSocketHandler;
    private final Clock clock;

    // Historial en memoria para la pantalla (thread-safe)
    private final CopyOnWriteArrayList<TapResultDto> todayResults = new CopyOnWriteArrayList<>();
    private final AtomicLong tapCount = new AtomicLong();

    private volatile LocalDate resultsDate;
    private volatile LocalDateTime captureStartedAt;

    public TapCaptureServiceImpl(
            SerialPortScanner portScanner,
            CardReaderListener readerListener,
            TapResolver tapResolver,
            AttendanceWebSocketHandler webSocketHandler,
            Clock clock) {
        this.portScanner = portScanner;
        this.readerListener = readerListener;
        this.tapResolver = tapResolver;
        this.webSocketHandler = webSocketHandler;
        this.clock = clock;
    }

    @Override
    public List<SerialPortInfo> getAvailablePorts() {
        return portScanner.getAvailablePorts();
    }

    @Override
    public synchronized void startCapture(String portName) {
        if (readerListener.isRunning()) {
            throw new IllegalStateException("El lector ya está activo. Deténgalo primero.");
        }

        log.info("Iniciando captura en puerto {}", portName);
        readerListener.start(portName, this::onReaderToken);
        captureStartedAt = LocalDateTime.now(clock);
        tapCount.set(0);
        webSocketHandler.broadcastReaderStatus(true, "Lector activo en " + portName);
    }

    @Override
    public synchronized void stopCapture() {
        if (!readerListener.isRunning()) {
            log.warn("No hay captura activa para detener");
            return;
        }

        readerListener.stop();
        captureStartedAt = null;
        webSocketHandler.broadcastReaderStatus(false, "Lector detenido");
        log.info("Captura detenida. Total toques: {}", tapCount.get());
    }

    @Override
    public ReaderStatusDto getReaderStatus() {
        LocalDateTime startedAt = captureStartedAt;
        if (!readerListener.isRunning() || startedAt == null) {
            return ReaderStatusDto.inactive();
        }
        return ReaderStatusDto.builder()
                .active(true)
                .portName(readerListener.getCurrentPortName())
                .startTime(startedAt.format(TIME_FORMAT))
                .tapCount(tapCount.get())
                .statusMessage("Esperando tarjetas...")
                .build();
    }

    @Override
    public TapResultDto processIncomingToken(String token) {
        TapOutcome outcome = tapResolver.resolveTap(token);
        LocalDateTime now = LocalDateTime.now(clock);
        TapResultDto result = TapResultDto.fromDomain(outcome, now);

        rollOverIfNewDay(now.toLocalDate());
        todayResults.add(result);
        tapCount.incrementAndGet();
        webSocketHandler.broadcastTapResult(result);
        return result;
    }

    @Override
    public List<TapResultDto> getLatestResults(int limit) {
        List<TapResultDto> snapshot = new ArrayList<>(todayResults);
        int fromIndex = Math.max(0, snapshot.size() - Math.max(0, limit));
        List<TapResultDto> latest = new ArrayList<>(snapshot.subList(fromIndex, snapshot.size()));
        Collections.reverse(latest);
        return latest;
    }

    @Override
    public DayStatsDto getDayStats() {
        List<TapResultDto> snapshot = new ArrayList<>(todayResults);
        long recorded = countOf(snapshot, TapOutcomeType.RECORDED);
        long duplicates = countOf(snapshot, TapOutcomeType.DUPLICATE);
        String lastTap = snapshot.isEmpty() ? "--:--:--" : snapshot.get(snapshot.size() - 1).getTime();
        return new DayStatsDto(snapshot.size(), recorded, duplicates,
                snapshot.size() - recorded - duplicates, lastTap);
    }

    /**
     * Callback del hilo lector.
     */
    private void onReaderToken(String token) {
        TapResultDto result = processIncomingToken(token);
        boolean accepted = TapOutcomeType.RECORDED.name().equals(result.getType())
                || TapOutcomeType.DUPLICATE.name().equals(result.getType());
        readerListener.sendFeedback(accepted);
    }

    private synchronized void rollOverIfNewDay(LocalDate today) {
        if (!today.equals(resultsDate)) {
            todayResults.clear();
            resultsDate = today;
        }
    }

    private long countOf(List<TapResultDto> results, TapOutcomeType type) {
        return results.stream().filter(r -> type.name().equals(r.getType())).count();
    }
}
