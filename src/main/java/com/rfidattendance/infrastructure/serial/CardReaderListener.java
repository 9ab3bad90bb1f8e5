package com.rfidattendance.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.rfidattendance.domain.exception.SerialPortException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escucha el lector de tarjetas por puerto serial.
 * Cada línea que trae un número se entrega al callback en el hilo lector,
 * que es el único que produce toques desde el hardware.
 */
@Component
@Slf4j
public class CardReaderListener {

    // "0012345678", "CARD:0012345678" o "UID: 0012345678"
    private static final Pattern TOKEN_PATTERN = Pattern.compile("^\\s*(?:[A-Za-z]+\\s*:)?\\s*([0-9]+)\\s*$");

    @Value("${serial.baud-rate:9600}")
    private int baudRate;

    @Value("${serial.data-bits:8}")
    private int dataBits;

    @Value("${serial.stop-bits:1}")
    private int stopBits;

    @Value("${serial.parity:0}")
    private int parity;

    private final SerialPortScanner portScanner;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "card-reader");
        thread.setDaemon(true);
        return thread;
    });

    private volatile SerialPort currentPort;
    private volatile Consumer<String> tokenCallback;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CardReaderListener(SerialPortScanner portScanner) {
        this.portScanner = portScanner;
    }

    /**
     * Abre el puerto y empieza a leer tarjetas.
     *
     * @param portName        Nombre del puerto (ej: COM3)
     * @param onTokenReceived Callback con cada token leído
     * @throws SerialPortException si el puerto no existe o no se puede abrir
     */
    public synchronized void start(String portName, Consumer<String> onTokenReceived) {
        if (running.get()) {
            log.warn("El lector ya está escuchando. Deteniendo primero...");
            stop();
        }

        SerialPort port = portScanner.findPort(portName)
                .orElseThrow(() -> SerialPortException.notFound(portName));
        port.setBaudRate(baudRate);
        port.setNumDataBits(dataBits);
        port.setNumStopBits(stopBits);
        port.setParity(parity);
        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, 0, 0);

        if (!port.openPort()) {
            throw SerialPortException.cannotOpen(portName);
        }

        this.tokenCallback = onTokenReceived;
        this.currentPort = port;
        running.set(true);
        log.info("Lector abierto en {} a {} baudios", portName, baudRate);

        executor.submit(this::readLoop);
    }

    /**
     * Detiene la escucha y cierra el puerto.
     */
    public synchronized void stop() {
        running.set(false);
        SerialPort port = currentPort;
        if (port != null && port.isOpen()) {
            port.closePort();
            log.info("Puerto {} cerrado", port.getSystemPortName());
        }
        currentPort = null;
    }

    public boolean isRunning() {
        SerialPort port = currentPort;
        return running.get() && port != null && port.isOpen();
    }

    public String getCurrentPortName() {
        SerialPort port = currentPort;
        return port != null ? port.getSystemPortName() : null;
    }

    /**
     * Envía al lector la señal de aceptado ('1') o rechazado ('0').
     * Lectores sin indicador la ignoran.
     */
    public void sendFeedback(boolean accepted) {
        SerialPort port = currentPort;
        if (port == null || !port.isOpen()) {
            return;
        }
        byte[] data = new byte[] { (byte) (accepted ? '1' : '0'), (byte) '\n' };
        if (port.writeBytes(data, data.length) <= 0) {
            log.warn("No se pudo enviar la señal al lector");
        }
    }

    /**
     * Extrae el token de una línea recibida del lector.
     *
     * @return Dígitos leídos, vacío si la línea no es una lectura
     */
    static Optional<String> extractToken(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = TOKEN_PATTERN.matcher(line);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private void readLoop() {
        log.info("Iniciando loop de lectura del lector...");
        SerialPort port = currentPort;
        if (port == null) {
            return;
        }

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(port.getInputStream(), StandardCharsets.US_ASCII))) {
            String line;
            while (running.get() && port.isOpen() && (line = reader.readLine()) != null) {
                processLine(line);
            }
        } catch (IOException e) {
            if (running.get()) {
                log.error("Error leyendo del lector: {}", e.getMessage(), e);
            }
        }

        log.info("Loop de lectura finalizado");
    }

    private void processLine(String line) {
        Optional<String> token = extractToken(line);
        if (token.isEmpty()) {
            log.debug("Línea ignorada del lector: [{}]", line);
            return;
        }

        Consumer<String> callback = tokenCallback;
        if (callback == null) {
            return;
        }
        try {
            callback.accept(token.get());
        } catch (RuntimeException e) {
            // Un toque fallido no debe detener el lector
            log.error("Error procesando token {}: {}", token.get(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void cleanup() {
        log.info("Liberando recursos del lector de tarjetas...");
        stop();
        executor.shutdown();
    }
}
