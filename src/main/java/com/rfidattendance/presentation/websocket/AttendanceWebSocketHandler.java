package com.rfidattendance.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfidattendance.application.dto.SessionSummaryDto;
import com.rfidattendance.application.dto.TapResultDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Handler de WebSocket que publica toques y eventos de sesión en tiempo real.
 */
@Component
@Slf4j
public class AttendanceWebSocketHandler extends TextWebSocketHandler {

    private final CopyOnWriteArraySet<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    /**
     * Publica el resultado de un toque.
     */
    public void broadcastTapResult(TapResultDto result) {
        broadcast("TAP_RESULT", result);
    }

    /**
     * Publica el estado del lector serial.
     */
    public void broadcastReaderStatus(boolean active, String message) {
        broadcast("READER_STATUS", new ReaderStatus(active, message));
    }

    public void broadcastSessionClosed(SessionSummaryDto summary) {
        broadcast("SESSION_CLOSED", summary);
    }

    public void broadcastMaintenanceStarted(String startTime) {
        broadcast("MAINTENANCE_STARTED", new MaintenanceStarted(startTime));
    }

    /**
     * Notifica el fin del mantenimiento nocturno.
     */
    public void broadcastMaintenanceCompleted(int sessionsClosed, int newlyInactive, int reactivated,
                                              boolean success, String completedTime) {
        broadcast("MAINTENANCE_COMPLETED",
                new MaintenanceCompleted(sessionsClosed, newlyInactive, reactivated, success, completedTime));
    }

    /**
     * Obtiene el número de clientes conectados.
     */
    public int getConnectedClients() {
        return sessions.size();
    }

    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(new WebSocketMessage(type, data)));
        } catch (JsonProcessingException e) {
            log.error("Error creando mensaje JSON {}: {}", type, e.getMessage());
            return;
        }

        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                continue;
            }
            try {
                // Una sesión de WebSocket no admite envíos concurrentes
                synchronized (session) {
                    session.sendMessage(message);
                }
            } catch (IOException e) {
                log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                sessions.remove(session);
            }
        }
        log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());
    }

    record WebSocketMessage(String type, Object data) {
    }

    record ReaderStatus(boolean active, String message) {
    }

    record MaintenanceStarted(String startTime) {
    }

    record MaintenanceCompleted(int sessionsClosed, int newlyInactive, int reactivated,
                                boolean success, String completedTime) {
    }
}
