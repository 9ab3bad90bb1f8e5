package com.rfidattendance.presentation.config;

import com.rfidattendance.presentation.websocket.AttendanceWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Publica el canal de eventos de asistencia para la pantalla de la sala.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String ATTENDANCE_PATH = "/ws/attendance";

    private final AttendanceWebSocketHandler attendanceWebSocketHandler;

    @Value("${websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(attendanceWebSocketHandler, ATTENDANCE_PATH)
                .setAllowedOrigins(allowedOrigins);
    }
}
