package com.rfidattendance.presentation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfidattendance.application.service.Authenticator;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.exception.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rechaza las rutas administrativas mientras no haya una sesión administrativa
 * desbloqueada: 401 sin sesión, 423 con el flujo bloqueado por intentos fallidos.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAccessInterceptor implements HandlerInterceptor {

    private final Authenticator authenticator;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        try {
            authenticator.requireUnlocked();
            return true;
        } catch (AttendanceException e) {
            log.warn("Acceso administrativo denegado ({}): {} {}", e.getKind(), request.getMethod(),
                    request.getRequestURI());
            reject(response, e);
            return false;
        }
    }

    private void reject(HttpServletResponse response, AttendanceException e) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("kind", e.getKind().name());
        body.put("message", e.getMessage());

        HttpStatus status = e.getKind() == ErrorKind.AUTH_LOCKOUT ? HttpStatus.LOCKED : HttpStatus.UNAUTHORIZED;
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
