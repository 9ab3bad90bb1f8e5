package com.rfidattendance.presentation.controller;

import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.exception.CsvProcessingException;
import com.rfidattendance.domain.exception.SerialPortException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Respuestas {success, message} comunes a todos los controladores.
 */
@Slf4j
final class ApiResponses {

    private ApiResponses() {
    }

    static Map<String, Object> success(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", message);
        return response;
    }

    static ResponseEntity<Map<String, Object>> ok(String message, String key, Object value) {
        Map<String, Object> response = success(message);
        response.put(key, value);
        return ResponseEntity.ok(response);
    }

    /**
     * Traduce una excepción del núcleo a su código HTTP.
     */
    static ResponseEntity<Map<String, Object>> failure(String action, Exception e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Error al {}: {}", action, e.getMessage(), e);
        } else {
            log.warn("No se pudo {}: {}", action, e.getMessage());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", "Error: " + e.getMessage());
        if (e instanceof AttendanceException) {
            response.put("kind", ((AttendanceException) e).getKind().name());
        }
        return ResponseEntity.status(status).body(response);
    }

    static HttpStatus statusOf(Exception e) {
        if (e instanceof AttendanceException) {
            return switch (((AttendanceException) e).getKind()) {
                case INVALID_TOKEN -> HttpStatus.BAD_REQUEST;
                case NOT_FOUND -> HttpStatus.NOT_FOUND;
                case UNIQUENESS_VIOLATION, REFERENTIAL_INTEGRITY -> HttpStatus.CONFLICT;
                case AUTH_LOCKOUT -> HttpStatus.LOCKED;
                case AUTH_REQUIRED -> HttpStatus.UNAUTHORIZED;
                case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            };
        }
        if (e instanceof IllegalStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof IllegalArgumentException
                || e instanceof SerialPortException
                || e instanceof CsvProcessingException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
