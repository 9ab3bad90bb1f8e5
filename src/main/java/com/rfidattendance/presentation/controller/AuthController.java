package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.service.Authenticator;
import com.rfidattendance.domain.model.AuthResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Flujo de acceso administrativo.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final Authenticator authenticator;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> response = new HashMap<>();
        response.put("configured", authenticator.isCredentialConfigured());
        response.put("unlocked", authenticator.isUnlocked());
        response.put("remainingAttempts", authenticator.getRemainingAttempts());
        return ResponseEntity.ok(response);
    }

    /**
     * Abre un nuevo flujo: contador a cero y sesión cerrada.
     */
    @PostMapping("/restart")
    public ResponseEntity<Map<String, Object>> restart() {
        authenticator.restartFlow();
        return ResponseEntity.ok(ApiResponses.success("Flujo reiniciado"));
    }

    @PostMapping("/verify")
    public ResponseEntity<Map<String, Object>> verify(@RequestBody CredentialRequest request) {
        try {
            return toResponse(authenticator.verify(request.credential()), "Acceso concedido");
        } catch (Exception e) {
            return ApiResponses.failure("verificar credencial", e);
        }
    }

    @PostMapping("/lock")
    public ResponseEntity<Map<String, Object>> lock() {
        authenticator.lock();
        return ResponseEntity.ok(ApiResponses.success("Sesión administrativa cerrada"));
    }

    @PostMapping("/change")
    public ResponseEntity<Map<String, Object>> change(@RequestBody ChangeRequest request) {
        try {
            return toResponse(authenticator.changeCredential(request.current(), request.replacement()),
                    "Credencial cambiada");
        } catch (Exception e) {
            return ApiResponses.failure("cambiar credencial", e);
        }
    }

    /**
     * Primera configuración de la credencial.
     */
    @PostMapping("/setup")
    public ResponseEntity<Map<String, Object>> setup(@RequestBody CredentialRequest request) {
        try {
            authenticator.configureInitialCredential(request.credential());
            return ResponseEntity.ok(ApiResponses.success("Credencial configurada"));
        } catch (Exception e) {
            return ApiResponses.failure("configurar credencial", e);
        }
    }

    private ResponseEntity<Map<String, Object>> toResponse(AuthResult result, String grantedMessage) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", result.isGranted());
        response.put("result", result.name());
        response.put("remainingAttempts", authenticator.getRemainingAttempts());
        switch (result) {
            case GRANTED -> {
                response.put("message", grantedMessage);
                return ResponseEntity.ok(response);
            }
            case LOCKED_OUT -> {
                response.put("message", "Demasiados intentos. Reinicie el flujo.");
                return ResponseEntity.status(HttpStatus.LOCKED).body(response);
            }
            default -> {
                response.put("message", "Credencial incorrecta");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
            }
        }
    }

    public record CredentialRequest(String credential) {
    }

    public record ChangeRequest(String current, String replacement) {
    }
}
