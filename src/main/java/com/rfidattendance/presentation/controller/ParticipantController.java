package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.ParticipantDto;
import com.rfidattendance.application.service.RegistrationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registro y consulta de participantes desde el puesto de entrada.
 * Las modificaciones destructivas están en {@link AdminController}.
 */
@RestController
@RequestMapping("/api/participants")
@RequiredArgsConstructor
@Slf4j
public class ParticipantController {

    private final RegistrationService registrationService;

    @GetMapping
    public ResponseEntity<List<ParticipantDto>> getAll() {
        return ResponseEntity.ok(registrationService.getAllParticipants());
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getCount() {
        Map<String, Long> response = new HashMap<>();
        response.put("count", registrationService.getParticipantCount());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getOne(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(registrationService.getParticipant(id));
        } catch (Exception e) {
            return ApiResponses.failure("consultar participante", e);
        }
    }

    /**
     * Busca el participante que tiene asignado el token.
     */
    @GetMapping("/by-token/{token}")
    public ResponseEntity<?> getByToken(@PathVariable String token) {
        try {
            return registrationService.findByToken(token.trim())
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            return ApiResponses.failure("buscar participante", e);
        }
    }

    /**
     * Registra un participante nuevo, normalmente tras un toque con token desconocido.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegisterRequest request) {
        try {
            log.info("Registrando participante: {} - {}", request.token(), request.displayName());
            if (request.displayName() == null || request.displayName().isBlank()) {
                throw new IllegalArgumentException("El nombre es requerido");
            }
            ParticipantDto participant = registrationService.register(
                    request.displayName(), request.token(), request.groupIds());
            return ApiResponses.ok("Participante registrado exitosamente", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("registrar participante", e);
        }
    }

    /**
     * Inscribe al participante en más grupos.
     */
    @PostMapping("/{id}/groups")
    public ResponseEntity<Map<String, Object>> assignGroups(@PathVariable Long id,
                                                            @RequestBody GroupsRequest request) {
        try {
            ParticipantDto participant = registrationService.assignGroups(id, request.groupIds());
            return ApiResponses.ok("Grupos asignados", "participant", participant);
        } catch (Exception e) {
            return ApiResponses.failure("asignar grupos", e);
        }
    }

    public record RegisterRequest(String displayName, String token, List<Long> groupIds) {
    }

    public record GroupsRequest(List<Long> groupIds) {
    }
}
