package com.rfidattendance.presentation.controller;

import com.rfidattendance.application.dto.GroupDto;
import com.rfidattendance.application.service.GroupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Consulta de grupos, inscritos y sesiones.
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @GetMapping
    public ResponseEntity<List<GroupDto>> getAll() {
        return ResponseEntity.ok(groupService.getAllGroups());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getOne(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(groupService.getGroup(id));
        } catch (Exception e) {
            return ApiResponses.failure("consultar grupo", e);
        }
    }

    @GetMapping("/{id}/members")
    public ResponseEntity<?> getMembers(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(groupService.getMembers(id));
        } catch (Exception e) {
            return ApiResponses.failure("listar inscritos", e);
        }
    }

    @GetMapping("/{id}/sessions")
    public ResponseEntity<?> getSessions(@PathVariable Long id) {
        try {
            return ResponseEntity.ok(groupService.getSessions(id));
        } catch (Exception e) {
            return ApiResponses.failure("listar sesiones", e);
        }
    }
}
