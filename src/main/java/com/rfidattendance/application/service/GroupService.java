package com.rfidattendance.application.service;

import com.rfidattendance.application.dto.GroupDto;
import com.rfidattendance.application.dto.ParticipantDto;
import com.rfidattendance.application.dto.SessionDto;
import com.rfidattendance.domain.model.ClassGroup;
import com.rfidattendance.domain.port.AttendanceStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Alta, edición y borrado de grupos.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupService {

    private final AttendanceStore store;
    private final StoreTransactions transactions;

    public List<GroupDto> getAllGroups() {
        return transactions.execute("listar grupos", () -> store.listGroups().stream()
                .map(GroupDto::fromDomain)
                .collect(Collectors.toList()));
    }

    public GroupDto getGroup(Long groupId) {
        return transactions.execute("consultar grupo", () -> GroupDto.fromDomain(store.requireGroup(groupId)));
    }

    public GroupDto createGroup(ClassGroup draft) {
        ClassGroup created = transactions.execute("crear grupo", () -> store.createGroup(draft));
        return GroupDto.fromDomain(created);
    }

    public GroupDto updateGroup(ClassGroup group) {
        ClassGroup updated = transactions.execute("actualizar grupo", () -> store.updateGroup(group));
        log.info("Grupo {} actualizado", updated.getId());
        return GroupDto.fromDomain(updated);
    }

    /**
     * Borra el grupo con sus sesiones, registros e inscripciones.
     */
    public void deleteGroup(Long groupId) {
        log.info("Eliminando grupo: {}", groupId);
        transactions.run("eliminar grupo", () -> store.deleteGroup(groupId));
    }

    public List<ParticipantDto> getMembers(Long groupId) {
        return transactions.execute("listar inscritos", () -> {
            store.requireGroup(groupId);
            return store.enrolledParticipants(groupId).stream()
                    .map(ParticipantDto::fromDomain)
                    .collect(Collectors.toList());
        });
    }

    public List<SessionDto> getSessions(Long groupId) {
        return transactions.execute("listar sesiones", () -> {
            store.requireGroup(groupId);
            return store.sessionsForGroups(List.of(groupId)).stream()
                    .map(SessionDto::fromDomain)
                    .collect(Collectors.toList());
        });
    }
}
