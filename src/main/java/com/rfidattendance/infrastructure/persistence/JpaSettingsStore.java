package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.domain.port.SettingsStore;
import com.rfidattendance.infrastructure.persistence.entity.SettingEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementación del puerto SettingsStore usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSettingsStore implements SettingsStore {

    private final JpaSettingRepository settingRepository;

    @Override
    @Transactional(readOnly = true)
    public Map<String, String> loadAll() {
        Map<String, String> values = new LinkedHashMap<>();
        settingRepository.findAll().forEach(s -> values.put(s.getKey(), s.getValue()));
        return values;
    }

    @Override
    @Transactional
    public void save(String key, String value) {
        settingRepository.saveAndFlush(new SettingEntity(key, value == null ? "" : value));
        log.debug("Ajuste guardado: {}", key);
    }
}
