package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.infrastructure.persistence.entity.SettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repositorio JPA para la tabla settings.
 */
@Repository
public interface JpaSettingRepository extends JpaRepository<SettingEntity, String> {
}
