package com.rfidattendance.application.service;

import com.rfidattendance.application.config.AttendanceProperties;
import com.rfidattendance.domain.model.OperatorSettings;
import com.rfidattendance.domain.port.SettingsStore;
import com.rfidattendance.infrastructure.persistence.StoreTransactions;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;

/**
 * Mantiene una instantánea inmutable de los ajustes del operador.
 * Se carga al arrancar y se reemplaza completa en cada cambio.
 */
@Service
@Slf4j
public class SettingsService {

    public static final String ADMIN_CREDENTIAL = "admin_credential";
    public static final String INACTIVITY_THRESHOLD = "inactivity_threshold";
    public static final String LANGUAGE = "language";
    public static final String ROSTER_IMPORT_MIN_SESSIONS = "roster_import_min_sessions";

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of("en", "es");

    private final SettingsStore settingsStore;
    private final StoreTransactions transactions;
    private final AttendanceProperties properties;

    private volatile OperatorSettings current;

    public SettingsService(SettingsStore settingsStore, StoreTransactions transactions,
                           AttendanceProperties properties) {
        this.settingsStore = settingsStore;
        this.transactions = transactions;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Vuelve a leer la tabla settings.
     */
    public OperatorSettings reload() {
        Map<String, String> values = transactions.execute("cargar ajustes", settingsStore::loadAll);
        current = OperatorSettings.builder()
                .adminCredential(values.getOrDefault(ADMIN_CREDENTIAL, ""))
                .inactivityThreshold(parseNonNegative(values.get(INACTIVITY_THRESHOLD),
                        properties.getDefaultInactivityThreshold(), INACTIVITY_THRESHOLD))
                .language(values.getOrDefault(LANGUAGE, "en"))
                .rosterImportMinSessions(parseNonNegative(values.get(ROSTER_IMPORT_MIN_SESSIONS), 1,
                        ROSTER_IMPORT_MIN_SESSIONS))
                .build();
        log.info("Ajustes cargados: umbral de inactividad={}, idioma={}, credencial configurada={}",
                current.getInactivityThreshold(), current.getLanguage(), current.isCredentialConfigured());
        return current;
    }

    public OperatorSettings current() {
        return current;
    }

    public synchronized OperatorSettings updateInactivityThreshold(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("El umbral de inactividad no puede ser negativo: " + threshold);
        }
        persist(INACTIVITY_THRESHOLD, String.valueOf(threshold));
        current = current.toBuilder().inactivityThreshold(threshold).build();
        log.info("Umbral de inactividad actualizado a {}", threshold);
        return current;
    }

    public synchronized OperatorSettings updateLanguage(String language) {
        String normalized = language == null ? "" : language.trim().toLowerCase();
        if (!SUPPORTED_LANGUAGES.contains(normalized)) {
            throw new IllegalArgumentException("Idioma no soportado: " + language);
        }
        persist(LANGUAGE, normalized);
        current = current.toBuilder().language(normalized).build();
        return current;
    }

    public synchronized OperatorSettings updateRosterImportMinSessions(int minSessions) {
        if (minSessions < 0) {
            throw new IllegalArgumentException("El mínimo de sesiones no puede ser negativo: " + minSessions);
        }
        persist(ROSTER_IMPORT_MIN_SESSIONS, String.valueOf(minSessions));
        current = current.toBuilder().rosterImportMinSessions(minSessions).build();
        return current;
    }

    /**
     * Guarda el hash de la credencial. Sólo lo usa el autenticador.
     */
    synchronized void storeCredential(String hashed) {
        persist(ADMIN_CREDENTIAL, hashed);
        current = current.toBuilder().adminCredential(hashed).build();
    }

    private void persist(String key, String value) {
        transactions.run("guardar ajuste " + key, () -> settingsStore.save(key, value));
    }

    private int parseNonNegative(String raw, int fallback, String key) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            log.warn("Valor no numérico en ajuste {}: '{}'", key, raw);
            return fallback;
        }
        log.warn("Valor negativo en ajuste {}: '{}', se usa {}", key, raw, fallback);
        return fallback;
    }
}
