package com.rfidattendance.application.service;

import com.rfidattendance.application.config.AttendanceProperties;
import com.rfidattendance.domain.exception.AttendanceException;
import com.rfidattendance.domain.model.AuthResult;
import com.rfidattendance.infrastructure.security.CredentialHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifica la credencial del administrador con bloqueo por intentos fallidos.
 *
 * El contador de fallos vive sólo en memoria: al llegar al máximo toda
 * verificación devuelve LOCKED_OUT, incluso con la credencial correcta,
 * hasta que se llama a {@link #restartFlow()}.
 */
@Service
@Slf4j
public class Authenticator {

    private final SettingsService settingsService;
    private final CredentialHasher hasher;
    private final int maxFailedAttempts;

    private int failedAttempts;
    private boolean unlocked;

    public Authenticator(SettingsService settingsService, CredentialHasher hasher,
                         AttendanceProperties properties) {
        this.settingsService = settingsService;
        this.hasher = hasher;
        this.maxFailedAttempts = properties.getMaxFailedAttempts();
    }

    /**
     * Verifica una credencial candidata.
     *
     * @param candidate Credencial introducida
     * @return GRANTED, DENIED o LOCKED_OUT
     */
    public synchronized AuthResult verify(String candidate) {
        if (failedAttempts >= maxFailedAttempts) {
            log.warn("Verificación rechazada: flujo bloqueado tras {} intentos", failedAttempts);
            return AuthResult.LOCKED_OUT;
        }

        String stored = settingsService.current().getAdminCredential();
        if (candidate != null && hasher.matches(candidate, stored)) {
            failedAttempts = 0;
            unlocked = true;
            upgradeIfLegacy(candidate, stored);
            log.info("Acceso administrativo concedido");
            return AuthResult.GRANTED;
        }

        failedAttempts++;
        log.warn("Credencial incorrecta ({}/{})", failedAttempts, maxFailedAttempts);
        return AuthResult.DENIED;
    }

    /**
     * Cambia la credencial tras verificar la actual con el mismo contador.
     *
     * @return Resultado de verificar la credencial actual
     */
    public synchronized AuthResult changeCredential(String current, String replacement) {
        if (replacement == null || replacement.isBlank()) {
            throw new IllegalArgumentException("La nueva credencial no puede estar vacía");
        }
        AuthResult result = verify(current);
        if (result.isGranted()) {
            settingsService.storeCredential(hasher.hash(replacement));
            log.info("Credencial de administrador cambiada");
        }
        return result;
    }

    /**
     * Configura la primera credencial. Sólo se permite si no hay ninguna guardada.
     *
     * @throws IllegalStateException si ya existe una credencial
     */
    public synchronized void configureInitialCredential(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("La credencial no puede estar vacía");
        }
        if (settingsService.current().isCredentialConfigured()) {
            throw new IllegalStateException("La credencial ya está configurada");
        }
        settingsService.storeCredential(hasher.hash(credential));
        failedAttempts = 0;
        unlocked = true;
        log.info("Credencial inicial de administrador configurada");
    }

    /**
     * Reinicia el flujo de autenticación: contador a cero y sesión bloqueada.
     */
    public synchronized void restartFlow() {
        failedAttempts = 0;
        unlocked = false;
        log.info("Flujo de autenticación reiniciado");
    }

    /**
     * Termina la sesión administrativa.
     */
    public synchronized void lock() {
        unlocked = false;
    }

    public synchronized boolean isUnlocked() {
        return unlocked;
    }

    public synchronized boolean isCredentialConfigured() {
        return settingsService.current().isCredentialConfigured();
    }

    public synchronized int getRemainingAttempts() {
        return Math.max(0, maxFailedAttempts - failedAttempts);
    }

    /**
     * Exige una sesión administrativa abierta.
     *
     * @throws AttendanceException AUTH_LOCKOUT si el flujo está bloqueado por intentos
     *                             fallidos, AUTH_REQUIRED si simplemente no hay sesión
     */
    public synchronized void requireUnlocked() {
        if (unlocked) {
            return;
        }
        if (failedAttempts >= maxFailedAttempts) {
            throw AttendanceException.lockedOut();
        }
        throw AttendanceException.authRequired();
    }

    private void upgradeIfLegacy(String candidate, String stored) {
        if (!hasher.needsRehash(stored)) {
            return;
        }
        try {
            settingsService.storeCredential(hasher.hash(candidate));
            log.info("Credencial antigua actualizada al formato actual");
        } catch (AttendanceException e) {
            // La verificación ya fue correcta; se reintenta en el próximo acceso
            log.error("No se pudo actualizar la credencial antigua: {}", e.getMessage(), e);
        }
    }
}
