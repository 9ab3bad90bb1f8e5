package com.rfidattendance.infrastructure.security;

import com.rfidattendance.application.config.AttendanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deriva y verifica la credencial del administrador.
 *
 * Formato actual: {@code iteraciones$saltHex$hashHex} (PBKDF2-HMAC-SHA256, sal
 * de 16 bytes, clave de 256 bits). Se siguen aceptando {@code saltHex$hashHex},
 * verificado con las iteraciones configuradas, y el SHA-256 sin sal en hexadecimal.
 */
@Component
@Slf4j
public class CredentialHasher {

    public static final char SEPARATOR = '$';

    private static final int SALT_BYTES = 16;
    private static final Pattern SALT_HEX = Pattern.compile("[0-9a-fA-F]{" + (SALT_BYTES * 2) + "}");
    private static final Pattern HASH_HEX = Pattern.compile("[0-9a-fA-F]{64}");
    private static final Pattern ITERATIONS = Pattern.compile("[1-9][0-9]{0,6}");

    private final Pbkdf2PasswordEncoder encoder;
    private final int iterations;

    @Autowired
    public CredentialHasher(AttendanceProperties properties) {
        this(properties.getCredentialIterations());
    }

    public CredentialHasher(int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Las iteraciones deben ser positivas: " + iterations);
        }
        this.iterations = iterations;
        this.encoder = encoderFor(iterations);
    }

    /**
     * Genera el valor a guardar para una credencial nueva.
     *
     * @param secret Credencial en claro, no vacía
     * @return Cadena {@code iteraciones$saltHex$hashHex}
     */
    public String hash(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("La credencial no puede estar vacía");
        }
        // El encoder devuelve hex(sal || hash)
        String encoded = encoder.encode(secret).toLowerCase(Locale.ROOT);
        return String.valueOf(iterations) + SEPARATOR + encoded.substring(0, SALT_BYTES * 2)
                + SEPARATOR + encoded.substring(SALT_BYTES * 2);
    }

    /**
     * Compara una credencial candidata con el valor guardado, en tiempo constante.
     * Un valor guardado mal formado nunca coincide.
     */
    public boolean matches(String candidate, String stored) {
        if (candidate == null || stored == null || stored.isBlank()) {
            return false;
        }
        String value = stored.trim();
        if (isLegacy(value)) {
            return matchesLegacy(candidate, value);
        }

        String[] parts = value.split("\\$", -1);
        Pbkdf2PasswordEncoder verifier = encoder;
        if (parts.length == 3) {
            if (!ITERATIONS.matcher(parts[0]).matches()) {
                log.warn("Credencial almacenada con iteraciones inválidas, se rechaza la verificación");
                return false;
            }
            int storedIterations = Integer.parseInt(parts[0]);
            if (storedIterations != iterations) {
                verifier = encoderFor(storedIterations);
            }
            parts = new String[] { parts[1], parts[2] };
        }
        if (parts.length != 2 || !SALT_HEX.matcher(parts[0]).matches() || !HASH_HEX.matcher(parts[1]).matches()) {
            log.warn("Credencial almacenada con formato inválido, se rechaza la verificación");
            return false;
        }
        try {
            return verifier.matches(candidate, parts[0] + parts[1]);
        } catch (IllegalArgumentException e) {
            log.warn("No se pudo decodificar la credencial almacenada: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Un valor sin separador es un hash SHA-256 antiguo (o basura).
     */
    public boolean isLegacy(String stored) {
        return stored != null && stored.indexOf(SEPARATOR) < 0;
    }

    /**
     * Indica si el valor guardado debe regenerarse en el formato actual:
     * SHA-256 antiguo o {@code saltHex$hashHex} sin iteraciones.
     */
    public boolean needsRehash(String stored) {
        if (stored == null) {
            return false;
        }
        String value = stored.trim();
        return isLegacy(value) || value.split("\\$", -1).length == 2;
    }

    /**
     * SHA-256 en hexadecimal, formato usado por versiones anteriores.
     */
    public static String legacyDigest(String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new String(Hex.encode(digest.digest(secret.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible en esta JVM", e);
        }
    }

    private static Pbkdf2PasswordEncoder encoderFor(int iterations) {
        // Sin secreto adicional: sólo la sal acompaña a la credencial
        return new Pbkdf2PasswordEncoder("", SALT_BYTES, iterations,
                SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    }

    private boolean matchesLegacy(String candidate, String stored) {
        if (!HASH_HEX.matcher(stored).matches()) {
            log.warn("Credencial antigua con formato inválido, se rechaza la verificación");
            return false;
        }
        byte[] expected = stored.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = legacyDigest(candidate).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
