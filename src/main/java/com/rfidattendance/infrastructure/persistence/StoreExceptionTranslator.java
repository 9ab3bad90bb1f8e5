package com.rfidattendance.infrastructure.persistence;

import com.rfidattendance.domain.exception.AttendanceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Locale;

/**
 * Traduce las excepciones de Spring/JDBC a {@link AttendanceException}.
 * Las excepciones del dominio y los argumentos inválidos pasan sin cambios.
 */
@Component
@Slf4j
public class StoreExceptionTranslator {

    /**
     * @param operation Nombre de la operación, para el mensaje
     * @param ex        Excepción capturada en la frontera
     * @return La excepción que debe propagarse
     */
    public RuntimeException translate(String operation, RuntimeException ex) {
        if (ex instanceof AttendanceException || ex instanceof IllegalArgumentException) {
            return ex;
        }
        if (ex instanceof DataIntegrityViolationException) {
            String detail = mostSpecificMessage(ex);
            if (isUniquenessViolation(detail)) {
                log.warn("Violación de unicidad en {}: {}", operation, detail);
                return AttendanceException.uniquenessViolation(detail, ex);
            }
            log.warn("Violación de integridad referencial en {}: {}", operation, detail);
            return AttendanceException.referentialIntegrity(detail, ex);
        }
        if (ex instanceof DataAccessException || ex instanceof TransactionException) {
            log.error("Base de datos no disponible en {}", operation, ex);
            return AttendanceException.storeUnavailable(operation, ex);
        }
        return ex;
    }

    private boolean isUniquenessViolation(String detail) {
        String upper = detail.toUpperCase(Locale.ROOT);
        return upper.contains("UNIQUE") || upper.contains("PRIMARY KEY") || upper.contains("PRIMARYKEY");
    }

    private String mostSpecificMessage(RuntimeException ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : ex.getMessage();
        return message != null ? message : ex.getClass().getSimpleName();
    }
}
