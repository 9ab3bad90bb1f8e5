package com.rfidattendance.domain.exception;

/**
 * Error al leer una planilla de inscritos o al escribir el resumen de asistencia.
 */
public class CsvProcessingException extends RuntimeException {

    private final String source;

    public CsvProcessingException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /** Archivo o nombre lógico de la planilla afectada */
    public String getSource() {
        return source;
    }

    public static CsvProcessingException cannotWrite(String target, Throwable cause) {
        return new CsvProcessingException(target, "No se pudo escribir el resumen en " + target, cause);
    }

    public static CsvProcessingException cannotRead(String source, Throwable cause) {
        return new CsvProcessingException(source, "No se pudo leer la planilla " + source, cause);
    }

    /**
     * La cabecera de la planilla no trae las columnas de nombre.
     */
    public static CsvProcessingException missingColumns(String source, String detail) {
        return new CsvProcessingException(source,
                String.format("La planilla %s no tiene las columnas requeridas: %s", source, detail), null);
    }
}
