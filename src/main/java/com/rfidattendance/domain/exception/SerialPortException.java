package com.rfidattendance.domain.exception;

/**
 * Excepción lanzada cuando el lector de tarjetas no se puede usar.
 */
public class SerialPortException extends RuntimeException {

    public SerialPortException(String message) {
        super(message);
    }

    /**
     * El puerto existe pero no se pudo abrir.
     */
    public static SerialPortException cannotOpen(String portName) {
        return new SerialPortException("No se puede abrir el lector en el puerto: " + portName);
    }

    /**
     * Excepción cuando el puerto no existe.
     */
    public static SerialPortException notFound(String portName) {
        return new SerialPortException("Puerto no encontrado: " + portName);
    }
}
