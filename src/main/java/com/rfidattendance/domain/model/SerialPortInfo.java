package com.rfidattendance.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Puerto serial donde puede estar conectado el lector de tarjetas.
 */
@Value
@Builder
public class SerialPortInfo {

    /** Nombre del sistema del puerto (ej: COM3, /dev/ttyUSB0) */
    String systemPortName;

    String descriptivePortName;

    /** Indica si el puerto está actualmente abierto */
    boolean open;
}
