package com.rfidattendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RFID Attendance - Aplicación Principal
 *
 * Control de asistencia por tarjeta:
 * - Lectura de tarjetas RFID via lector serial o API
 * - Sesiones por grupo y día creadas bajo demanda
 * - Marcado de inactivos por ausencias consecutivas
 * - Acceso administrativo protegido por credencial con bloqueo
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class RfidAttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RfidAttendanceApplication.class, args);
    }
}
