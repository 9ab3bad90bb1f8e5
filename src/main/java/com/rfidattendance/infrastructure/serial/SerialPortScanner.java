package com.rfidattendance.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.rfidattendance.domain.model.SerialPortInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Escáner de puertos seriales usando jSerialComm.
 */
@Component
@Slf4j
public class SerialPortScanner {

    /**
     * Lista los puertos donde podría estar el lector.
     */
    public List<SerialPortInfo> getAvailablePorts() {
        SerialPort[] ports = SerialPort.getCommPorts();
        log.info("Escaneando puertos seriales. Encontrados: {}", ports.length);

        return Arrays.stream(ports)
                .map(port -> SerialPortInfo.builder()
                        .systemPortName(port.getSystemPortName())
                        .descriptivePortName(port.getDescriptivePortName())
                        .open(port.isOpen())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Busca un puerto por su nombre de sistema, sin distinguir mayúsculas.
     */
    public Optional<SerialPort> findPort(String portName) {
        Optional<SerialPort> port = Arrays.stream(SerialPort.getCommPorts())
                .filter(p -> p.getSystemPortName().equalsIgnoreCase(portName))
                .findFirst();
        if (port.isEmpty()) {
            log.warn("Puerto no encontrado: {}", portName);
        }
        return port;
    }
}
