package com.musicbox.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.musicbox.domain.model.SerialPortInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Escáner de puertos seriales usando jSerialComm.
 */
@Component
@ConditionalOnProperty(name = "nfc.hardware", havingValue = "serial")
@Slf4j
public class SerialPortScanner {

    /**
     * Obtiene la lista de puertos seriales disponibles en el sistema.
     * 
     * @return Lista de información de puertos
     */
    public List<SerialPortInfo> getAvailablePorts() {
        SerialPort[] ports = SerialPort.getCommPorts();

        log.debug("Escaneando puertos seriales. Encontrados: {}", ports.length);

        return Arrays.stream(ports)
                .map(this::toSerialPortInfo)
                .collect(Collectors.toList());
    }

    /**
     * Busca un puerto por su nombre de sistema.
     * 
     * @param portName Nombre del puerto (ej: /dev/ttyUSB0)
     * @return SerialPort si existe, null si no
     */
    public SerialPort findPort(String portName) {
        for (SerialPort port : SerialPort.getCommPorts()) {
            if (port.getSystemPortName().equalsIgnoreCase(portName)
                    || port.getSystemPortPath().equalsIgnoreCase(portName)) {
                return port;
            }
        }

        log.warn("Puerto no encontrado: {}", portName);
        return null;
    }

    private SerialPortInfo toSerialPortInfo(SerialPort port) {
        return SerialPortInfo.builder()
                .systemPortName(port.getSystemPortName())
                .descriptivePortName(port.getDescriptivePortName())
                .open(port.isOpen())
                .build();
    }
}
