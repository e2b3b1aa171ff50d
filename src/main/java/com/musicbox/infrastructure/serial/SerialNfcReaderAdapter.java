package com.musicbox.infrastructure.serial;

import com.fazecast.jSerialComm.SerialPort;
import com.musicbox.domain.exception.HardwareException;
import com.musicbox.domain.port.NfcHardwareAdapter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lector NFC conectado por puerto serial (Arduino/PN532 o similar).
 * El firmware envía una línea {@code UID:XX XX XX XX} por cada tag leído y
 * {@code REMOVED} cuando el tag se retira.
 * La lectura corre en un hilo propio; los callbacks se invocan en ese hilo.
 */
@Component
@ConditionalOnProperty(name = "nfc.hardware", havingValue = "serial")
@Slf4j
public class SerialNfcReaderAdapter implements NfcHardwareAdapter {

    // Patrón para parsear UID: "UID:XX-XX-XX-XX" o "UID: XX XX XX XX"
    private static final Pattern UID_PATTERN = Pattern.compile("UID:?\\s*([A-Fa-f0-9:\\s\\-]+)");
    private static final String REMOVED_MARKER = "REMOVED";

    @Value("${serial.port-name:}")
    private String portName;

    @Value("${serial.baud-rate:115200}")
    private int baudRate;

    @Value("${serial.data-bits:8}")
    private int dataBits;

    @Value("${serial.stop-bits:1}")
    private int stopBits;

    @Value("${serial.parity:0}")
    private int parity;

    private final SerialPortScanner portScanner;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(
            new CustomizableThreadFactory("nfc-serial-"));

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile SerialPort currentPort;
    private volatile Consumer<String> tagDetectedCallback;
    private volatile Runnable tagRemovedCallback;
    private volatile String lastError;

    public SerialNfcReaderAdapter(SerialPortScanner portScanner) {
        this.portScanner = portScanner;
    }

    @Override
    public synchronized void startDetection() {
        if (isDetecting()) {
            log.debug("El lector serial ya está escuchando en {}", portName);
            return;
        }
        if (portName == null || portName.isBlank()) {
            lastError = "serial.port-name vacío";
            throw HardwareException.portNotConfigured();
        }

        SerialPort port = portScanner.findPort(portName);
        if (port == null) {
            lastError = "Puerto no encontrado";
            throw HardwareException.portNotFound(portName);
        }

        // Configurar puerto
        port.setBaudRate(baudRate);
        port.setNumDataBits(dataBits);
        port.setNumStopBits(stopBits);
        port.setParity(parity);
        port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING, 0, 0);

        if (!port.openPort()) {
            lastError = "No se pudo abrir el puerto";
            throw HardwareException.cannotOpen(portName);
        }

        currentPort = port;
        lastError = null;
        running.set(true);
        log.info("Puerto {} abierto a {} baudios, esperando tags", portName, baudRate);

        executor.submit(() -> readLoop(port));
    }

    @Override
    public synchronized void stopDetection() {
        running.set(false);

        SerialPort port = currentPort;
        if (port != null && port.isOpen()) {
            port.closePort();
            log.info("Puerto {} cerrado", port.getSystemPortName());
        }
        currentPort = null;
    }

    @Override
    public void setTagDetectedCallback(Consumer<String> callback) {
        this.tagDetectedCallback = callback;
    }

    @Override
    public void setTagRemovedCallback(Runnable callback) {
        this.tagRemovedCallback = callback;
    }

    @Override
    public Map<String, Object> getHardwareStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("adapterType", "serial");
        status.put("available", portScanner.findPort(portName) != null);
        status.put("detecting", isDetecting());
        status.put("portName", portName);
        status.put("baudRate", baudRate);
        status.put("availablePorts", portScanner.getAvailablePorts());
        if (lastError != null) {
            status.put("lastError", lastError);
        }
        return status;
    }

    @Override
    public boolean isDetecting() {
        SerialPort port = currentPort;
        return running.get() && port != null && port.isOpen();
    }

    /**
     * Loop principal de lectura del puerto serial.
     */
    private void readLoop(SerialPort port) {
        log.info("Iniciando loop de lectura serial...");

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(port.getInputStream(), StandardCharsets.US_ASCII))) {

            while (running.get() && port.isOpen()) {
                try {
                    String line = reader.readLine();
                    if (line == null) {
                        log.warn("Fin de flujo en el puerto {}", port.getSystemPortName());
                        break;
                    }
                    if (!line.isBlank()) {
                        processLine(line.trim());
                    }
                } catch (Exception e) {
                    if (running.get()) {
                        log.error("Error leyendo línea: {}", e.getMessage());
                    }
                }
            }
        } catch (Exception e) {
            lastError = e.getMessage();
            log.error("Error en loop de lectura: {}", e.getMessage(), e);
        }

        running.set(false);
        log.info("Loop de lectura finalizado");
    }

    /**
     * Procesa una línea recibida del firmware.
     */
    void processLine(String line) {
        log.debug("Serial recibido: [{}]", line);

        if (REMOVED_MARKER.equalsIgnoreCase(line)) {
            Runnable callback = tagRemovedCallback;
            if (callback != null) {
                try {
                    callback.run();
                } catch (Exception e) {
                    log.error("Error en callback de tag retirado: {}", e.getMessage(), e);
                }
            }
            return;
        }

        Matcher matcher = UID_PATTERN.matcher(line);
        if (!matcher.find()) {
            log.debug("Línea no coincide con patrón UID: {}", line);
            return;
        }

        String uid = matcher.group(1).trim();
        log.info("UID leído: {}", uid);

        Consumer<String> callback = tagDetectedCallback;
        if (callback != null) {
            try {
                callback.accept(uid);
            } catch (Exception e) {
                log.error("Error en callback de UID: {}", e.getMessage(), e);
            }
        }
    }

    /**
     * Cierra recursos al destruir el componente.
     */
    @PreDestroy
    public void cleanup() {
        log.info("Limpiando recursos del lector serial...");
        stopDetection();
        executor.shutdown();
    }
}
