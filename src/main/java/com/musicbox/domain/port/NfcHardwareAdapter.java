package com.musicbox.domain.port;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Puerto (interfaz) hacia el lector NFC físico.
 * Los callbacks se invocan en el hilo del lector.
 */
public interface NfcHardwareAdapter {

    /**
     * Inicia la detección de tags. Idempotente.
     *
     * @throws com.musicbox.domain.exception.HardwareException si el lector no arranca
     */
    void startDetection();

    /**
     * Detiene la detección de tags. Idempotente.
     *
     * @throws com.musicbox.domain.exception.HardwareException si el lector no se detiene
     */
    void stopDetection();

    /**
     * Registra el callback de tag detectado (recibe el UID tal como lo leyó el lector).
     */
    void setTagDetectedCallback(Consumer<String> callback);

    /**
     * Registra el callback de tag retirado.
     */
    void setTagRemovedCallback(Runnable callback);

    /**
     * Estado del lector: al menos {@code available}, {@code detecting} y {@code adapterType}.
     */
    Map<String, Object> getHardwareStatus();

    boolean isDetecting();
}
