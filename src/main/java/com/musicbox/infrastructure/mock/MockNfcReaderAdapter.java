package com.musicbox.infrastructure.mock;

import com.musicbox.domain.port.NfcHardwareAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Lector NFC simulado para desarrollo y tests.
 * Las lecturas se disparan a mano con {@link #simulateTagDetection(String)};
 * el callback se invoca en el hilo que llama, igual que el hilo del lector real.
 */
@Component
@ConditionalOnProperty(name = "nfc.hardware", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class MockNfcReaderAdapter implements NfcHardwareAdapter {

    private final AtomicBoolean detecting = new AtomicBoolean(false);
    private final AtomicLong simulatedReads = new AtomicLong();

    private volatile Consumer<String> tagDetectedCallback;
    private volatile Runnable tagRemovedCallback;
    private volatile String lastSimulatedUid;

    @Override
    public void startDetection() {
        if (detecting.compareAndSet(false, true)) {
            log.info("Lector NFC simulado iniciado");
        }
    }

    @Override
    public void stopDetection() {
        if (detecting.compareAndSet(true, false)) {
            log.info("Lector NFC simulado detenido");
        }
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
        status.put("adapterType", "mock");
        status.put("available", true);
        status.put("detecting", detecting.get());
        status.put("simulatedReads", simulatedReads.get());
        status.put("lastSimulatedUid", lastSimulatedUid);
        return status;
    }

    @Override
    public boolean isDetecting() {
        return detecting.get();
    }

    /**
     * Simula la lectura de un tag.
     *
     * @param uid UID tal como lo enviaría el lector
     * @return false si el lector no está detectando y la lectura se ignora
     */
    public boolean simulateTagDetection(String uid) {
        if (!detecting.get()) {
            log.warn("No se puede simular el tag {}: el lector simulado no está detectando", uid);
            return false;
        }

        lastSimulatedUid = uid;
        simulatedReads.incrementAndGet();
        log.info("Tag simulado: {}", uid);

        Consumer<String> callback = tagDetectedCallback;
        if (callback != null) {
            callback.accept(uid);
        }
        return true;
    }

    /**
     * Simula la retirada del tag.
     */
    public void simulateTagRemoval() {
        Runnable callback = tagRemovedCallback;
        if (callback != null && detecting.get()) {
            callback.run();
        }
    }
}
