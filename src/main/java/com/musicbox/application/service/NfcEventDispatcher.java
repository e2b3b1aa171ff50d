package com.musicbox.application.service;

import com.musicbox.application.dto.SessionEventDto;
import com.musicbox.application.dto.TagDissociatedEvent;
import com.musicbox.domain.model.DetectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Distribuye los eventos NFC a los callbacks registrados.
 * Un callback que falla no impide que se notifique al resto.
 */
@Component
@Slf4j
public class NfcEventDispatcher {

    // Reproducción: reciben el UID tal como llegó del lector
    private final List<Consumer<String>> tagDetectedCallbacks = new CopyOnWriteArrayList<>();

    // UI / broadcast: reciben el resultado de cada detección
    private final List<Consumer<DetectionResult>> associationCallbacks = new CopyOnWriteArrayList<>();

    private final List<Consumer<SessionEventDto>> sessionCallbacks = new CopyOnWriteArrayList<>();

    private final List<Consumer<TagDissociatedEvent>> dissociationCallbacks = new CopyOnWriteArrayList<>();

    public void registerTagDetectedCallback(Consumer<String> callback) {
        tagDetectedCallbacks.add(callback);
    }

    public void registerAssociationCallback(Consumer<DetectionResult> callback) {
        associationCallbacks.add(callback);
    }

    public void registerSessionCallback(Consumer<SessionEventDto> callback) {
        sessionCallbacks.add(callback);
    }

    public void registerDissociationCallback(Consumer<TagDissociatedEvent> callback) {
        dissociationCallbacks.add(callback);
    }

    public void publishTagDetected(String uid) {
        log.debug("Notificando tag {} a {} callbacks de reproducción", uid, tagDetectedCallbacks.size());
        notifyCallbacks(tagDetectedCallbacks, uid, "tag detectado");
    }

    public void publishAssociationResult(DetectionResult result) {
        notifyCallbacks(associationCallbacks, result, "asociación");
    }

    public void publishSessionEvent(SessionEventDto event) {
        notifyCallbacks(sessionCallbacks, event, "sesión " + event.type());
    }

    public void publishTagDissociated(TagDissociatedEvent event) {
        notifyCallbacks(dissociationCallbacks, event, "desasociación");
    }

    private <T> void notifyCallbacks(List<Consumer<T>> callbacks, T payload, String eventName) {
        for (Consumer<T> callback : callbacks) {
            try {
                callback.accept(payload);
            } catch (Exception e) {
                log.error("Error en callback de {}: {}", eventName, e.getMessage(), e);
            }
        }
    }
}
