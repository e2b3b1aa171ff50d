package com.musicbox.application.service;

import com.musicbox.domain.exception.ValidationException;
import com.musicbox.domain.model.PlaylistSummary;
import com.musicbox.domain.model.TagIdentifier;
import com.musicbox.domain.port.PlaylistSyncPort;
import com.musicbox.presentation.websocket.NfcWebSocketHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Convierte las detecciones permitidas para reproducción en peticiones de
 * reproducción de la playlist asociada al tag.
 * El reproductor escucha los mensajes PLAYBACK_REQUESTED del WebSocket.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaybackRequestListener {

    private final NfcApplicationService nfcApplicationService;
    private final PlaylistSyncPort playlistSync;
    private final NfcWebSocketHandler webSocketHandler;

    @PostConstruct
    public void register() {
        nfcApplicationService.registerTagDetectedCallback(this::onTagDetected);
    }

    /**
     * Busca la playlist del tag y pide su reproducción.
     *
     * @param uid UID tal como lo leyó el lector
     */
    void onTagDetected(String uid) {
        String tagId;
        try {
            tagId = TagIdentifier.parse(uid).uid();
        } catch (ValidationException e) {
            log.warn("UID inválido recibido para reproducción: {}", uid);
            return;
        }

        Optional<PlaylistSummary> playlist = playlistSync.findByNfcTag(tagId);
        if (playlist.isEmpty()) {
            log.info("El tag {} no tiene playlist asociada", tagId);
            return;
        }

        log.info("Reproducción solicitada: tag {} -> playlist {}", tagId, playlist.get().getId());
        webSocketHandler.broadcastPlaybackRequested(tagId, playlist.get());
    }
}
