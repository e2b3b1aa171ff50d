package com.musicbox.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Resultado de una detección, tal como lo reciben los consumidores de eventos
 * de asociación (UI, broadcast).
 */
@Value
@Builder
public class DetectionResult {

    DetectionAction action;

    /** UID normalizado del tag detectado */
    String tagId;

    /** Playlist de la sesión que procesó la detección */
    String playlistId;

    /** Playlist que ya tenía el tag (solo en duplicados) */
    String existingPlaylistId;

    String sessionId;

    SessionState sessionState;

    /** Playlist asociada al tag tras procesar la detección */
    String associatedPlaylistId;

    boolean noActiveSessions;

    /** La escritura en el lado de la playlist falló */
    boolean syncFailed;

    String errorMessage;

    long detectionCount;

    public boolean isSuccess() {
        return action == DetectionAction.ASSOCIATION_SUCCESS;
    }
}
