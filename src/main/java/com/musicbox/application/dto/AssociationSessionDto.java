package com.musicbox.application.dto;

import com.musicbox.domain.model.AssociationSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO para el estado de una sesión de asociación.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssociationSessionDto {

    private String sessionId;
    private String playlistId;
    private String state;
    private int timeoutSeconds;
    private boolean overrideMode;
    private boolean active;

    /**
     * El tag ya se capturó y se está sincronizando la playlist
     */
    private boolean claimed;
    private long secondsRemaining;
    private String startedAt;
    private String timeoutAt;

    /**
     * UID del tag detectado (null si todavía no se detectó ninguno)
     */
    private String detectedTag;

    /**
     * Playlist que ya tenía el tag, en sesiones DUPLICATE
     */
    private String conflictPlaylistId;

    private String errorMessage;

    /**
     * Crea un DTO desde un modelo de dominio.
     */
    public static AssociationSessionDto fromDomain(AssociationSession session) {
        return AssociationSessionDto.builder()
                .sessionId(session.getSessionId())
                .playlistId(session.getPlaylistId())
                .state(session.getState().name())
                .timeoutSeconds(session.getTimeoutSeconds())
                .overrideMode(session.isOverrideMode())
                .active(session.isActive())
                .claimed(session.isClaimed())
                .secondsRemaining(session.secondsRemaining())
                .startedAt(session.getStartedAt().toString())
                .timeoutAt(session.getTimeoutAt().toString())
                .detectedTag(session.getDetectedTag() != null ? session.getDetectedTag().uid() : null)
                .conflictPlaylistId(session.getConflictPlaylistId())
                .errorMessage(session.getErrorMessage())
                .build();
    }
}
