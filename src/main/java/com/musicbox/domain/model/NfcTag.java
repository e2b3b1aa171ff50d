package com.musicbox.domain.model;

import com.musicbox.domain.exception.ValidationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Modelo de dominio que representa un tag NFC conocido por el sistema:
 * su asociación con una playlist y su historial de detecciones.
 */
@Getter
@ToString
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NfcTag {

    /** Identificador normalizado del tag */
    private final TagIdentifier identifier;

    /** Playlist asociada (null si no hay asociación) */
    private String associatedPlaylistId;

    /** Momento de la última detección */
    private Instant lastDetectedAt;

    /** Número de veces que se ha detectado el tag */
    private long detectionCount;

    /** Datos adicionales del lector o de la UI */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Crea un tag nuevo, nunca detectado y sin asociación.
     */
    public static NfcTag create(TagIdentifier identifier) {
        return NfcTag.builder()
                .identifier(identifier)
                .detectionCount(0)
                .build();
    }

    /**
     * Registra una detección del tag.
     *
     * @param detectedAt Momento de la detección
     */
    public void markDetected(Instant detectedAt) {
        this.detectionCount++;
        this.lastDetectedAt = detectedAt;
    }

    /**
     * Asocia el tag a una playlist.
     *
     * @param playlistId ID de la playlist
     * @throws ValidationException si el ID está vacío
     */
    public void associateWithPlaylist(String playlistId) {
        if (playlistId == null || playlistId.isBlank()) {
            throw ValidationException.playlistIdRequired();
        }
        this.associatedPlaylistId = playlistId;
    }

    /**
     * Elimina la asociación actual.
     *
     * @return ID de la playlist asociada antes, o null si no había
     */
    public String dissociateFromPlaylist() {
        String previous = this.associatedPlaylistId;
        this.associatedPlaylistId = null;
        return previous;
    }

    public boolean isAssociated() {
        return associatedPlaylistId != null;
    }

    public boolean isAssociatedWith(String playlistId) {
        return associatedPlaylistId != null && associatedPlaylistId.equals(playlistId);
    }
}
