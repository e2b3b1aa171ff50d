package com.musicbox.domain.port;

import com.musicbox.domain.model.PlaylistSummary;

import java.util.Optional;

/**
 * Puerto (interfaz) hacia el almacén de playlists, que guarda una copia
 * desnormalizada de la asociación tag-playlist.
 */
public interface PlaylistSyncPort {

    /**
     * Escribe la asociación en la playlist.
     *
     * @param playlistId ID de la playlist
     * @param tagId      UID normalizado del tag
     * @return true si la playlist quedó actualizada
     * @throws com.musicbox.domain.exception.SyncException si falla el almacén
     */
    boolean updateNfcTagAssociation(String playlistId, String tagId);

    /**
     * Quita el tag de la playlist que lo tenga asociado.
     *
     * @param tagId UID normalizado del tag
     * @return true si alguna playlist tenía el tag
     * @throws com.musicbox.domain.exception.SyncException si falla el almacén
     */
    boolean removeNfcTagAssociation(String tagId);

    /**
     * Busca la playlist asociada a un tag.
     *
     * @param tagId UID normalizado del tag
     * @return Optional con la playlist si existe
     */
    Optional<PlaylistSummary> findByNfcTag(String tagId);
}
