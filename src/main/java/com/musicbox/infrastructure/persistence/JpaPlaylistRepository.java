package com.musicbox.infrastructure.persistence;

import com.musicbox.infrastructure.persistence.entity.PlaylistEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repositorio JPA para operaciones con playlists.
 */
@Repository
public interface JpaPlaylistRepository extends JpaRepository<PlaylistEntity, String> {

    /**
     * Busca la playlist asociada a un tag NFC.
     * 
     * @param nfcTagId UID normalizado del tag
     * @return Optional con la playlist si existe
     */
    Optional<PlaylistEntity> findByNfcTagId(String nfcTagId);

    List<PlaylistEntity> findAllByNfcTagId(String nfcTagId);
}
