package com.musicbox.infrastructure.persistence;

import com.musicbox.domain.exception.SyncException;
import com.musicbox.domain.model.PlaylistSummary;
import com.musicbox.domain.port.PlaylistSyncPort;
import com.musicbox.infrastructure.persistence.entity.PlaylistEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Implementación del puerto de sincronización de playlists usando JPA.
 * Mantiene la columna nfc_tag_id de la tabla playlists alineada con el
 * registro de tags.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaPlaylistSyncAdapter implements PlaylistSyncPort {

    private final JpaPlaylistRepository playlistRepository;

    @Override
    @Transactional
    public boolean updateNfcTagAssociation(String playlistId, String tagId) {
        try {
            Optional<PlaylistEntity> target = playlistRepository.findById(playlistId);
            if (target.isEmpty()) {
                log.warn("Playlist {} no encontrada en la base de datos", playlistId);
                return false;
            }

            // Un tag solo puede estar en una playlist
            List<PlaylistEntity> previous = playlistRepository.findAllByNfcTagId(tagId);
            for (PlaylistEntity other : previous) {
                if (!other.getId().equals(playlistId)) {
                    other.setNfcTagId(null);
                    other.setUpdatedAt(LocalDateTime.now());
                    log.info("Tag {} retirado de la playlist {}", tagId, other.getId());
                }
            }
            playlistRepository.flush();

            PlaylistEntity entity = target.get();
            entity.setNfcTagId(tagId);
            entity.setUpdatedAt(LocalDateTime.now());
            playlistRepository.save(entity);

            log.info("Playlist {} sincronizada con el tag {}", playlistId, tagId);
            return true;
        } catch (DataAccessException e) {
            log.error("Error sincronizando playlist {}: {}", playlistId, e.getMessage());
            throw SyncException.updateFailed(playlistId, tagId, e);
        }
    }

    @Override
    @Transactional
    public boolean removeNfcTagAssociation(String tagId) {
        try {
            List<PlaylistEntity> playlists = playlistRepository.findAllByNfcTagId(tagId);
            if (playlists.isEmpty()) {
                log.debug("Ninguna playlist tenía el tag {}", tagId);
                return false;
            }

            for (PlaylistEntity entity : playlists) {
                entity.setNfcTagId(null);
                entity.setUpdatedAt(LocalDateTime.now());
            }
            playlistRepository.saveAll(playlists);

            log.info("Tag {} retirado de {} playlist(s)", tagId, playlists.size());
            return true;
        } catch (DataAccessException e) {
            log.error("Error retirando el tag {}: {}", tagId, e.getMessage());
            throw SyncException.removeFailed(tagId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PlaylistSummary> findByNfcTag(String tagId) {
        try {
            return playlistRepository.findByNfcTagId(tagId).map(this::toSummary);
        } catch (DataAccessException e) {
            log.error("Error buscando la playlist del tag {}: {}", tagId, e.getMessage());
            return Optional.empty();
        }
    }

    private PlaylistSummary toSummary(PlaylistEntity entity) {
        return PlaylistSummary.builder()
                .id(entity.getId())
                .title(entity.getTitle())
                .nfcTagId(entity.getNfcTagId())
                .build();
    }
}
