package com.musicbox.application.dto;

/**
 * Evento de tag desasociado de su playlist.
 *
 * @param tagId              UID normalizado del tag
 * @param previousPlaylistId Playlist que tenía el tag (null si no tenía ninguna)
 */
public record TagDissociatedEvent(String tagId, String previousPlaylistId) {
}
