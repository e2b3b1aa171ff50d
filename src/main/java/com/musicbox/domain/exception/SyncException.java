package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando falla la escritura de la asociación en el lado de la
 * playlist.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SyncException updateFailed(String playlistId, String tagId, Throwable cause) {
        return new SyncException(
                String.format("No se pudo sincronizar el tag %s con la playlist %s", tagId, playlistId), cause);
    }

    public static SyncException removeFailed(String tagId, Throwable cause) {
        return new SyncException("No se pudo quitar el tag " + tagId + " de su playlist", cause);
    }
}
