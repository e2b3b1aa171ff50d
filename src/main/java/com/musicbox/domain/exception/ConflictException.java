package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando ya existe una sesión de asociación activa
 * para la misma playlist.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public static ConflictException sessionAlreadyActive(String playlistId, String sessionId) {
        return new ConflictException(String.format(
                "Ya hay una sesión de asociación activa para la playlist %s (sesión %s)", playlistId, sessionId));
    }
}
