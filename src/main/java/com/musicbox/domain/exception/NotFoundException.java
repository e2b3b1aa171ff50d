package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando una sesión o un tag no existen.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException session(String sessionId) {
        return new NotFoundException("Sesión de asociación no encontrada: " + sessionId);
    }

    public static NotFoundException tag(String tagId) {
        return new NotFoundException("Tag NFC no encontrado: " + tagId);
    }
}
