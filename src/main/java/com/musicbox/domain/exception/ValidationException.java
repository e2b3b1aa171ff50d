package com.musicbox.domain.exception;

/**
 * Excepción lanzada cuando un dato de entrada no es válido
 * (UID de tag mal formado, ID de playlist vacío, timeout no positivo).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    /**
     * Excepción cuando el UID del tag no es un hexadecimal válido.
     */
    public static ValidationException invalidTagUid(String rawUid, String reason) {
        return new ValidationException(String.format("UID de tag inválido '%s': %s", rawUid, reason));
    }

    /**
     * Excepción cuando falta el ID de playlist.
     */
    public static ValidationException playlistIdRequired() {
        return new ValidationException("El ID de playlist es requerido");
    }

    /**
     * Excepción cuando el timeout de la sesión no es positivo.
     */
    public static ValidationException invalidTimeout(int timeoutSeconds) {
        return new ValidationException("El timeout debe ser mayor que cero: " + timeoutSeconds);
    }
}
