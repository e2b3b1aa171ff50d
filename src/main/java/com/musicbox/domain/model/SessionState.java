package com.musicbox.domain.model;

/**
 * Estados de una sesión de asociación. Solo LISTENING no es terminal.
 */
public enum SessionState {

    /** Esperando que se acerque un tag */
    LISTENING,

    /** Tag asociado a la playlist de la sesión */
    SUCCESS,

    /** El tag ya estaba asociado a otra playlist */
    DUPLICATE,

    /** Detenida por el usuario */
    STOPPED,

    /** Expirada sin detectar ningún tag */
    TIMEOUT,

    /** Error durante el procesamiento */
    ERROR,

    /** Cancelada por el sistema (apagado) */
    CANCELLED;

    public boolean isTerminal() {
        return this != LISTENING;
    }
}
