package com.musicbox.application.dto;

import com.musicbox.domain.model.AssociationSession;

/**
 * Evento del ciclo de vida de una sesión de asociación.
 *
 * @param type    STARTED, STOPPED, TIMEOUT o CANCELLED
 * @param session Estado de la sesión en el momento del evento
 */
public record SessionEventDto(String type, AssociationSessionDto session) {

    public static final String STARTED = "STARTED";
    public static final String STOPPED = "STOPPED";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String CANCELLED = "CANCELLED";

    public static SessionEventDto of(String type, AssociationSession session) {
        return new SessionEventDto(type, AssociationSessionDto.fromDomain(session));
    }
}
