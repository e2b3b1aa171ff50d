package com.musicbox.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicbox.application.dto.SessionEventDto;
import com.musicbox.application.dto.TagDissociatedEvent;
import com.musicbox.application.service.NfcApplicationService;
import com.musicbox.domain.model.DetectionResult;
import com.musicbox.domain.model.PlaylistSummary;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handler de WebSocket que envía a la UI los eventos de asociación y las
 * peticiones de reproducción.
 * Los broadcasts llegan desde el worker de detección, el barrido y los hilos
 * HTTP, por eso cada sesión se envuelve en un
 * {@link ConcurrentWebSocketSessionDecorator}.
 */
@Component
@Slf4j
public class NfcWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    // Sesiones decoradas, por ID de la sesión original
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NfcApplicationService nfcApplicationService;

    public NfcWebSocketHandler(NfcApplicationService nfcApplicationService) {
        this.nfcApplicationService = nfcApplicationService;
    }

    @PostConstruct
    public void subscribe() {
        nfcApplicationService.registerAssociationCallback(this::broadcastAssociationResult);
        nfcApplicationService.registerSessionCallback(this::broadcastSessionEvent);
        nfcApplicationService.registerDissociationCallback(this::broadcastTagDissociated);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Envía el resultado de una detección a todos los clientes.
     *
     * @param result Resultado de la detección
     */
    public void broadcastAssociationResult(DetectionResult result) {
        broadcast("ASSOCIATION_RESULT", result);
    }

    /**
     * Notifica un cambio en el ciclo de vida de una sesión.
     *
     * @param event Evento de sesión
     */
    public void broadcastSessionEvent(SessionEventDto event) {
        broadcast("SESSION_EVENT", event);
    }

    /**
     * Notifica que un tag ya no está asociado a ninguna playlist.
     */
    public void broadcastTagDissociated(TagDissociatedEvent event) {
        broadcast("TAG_DISSOCIATED", event);
    }

    /**
     * Pide al reproductor que arranque la playlist asociada a un tag.
     *
     * @param tagId    UID normalizado del tag
     * @param playlist Playlist a reproducir
     */
    public void broadcastPlaybackRequested(String tagId, PlaylistSummary playlist) {
        broadcast("PLAYBACK_REQUESTED", new PlaybackRequestData(tagId, playlist.getId(), playlist.getTitle()));
    }

    /**
     * Obtiene el número de clientes conectados.
     */
    public int getConnectedClients() {
        return sessions.size();
    }

    /**
     * Método genérico para broadcast de mensajes.
     */
    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(new WebSocketMessage(type, data));
            TextMessage message = new TextMessage(json);

            for (WebSocketSession session : sessions.values()) {
                if (session.isOpen()) {
                    try {
                        session.sendMessage(message);
                    } catch (Exception e) {
                        // IOException o límites del decorador superados
                        log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                        sessions.remove(session.getId());
                    }
                }
            }

            log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());

        } catch (Exception e) {
            log.error("Error creando mensaje JSON: {}", e.getMessage());
        }
    }

    // Records para mensajes
    record WebSocketMessage(String type, Object data) {
    }

    record PlaybackRequestData(String tagId, String playlistId, String title) {
    }
}
