package com.musicbox.application.service;

import com.musicbox.domain.exception.ConflictException;
import com.musicbox.domain.exception.ValidationException;
import com.musicbox.domain.model.AssociationSession;
import com.musicbox.domain.model.DetectionAction;
import com.musicbox.domain.model.DetectionResult;
import com.musicbox.domain.model.NfcTag;
import com.musicbox.domain.model.SessionState;
import com.musicbox.domain.model.TagIdentifier;
import com.musicbox.domain.port.PlaylistSyncPort;
import com.musicbox.domain.port.TagRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Servicio de dominio para la asociación de tags NFC con playlists.
 * Gestiona las sesiones de asociación, la política de conflictos/override y la
 * limpieza de sesiones vencidas.
 *
 * CONCURRENCIA:
 * 1. El registro de sesiones se protege con {@code registryLock}. Sus secciones
 * críticas no hacen I/O: elegir y reclamar la sesión, cerrarla, barrer.
 * 2. El read-modify-write de los tags (incluida la escritura en el registro de
 * tags) se serializa con {@code tagLock}, fuera del lock del registro.
 * 3. La escritura en el lado de la playlist no toma ningún lock. Mientras tanto
 * la sesión queda reclamada: sigue en LISTENING y bloquea la reproducción,
 * pero no acepta otro tag ni la toca el barrido.
 * 4. {@link #getActiveSessions()} lee una copia inmutable del registro que se
 * republica en cada cambio, así el hilo del lector nunca espera un lock.
 * Nunca se toman los dos locks a la vez.
 */
@Service
@Slf4j
public class AssociationService {

    private final TagRepository tagRepository;
    private final PlaylistSyncPort playlistSync;
    private final Clock clock;
    private final int defaultTimeoutSeconds;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final ReentrantLock tagLock = new ReentrantLock();

    // Sesiones en LISTENING, en orden de creación
    private final Map<String, AssociationSession> activeSessions = new LinkedHashMap<>();

    // Copia de activeSessions para lectores sin lock
    private volatile List<AssociationSession> activeView = List.of();

    // Todas las sesiones creadas durante la vida del proceso
    private final Map<String, AssociationSession> allSessions = new ConcurrentHashMap<>();

    public AssociationService(TagRepository tagRepository,
            Optional<PlaylistSyncPort> playlistSync,
            Clock clock,
            @Value("${nfc.association.default-timeout-seconds:60}") int defaultTimeoutSeconds) {
        this.tagRepository = tagRepository;
        this.playlistSync = playlistSync.orElse(null);
        this.clock = clock;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;

        if (this.playlistSync == null) {
            log.warn("Sin repositorio de playlists: las asociaciones solo se guardan en el registro de tags");
        }
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    /**
     * Inicia una sesión con el timeout por defecto y sin override.
     */
    public AssociationSession startAssociationSession(String playlistId) {
        return startAssociationSession(playlistId, defaultTimeoutSeconds, false);
    }

    /**
     * Inicia una nueva sesión de asociación para una playlist.
     *
     * @param playlistId     ID de la playlist a asociar
     * @param timeoutSeconds Duración de la ventana de escucha
     * @param overrideMode   Si se permite reasignar un tag ya asociado a otra playlist
     * @return Nueva sesión en estado LISTENING
     * @throws ValidationException si el ID está vacío o el timeout no es positivo
     * @throws ConflictException   si ya hay una sesión activa para la playlist
     */
    public AssociationSession startAssociationSession(String playlistId, int timeoutSeconds, boolean overrideMode) {
        if (playlistId == null || playlistId.isBlank()) {
            throw ValidationException.playlistIdRequired();
        }
        if (timeoutSeconds <= 0) {
            throw ValidationException.invalidTimeout(timeoutSeconds);
        }

        registryLock.lock();
        try {
            Optional<AssociationSession> existing = findActiveSessionForPlaylist(playlistId);
            if (existing.isPresent()) {
                throw ConflictException.sessionAlreadyActive(playlistId, existing.get().getSessionId());
            }

            AssociationSession session = AssociationSession.start(playlistId, timeoutSeconds, overrideMode, clock);
            activeSessions.put(session.getSessionId(), session);
            allSessions.put(session.getSessionId(), session);
            publishActiveView();

            log.info("Sesión de asociación {} iniciada para playlist {} (timeout={}s, override={})",
                    session.getSessionId(), playlistId, timeoutSeconds, overrideMode);
            return session;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Procesa la detección de un tag sin sesión concreta.
     */
    public DetectionResult processTagDetection(TagIdentifier identifier) {
        return processTagDetection(identifier, null);
    }

    /**
     * Procesa la detección de un tag.
     * Siempre registra la detección en el tag; si hay una sesión activa, intenta
     * asociarlo a su playlist. Los errores se capturan en la sesión y se
     * devuelven en el resultado, nunca se lanzan.
     *
     * @param identifier Tag detectado
     * @param sessionId  Sesión concreta (opcional); si no está activa se usa la
     *                   primera sesión activa
     * @return Resultado de la detección
     */
    public DetectionResult processTagDetection(TagIdentifier identifier, String sessionId) {
        AssociationSession session = claimSession(identifier, sessionId);

        TagUpdate update;
        try {
            update = updateTag(identifier, session);
        } catch (RuntimeException e) {
            if (session != null) {
                return failSession(session, identifier, e);
            }
            log.error("Error registrando la detección del tag {}: {}", identifier, e.getMessage(), e);
            return errorResult(identifier, null, e.getMessage()).noActiveSessions(true).build();
        }

        NfcTag tag = update.tag();
        if (session == null) {
            log.debug("Tag {} detectado sin sesiones activas (detecciones: {})",
                    identifier, tag.getDetectionCount());

            return DetectionResult.builder()
                    .action(DetectionAction.TAG_DETECTED)
                    .tagId(identifier.uid())
                    .associatedPlaylistId(tag.getAssociatedPlaylistId())
                    .noActiveSessions(true)
                    .detectionCount(tag.getDetectionCount())
                    .build();
        }

        if (update.duplicate()) {
            return finishDuplicate(session, identifier, update);
        }

        return completeAssociation(new PendingAssociation(session, identifier,
                update.previousPlaylistId(), tag.getDetectionCount()));
    }

    /**
     * Detiene una sesión de asociación a petición del usuario.
     *
     * @param sessionId ID de la sesión
     * @return true si la sesión estaba escuchando y se detuvo; false si ya había
     *         terminado o si está terminando de asociar un tag
     */
    public boolean stopAssociationSession(String sessionId) {
        registryLock.lock();
        try {
            AssociationSession session = activeSessions.get(sessionId);
            if (session == null || session.getState() != SessionState.LISTENING) {
                return false;
            }
            if (session.isClaimed()) {
                log.info("La sesión {} ya está asociando el tag {}, no se detiene",
                        sessionId, session.getDetectedTag());
                return false;
            }

            session.markStopped();
            activeSessions.remove(sessionId);
            publishActiveView();
            log.info("Sesión de asociación {} detenida", sessionId);
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Pasa a TIMEOUT las sesiones vencidas que seguían escuchando.
     *
     * @return Número de sesiones limpiadas
     */
    public int cleanupExpiredSessions() {
        return sweepExpiredSessions().size();
    }

    /**
     * Igual que {@link #cleanupExpiredSessions()} pero devuelve las sesiones
     * afectadas, para notificarlas.
     */
    public List<AssociationSession> sweepExpiredSessions() {
        List<AssociationSession> expired = new ArrayList<>();

        registryLock.lock();
        try {
            Iterator<AssociationSession> it = activeSessions.values().iterator();
            while (it.hasNext()) {
                AssociationSession session = it.next();
                if (session.getState() != SessionState.LISTENING) {
                    it.remove();
                } else if (session.isExpired() && !session.isClaimed()) {
                    session.markTimeout();
                    it.remove();
                    expired.add(session);
                    log.info("Sesión de asociación {} (playlist {}) expirada",
                            session.getSessionId(), session.getPlaylistId());
                }
            }
            publishActiveView();
        } finally {
            registryLock.unlock();
        }

        return expired;
    }

    /**
     * Cancela todas las sesiones que siguen escuchando (apagado del sistema).
     *
     * @return Sesiones canceladas
     */
    public List<AssociationSession> cancelAllSessions() {
        List<AssociationSession> cancelled = new ArrayList<>();

        registryLock.lock();
        try {
            Iterator<AssociationSession> it = activeSessions.values().iterator();
            while (it.hasNext()) {
                AssociationSession session = it.next();
                if (session.getState() == SessionState.LISTENING && !session.isClaimed()) {
                    session.markCancelled();
                    it.remove();
                    cancelled.add(session);
                }
            }
            publishActiveView();
        } finally {
            registryLock.unlock();
        }

        if (!cancelled.isEmpty()) {
            log.info("{} sesiones de asociación canceladas", cancelled.size());
        }
        return cancelled;
    }

    /**
     * Quita la asociación de un tag, en el registro de tags y en la playlist.
     *
     * @param identifier Tag a desasociar
     * @return false si el tag no existe
     */
    public boolean dissociateTag(TagIdentifier identifier) {
        return dissociate(identifier).isPresent();
    }

    /**
     * Igual que {@link #dissociateTag(TagIdentifier)} pero devuelve la playlist
     * que tenía el tag, para notificarlo.
     *
     * @param identifier Tag a desasociar
     * @return Vacío si el tag no existe
     */
    public Optional<TagDissociation> dissociate(TagIdentifier identifier) {
        String previousPlaylistId;

        tagLock.lock();
        try {
            Optional<NfcTag> found = tagRepository.findByIdentifier(identifier);
            if (found.isEmpty()) {
                log.warn("Tag no encontrado para desasociar: {}", identifier);
                return Optional.empty();
            }

            NfcTag tag = found.get();
            previousPlaylistId = tag.dissociateFromPlaylist();
            tagRepository.save(tag);
        } finally {
            tagLock.unlock();
        }

        if (previousPlaylistId != null && playlistSync != null) {
            try {
                playlistSync.removeNfcTagAssociation(identifier.uid());
            } catch (RuntimeException e) {
                log.error("Error quitando el tag {} de la playlist {}: {}",
                        identifier, previousPlaylistId, e.getMessage());
            }
        }

        log.info("Tag {} desasociado de la playlist {}", identifier, previousPlaylistId);
        return Optional.of(new TagDissociation(identifier, previousPlaylistId));
    }

    /**
     * Sesiones activas en este momento (la expiración se comprueba aquí también).
     * No toma ningún lock: lo llama el hilo del lector.
     */
    public List<AssociationSession> getActiveSessions() {
        List<AssociationSession> result = new ArrayList<>();
        for (AssociationSession session : activeView) {
            if (session.isActive()) {
                result.add(session);
            }
        }
        return result;
    }

    /**
     * Busca una sesión por ID, esté activa o no.
     */
    public Optional<AssociationSession> findSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(allSessions.get(sessionId));
    }

    // Llamar siempre con registryLock tomado
    private void publishActiveView() {
        activeView = List.copyOf(activeSessions.values());
    }

    private Optional<AssociationSession> findActiveSessionForPlaylist(String playlistId) {
        return activeSessions.values().stream()
                .filter(s -> s.getPlaylistId().equals(playlistId) && s.isActive())
                .findFirst();
    }

    /**
     * Elige la sesión que recibe el tag y la reclama para que ninguna otra
     * detección, parada o barrido la toque mientras se procesa.
     */
    private AssociationSession claimSession(TagIdentifier identifier, String sessionId) {
        registryLock.lock();
        try {
            AssociationSession session = selectSession(sessionId);
            if (session != null) {
                session.claim(identifier);
            }
            return session;
        } finally {
            registryLock.unlock();
        }
    }

    private AssociationSession selectSession(String sessionId) {
        if (sessionId != null) {
            AssociationSession requested = activeSessions.get(sessionId);
            if (requested != null && requested.isActive() && !requested.isClaimed()) {
                return requested;
            }
            log.debug("Sesión {} no activa, se usa la primera sesión activa", sessionId);
        }

        for (AssociationSession session : activeSessions.values()) {
            if (session.isActive() && !session.isClaimed()) {
                return session;
            }
        }
        return null;
    }

    /**
     * Registra la detección en el tag y, si hay sesión, aplica la política de
     * conflictos. Es la única parte que escribe en el registro de tags.
     */
    private TagUpdate updateTag(TagIdentifier identifier, AssociationSession session) {
        tagLock.lock();
        try {
            NfcTag tag = tagRepository.findByIdentifier(identifier).orElseGet(() -> NfcTag.create(identifier));
            tag.markDetected(clock.instant());

            if (session == null) {
                tagRepository.save(tag);
                return new TagUpdate(tag, null, false);
            }

            String existingPlaylistId = tag.getAssociatedPlaylistId();
            boolean boundElsewhere = tag.isAssociated() && !tag.isAssociatedWith(session.getPlaylistId());

            if (boundElsewhere && !session.isOverrideMode()) {
                tagRepository.save(tag);
                return new TagUpdate(tag, existingPlaylistId, true);
            }

            if (boundElsewhere) {
                log.warn("Override: reasignando tag {} de la playlist {} a {}",
                        identifier, existingPlaylistId, session.getPlaylistId());
                tag.dissociateFromPlaylist();
            }

            tag.associateWithPlaylist(session.getPlaylistId());
            tagRepository.save(tag);
            return new TagUpdate(tag, boundElsewhere ? existingPlaylistId : null, false);
        } finally {
            tagLock.unlock();
        }
    }

    private DetectionResult finishDuplicate(AssociationSession session, TagIdentifier identifier, TagUpdate update) {
        registryLock.lock();
        try {
            session.markDuplicate(identifier, update.previousPlaylistId());
            activeSessions.remove(session.getSessionId());
            publishActiveView();
        } finally {
            registryLock.unlock();
        }

        log.warn("Tag {} ya asociado a la playlist {} (sesión {} pedía {})",
                identifier, update.previousPlaylistId(), session.getSessionId(), session.getPlaylistId());

        return DetectionResult.builder()
                .action(DetectionAction.DUPLICATE_ASSOCIATION)
                .tagId(identifier.uid())
                .playlistId(session.getPlaylistId())
                .existingPlaylistId(update.previousPlaylistId())
                .associatedPlaylistId(update.previousPlaylistId())
                .sessionId(session.getSessionId())
                .sessionState(session.getState())
                .detectionCount(update.tag().getDetectionCount())
                .build();
    }

    /**
     * Sincroniza el lado de la playlist y cierra la sesión reclamada.
     */
    private DetectionResult completeAssociation(PendingAssociation pending) {
        String tagId = pending.tag().uid();
        String playlistId = pending.session().getPlaylistId();
        String syncError = null;

        if (playlistSync != null) {
            try {
                if (pending.previousPlaylistId() != null
                        && !playlistSync.removeNfcTagAssociation(tagId)) {
                    log.warn("La playlist {} no tenía el tag {} registrado", pending.previousPlaylistId(), tagId);
                }
                if (!playlistSync.updateNfcTagAssociation(playlistId, tagId)) {
                    syncError = "La playlist " + playlistId + " no aceptó la asociación";
                }
            } catch (RuntimeException e) {
                syncError = e.getMessage();
            }
        }

        registryLock.lock();
        try {
            AssociationSession session = pending.session();
            activeSessions.remove(session.getSessionId());
            publishActiveView();

            if (syncError != null) {
                session.markError("Sincronización con la playlist fallida: " + syncError);
                log.error("Tag {} guardado con playlist {} pero la sincronización falló: {}",
                        tagId, playlistId, syncError);
                return errorResult(pending.tag(), session, session.getErrorMessage())
                        .syncFailed(true)
                        .associatedPlaylistId(playlistId)
                        .detectionCount(pending.detectionCount())
                        .build();
            }

            session.markSuccessful(pending.tag());
            log.info("Tag {} asociado a la playlist {} (sesión {})", tagId, playlistId, session.getSessionId());

            return DetectionResult.builder()
                    .action(DetectionAction.ASSOCIATION_SUCCESS)
                    .tagId(tagId)
                    .playlistId(playlistId)
                    .associatedPlaylistId(playlistId)
                    .existingPlaylistId(pending.previousPlaylistId())
                    .sessionId(session.getSessionId())
                    .sessionState(session.getState())
                    .detectionCount(pending.detectionCount())
                    .build();
        } finally {
            registryLock.unlock();
        }
    }

    private DetectionResult failSession(AssociationSession session, TagIdentifier identifier, RuntimeException e) {
        log.error("Error procesando el tag {} en la sesión {}: {}",
                identifier, session.getSessionId(), e.getMessage(), e);

        registryLock.lock();
        try {
            if (session.getState() == SessionState.LISTENING) {
                session.markError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
            activeSessions.remove(session.getSessionId());
            publishActiveView();
        } finally {
            registryLock.unlock();
        }

        return errorResult(identifier, session, session.getErrorMessage()).build();
    }

    private DetectionResult.DetectionResultBuilder errorResult(TagIdentifier identifier,
            AssociationSession session, String message) {
        DetectionResult.DetectionResultBuilder builder = DetectionResult.builder()
                .action(DetectionAction.ASSOCIATION_ERROR)
                .tagId(identifier.uid())
                .errorMessage(message);
        if (session != null) {
            builder.sessionId(session.getSessionId())
                    .playlistId(session.getPlaylistId())
                    .sessionState(session.getState());
        }
        return builder;
    }

    /**
     * Tag desasociado y la playlist que tenía (null si no tenía ninguna).
     */
    public record TagDissociation(TagIdentifier tag, String previousPlaylistId) {
    }

    /**
     * Estado del tag tras aplicar una detección.
     */
    private record TagUpdate(NfcTag tag, String previousPlaylistId, boolean duplicate) {
    }

    /**
     * Asociación decidida, pendiente de sincronizar con la playlist.
     */
    private record PendingAssociation(AssociationSession session, TagIdentifier tag,
            String previousPlaylistId, long detectionCount) {
    }
}
