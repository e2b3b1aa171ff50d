package com.musicbox.application.service;

import com.musicbox.application.dto.AssociationSessionDto;
import com.musicbox.application.dto.NfcStatusDto;
import com.musicbox.application.dto.SessionEventDto;
import com.musicbox.application.dto.TagDissociatedEvent;
import com.musicbox.domain.exception.HardwareException;
import com.musicbox.domain.exception.NotFoundException;
import com.musicbox.domain.exception.ValidationException;
import com.musicbox.domain.model.AssociationSession;
import com.musicbox.domain.model.DetectionResult;
import com.musicbox.domain.model.TagIdentifier;
import com.musicbox.domain.port.NfcHardwareAdapter;
import com.musicbox.domain.port.TagRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Servicio de aplicación que orquesta los casos de uso NFC.
 * Conecta el lector con el servicio de asociación y decide qué detecciones
 * llegan a la reproducción.
 *
 * REGLA DE REPRODUCCIÓN:
 * Una detección solo se notifica a los callbacks de reproducción si no había
 * ninguna sesión de asociación activa en el momento en que llegó del lector.
 * Si había una, la detección la consume entera el flujo de asociación.
 */
@Service
@Slf4j
public class NfcApplicationService {

    private final NfcHardwareAdapter hardware;
    private final AssociationService associationService;
    private final NfcEventDispatcher dispatcher;
    private final TagRepository tagRepository;
    private final ExecutorService detectionExecutor;
    private final ScheduledExecutorService sweepScheduler;
    private final long cleanupIntervalSeconds;

    @Value("${nfc.autostart:true}")
    private boolean autostart;

    private ScheduledFuture<?> sweepTask;

    public NfcApplicationService(
            NfcHardwareAdapter hardware,
            AssociationService associationService,
            NfcEventDispatcher dispatcher,
            TagRepository tagRepository,
            @Qualifier("nfcDetectionExecutor") ExecutorService detectionExecutor,
            @Qualifier("nfcSweepScheduler") ScheduledExecutorService sweepScheduler,
            @Value("${nfc.association.cleanup-interval-seconds:30}") long cleanupIntervalSeconds) {
        this.hardware = hardware;
        this.associationService = associationService;
        this.dispatcher = dispatcher;
        this.tagRepository = tagRepository;
        this.detectionExecutor = detectionExecutor;
        this.sweepScheduler = sweepScheduler;
        this.cleanupIntervalSeconds = cleanupIntervalSeconds;

        this.hardware.setTagDetectedCallback(this::onTagDetected);
        this.hardware.setTagRemovedCallback(this::onTagRemoved);
    }

    /**
     * Arranca el lector al iniciar la aplicación si {@code nfc.autostart} está activo.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!autostart) {
            log.info("Autoarranque NFC desactivado");
            return;
        }
        try {
            startSystem();
        } catch (HardwareException e) {
            log.error("No se pudo arrancar el sistema NFC: {}", e.getMessage());
        }
    }

    /**
     * Inicia la detección de tags y el barrido periódico de sesiones vencidas.
     *
     * @return Estado del sistema
     * @throws HardwareException si el lector no arranca
     */
    public synchronized NfcStatusDto startSystem() {
        try {
            hardware.startDetection();
        } catch (HardwareException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HardwareException("No se pudo iniciar el lector NFC: " + e.getMessage(), e);
        }

        if (sweepTask == null || sweepTask.isDone()) {
            sweepTask = sweepScheduler.scheduleAtFixedRate(this::runCleanupSweep,
                    cleanupIntervalSeconds, cleanupIntervalSeconds, TimeUnit.SECONDS);
            log.info("Barrido de sesiones programado cada {}s", cleanupIntervalSeconds);
        }

        log.info("Sistema NFC iniciado");
        return getStatusUseCase();
    }

    /**
     * Detiene la detección y el barrido. Una detección en curso termina
     * normalmente.
     *
     * @throws HardwareException si el lector no se detiene
     */
    public synchronized void stopSystem() {
        try {
            hardware.stopDetection();
        } catch (HardwareException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HardwareException("No se pudo detener el lector NFC: " + e.getMessage(), e);
        } finally {
            cancelSweep();
        }
        log.info("Sistema NFC detenido");
    }

    /**
     * Caso de uso: iniciar la asociación de una playlist con un tag.
     *
     * @param playlistId     ID de la playlist
     * @param timeoutSeconds Ventana de escucha (null para usar la de por defecto)
     * @param overrideMode   Si se permite reasignar un tag ya asociado
     * @return Estado de la nueva sesión
     */
    public AssociationSessionDto startAssociationUseCase(String playlistId, Integer timeoutSeconds,
            boolean overrideMode) {
        int timeout = timeoutSeconds != null ? timeoutSeconds : associationService.getDefaultTimeoutSeconds();
        AssociationSession session = associationService.startAssociationSession(playlistId, timeout, overrideMode);

        dispatcher.publishSessionEvent(SessionEventDto.of(SessionEventDto.STARTED, session));
        return AssociationSessionDto.fromDomain(session);
    }

    /**
     * Caso de uso: detener una sesión de asociación.
     *
     * @param sessionId ID de la sesión
     * @return false si la sesión ya había terminado o está terminando de
     *         asociar un tag
     * @throws NotFoundException si la sesión no existe
     */
    public boolean stopAssociationUseCase(String sessionId) {
        AssociationSession session = associationService.findSession(sessionId)
                .orElseThrow(() -> NotFoundException.session(sessionId));

        boolean stopped = associationService.stopAssociationSession(sessionId);
        if (stopped) {
            dispatcher.publishSessionEvent(SessionEventDto.of(SessionEventDto.STOPPED, session));
        } else if (session.isClaimed()) {
            log.info("La sesión {} está terminando de asociar el tag {}", sessionId, session.getDetectedTag());
        } else {
            log.info("La sesión {} ya estaba en estado {}", sessionId, session.getState());
        }
        return stopped;
    }

    /**
     * Caso de uso: consultar una sesión, activa o terminada.
     *
     * @throws NotFoundException si la sesión no existe
     */
    public AssociationSessionDto getSessionUseCase(String sessionId) {
        return associationService.findSession(sessionId)
                .map(AssociationSessionDto::fromDomain)
                .orElseThrow(() -> NotFoundException.session(sessionId));
    }

    /**
     * Caso de uso: estado completo del sistema NFC.
     */
    public NfcStatusDto getStatusUseCase() {
        List<AssociationSessionDto> sessions = associationService.getActiveSessions().stream()
                .map(AssociationSessionDto::fromDomain)
                .collect(Collectors.toList());

        return NfcStatusDto.builder()
                .activeSessions(sessions)
                .sessionCount(sessions.size())
                .hardware(hardware.getHardwareStatus())
                .detecting(hardware.isDetecting())
                .sweepRunning(isSweepRunning())
                .knownTags(tagRepository.count())
                .build();
    }

    /**
     * Caso de uso: quitar la asociación de un tag.
     *
     * @param tagId UID del tag, en cualquier formato
     * @return true si se desasoció
     * @throws ValidationException si el UID no es válido
     * @throws NotFoundException   si el tag no existe
     */
    public boolean dissociateUseCase(String tagId) {
        TagIdentifier identifier = TagIdentifier.parse(tagId);
        AssociationService.TagDissociation dissociation = associationService.dissociate(identifier)
                .orElseThrow(() -> NotFoundException.tag(identifier.uid()));

        dispatcher.publishTagDissociated(
                new TagDissociatedEvent(identifier.uid(), dissociation.previousPlaylistId()));
        return true;
    }

    public void registerTagDetectedCallback(Consumer<String> callback) {
        dispatcher.registerTagDetectedCallback(callback);
    }

    public void registerAssociationCallback(Consumer<DetectionResult> callback) {
        dispatcher.registerAssociationCallback(callback);
    }

    public void registerSessionCallback(Consumer<SessionEventDto> callback) {
        dispatcher.registerSessionCallback(callback);
    }

    public void registerDissociationCallback(Consumer<TagDissociatedEvent> callback) {
        dispatcher.registerDissociationCallback(callback);
    }

    public synchronized boolean isSweepRunning() {
        return sweepTask != null && !sweepTask.isDone();
    }

    /**
     * Callback del lector. Se ejecuta en el hilo del hardware: solo valida,
     * toma la foto de las sesiones activas y delega en el worker.
     */
    private void onTagDetected(String rawUid) {
        TagIdentifier identifier;
        try {
            identifier = TagIdentifier.parse(rawUid);
        } catch (ValidationException e) {
            log.warn("Lectura descartada: {}", e.getMessage());
            return;
        }

        boolean playbackAllowed = associationService.getActiveSessions().isEmpty();
        log.debug("Tag {} recibido del lector (reproducción permitida: {})", identifier, playbackAllowed);

        try {
            detectionExecutor.execute(() -> handleTagDetection(rawUid, identifier, playbackAllowed));
        } catch (RejectedExecutionException e) {
            log.warn("Detección de {} descartada: el sistema se está apagando", identifier);
        }
    }

    private void onTagRemoved() {
        log.debug("Tag NFC retirado");
    }

    private void handleTagDetection(String rawUid, TagIdentifier identifier, boolean playbackAllowed) {
        try {
            DetectionResult result = associationService.processTagDetection(identifier);

            if (playbackAllowed) {
                dispatcher.publishTagDetected(rawUid);
            } else {
                log.info("Tag {} consumido por la asociación ({}), no se reproduce",
                        identifier, result.getAction().getCode());
            }

            dispatcher.publishAssociationResult(result);
        } catch (Exception e) {
            log.error("Error procesando la detección de {}: {}", identifier, e.getMessage(), e);
        }
    }

    private void runCleanupSweep() {
        try {
            List<AssociationSession> expired = associationService.sweepExpiredSessions();
            for (AssociationSession session : expired) {
                dispatcher.publishSessionEvent(SessionEventDto.of(SessionEventDto.TIMEOUT, session));
            }
            if (!expired.isEmpty()) {
                log.info("{} sesiones de asociación expiradas limpiadas", expired.size());
            }
        } catch (Exception e) {
            log.warn("Error en el barrido de sesiones: {}", e.getMessage(), e);
        }
    }

    private void cancelSweep() {
        if (sweepTask != null && !sweepTask.isDone()) {
            sweepTask.cancel(false);
            log.info("Barrido de sesiones cancelado");
        }
        sweepTask = null;
    }

    /**
     * Cancela las sesiones pendientes y detiene el lector al cerrar la aplicación.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Cerrando el sistema NFC...");

        synchronized (this) {
            cancelSweep();
        }

        for (AssociationSession session : associationService.cancelAllSessions()) {
            dispatcher.publishSessionEvent(SessionEventDto.of(SessionEventDto.CANCELLED, session));
        }

        try {
            hardware.stopDetection();
        } catch (RuntimeException e) {
            log.error("Error deteniendo el lector NFC: {}", e.getMessage());
        }
    }
}
