package com.musicbox.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Modelo de dominio que representa un intento de asociar un tag a una playlist
 * dentro de una ventana de tiempo.
 * <p>
 * La expiración no se programa: {@link #isActive()} y {@link #isExpired()} se
 * calculan con el reloj en cada lectura. Solo {@code AssociationService} muta
 * las sesiones.
 */
@Getter
@ToString(exclude = "clock")
public class AssociationSession {

    private final String sessionId;
    private final String playlistId;
    private final Instant startedAt;
    private final int timeoutSeconds;
    private final boolean overrideMode;
    private final Clock clock;

    private volatile SessionState state;
    private volatile TagIdentifier detectedTag;
    private String conflictPlaylistId;
    private String errorMessage;

    private AssociationSession(String playlistId, int timeoutSeconds, boolean overrideMode, Clock clock) {
        this.sessionId = UUID.randomUUID().toString();
        this.playlistId = playlistId;
        this.timeoutSeconds = timeoutSeconds;
        this.overrideMode = overrideMode;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.state = SessionState.LISTENING;
    }

    /**
     * Crea una nueva sesión en estado LISTENING.
     *
     * @param playlistId     Playlist a asociar
     * @param timeoutSeconds Duración de la ventana de escucha
     * @param overrideMode   Si se permite reasignar un tag ya asociado
     * @param clock          Reloj usado para calcular la expiración
     * @return Nueva sesión
     */
    public static AssociationSession start(String playlistId, int timeoutSeconds, boolean overrideMode, Clock clock) {
        return new AssociationSession(playlistId, timeoutSeconds, overrideMode, clock);
    }

    public Instant getTimeoutAt() {
        return startedAt.plusSeconds(timeoutSeconds);
    }

    /**
     * La sesión está activa si sigue escuchando y no ha vencido.
     */
    public boolean isActive() {
        return state == SessionState.LISTENING && clock.instant().isBefore(getTimeoutAt());
    }

    /**
     * La ventana de escucha ha vencido, sea cual sea el estado.
     */
    public boolean isExpired() {
        return !clock.instant().isBefore(getTimeoutAt());
    }

    /**
     * Indica si la sesión ya capturó un tag y espera la sincronización con la
     * playlist. Una sesión reclamada sigue en LISTENING pero no acepta otro tag.
     */
    public boolean isClaimed() {
        return state == SessionState.LISTENING && detectedTag != null;
    }

    /**
     * Segundos que quedan antes del timeout (0 si ya venció).
     */
    public long secondsRemaining() {
        long remaining = Duration.between(clock.instant(), getTimeoutAt()).getSeconds();
        return Math.max(0, remaining);
    }

    /**
     * Reserva la sesión para el tag detectado mientras se sincroniza la playlist.
     */
    public void claim(TagIdentifier tag) {
        requireListening("claim");
        this.detectedTag = tag;
    }

    public void markSuccessful(TagIdentifier tag) {
        requireListening(SessionState.SUCCESS.name());
        this.detectedTag = tag;
        this.state = SessionState.SUCCESS;
    }

    public void markDuplicate(TagIdentifier tag, String existingPlaylistId) {
        requireListening(SessionState.DUPLICATE.name());
        this.detectedTag = tag;
        this.conflictPlaylistId = existingPlaylistId;
        this.state = SessionState.DUPLICATE;
    }

    public void markStopped() {
        requireListening(SessionState.STOPPED.name());
        this.state = SessionState.STOPPED;
    }

    public void markTimeout() {
        requireListening(SessionState.TIMEOUT.name());
        this.state = SessionState.TIMEOUT;
    }

    public void markCancelled() {
        requireListening(SessionState.CANCELLED.name());
        this.state = SessionState.CANCELLED;
    }

    public void markError(String message) {
        requireListening(SessionState.ERROR.name());
        this.errorMessage = message;
        this.state = SessionState.ERROR;
    }

    private void requireListening(String target) {
        if (state != SessionState.LISTENING) {
            throw new IllegalStateException(
                    String.format("Sesión %s en estado terminal %s, no puede pasar a %s", sessionId, state, target));
        }
    }
}
