package com.musicbox.presentation.controller;

import com.musicbox.application.dto.AssociationSessionDto;
import com.musicbox.application.dto.NfcStatusDto;
import com.musicbox.application.service.NfcApplicationService;
import com.musicbox.domain.exception.ConflictException;
import com.musicbox.domain.exception.HardwareException;
import com.musicbox.domain.exception.NotFoundException;
import com.musicbox.domain.exception.ValidationException;
import com.musicbox.infrastructure.mock.MockNfcReaderAdapter;
import com.musicbox.presentation.websocket.NfcWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Controlador REST para la asociación de tags NFC con playlists.
 */
@RestController
@RequestMapping("/api/nfc")
@RequiredArgsConstructor
@Slf4j
public class NfcController {

    private final NfcApplicationService nfcApplicationService;
    private final NfcWebSocketHandler webSocketHandler;
    private final Optional<MockNfcReaderAdapter> mockReader;

    /**
     * Inicia una sesión de asociación: el próximo tag leído se asocia a la
     * playlist.
     * 
     * @param request Objeto con playlistId, timeoutSeconds y overrideMode
     * @return Sesión creada
     */
    @PostMapping("/associate")
    public ResponseEntity<Map<String, Object>> startAssociation(@RequestBody AssociateRequest request) {
        try {
            log.info("Iniciando asociación para playlist {}", request.playlistId());
            AssociationSessionDto session = nfcApplicationService.startAssociationUseCase(
                    request.playlistId(), request.timeoutSeconds(), Boolean.TRUE.equals(request.overrideMode()));

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "Acerque un tag NFC al lector");
            response.put("session", session);
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("iniciando asociación", e);
        }
    }

    /**
     * Detiene una sesión de asociación en curso.
     */
    @DeleteMapping("/session/{sessionId}")
    public ResponseEntity<Map<String, Object>> stopAssociation(@PathVariable String sessionId) {
        try {
            boolean stopped = nfcApplicationService.stopAssociationUseCase(sessionId);
            AssociationSessionDto session = nfcApplicationService.getSessionUseCase(sessionId);

            String message;
            if (stopped) {
                message = "Sesión detenida";
            } else if (session.isClaimed()) {
                message = "La sesión está terminando de asociar el tag " + session.getDetectedTag();
            } else {
                message = "La sesión ya había terminado (" + session.getState() + ")";
            }

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("stopped", stopped);
            response.put("message", message);
            response.put("session", session);
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("deteniendo sesión", e);
        }
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<Map<String, Object>> getSession(@PathVariable String sessionId) {
        try {
            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("session", nfcApplicationService.getSessionUseCase(sessionId));
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("consultando sesión", e);
        }
    }

    /**
     * Estado del sistema NFC: lector, sesiones activas y clientes conectados.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        NfcStatusDto status = nfcApplicationService.getStatusUseCase();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("status", status);
        response.put("websocketClients", webSocketHandler.getConnectedClients());
        return ResponseEntity.ok(response);
    }

    /**
     * Quita la asociación de un tag.
     * 
     * @param tagId UID del tag, en cualquier formato
     */
    @DeleteMapping("/associate/{tagId}")
    public ResponseEntity<Map<String, Object>> dissociate(@PathVariable String tagId) {
        try {
            nfcApplicationService.dissociateUseCase(tagId);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "Tag desasociado");
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("desasociando tag", e);
        }
    }

    @PostMapping("/system/start")
    public ResponseEntity<Map<String, Object>> startSystem() {
        try {
            NfcStatusDto status = nfcApplicationService.startSystem();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "Sistema NFC iniciado");
            response.put("status", status);
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("iniciando sistema", e);
        }
    }

    @PostMapping("/system/stop")
    public ResponseEntity<Map<String, Object>> stopSystem() {
        try {
            nfcApplicationService.stopSystem();

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "Sistema NFC detenido");
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            return errorResponse("deteniendo sistema", e);
        }
    }

    /**
     * Simula la lectura de un tag. Solo disponible con {@code nfc.hardware=mock}.
     */
    @PostMapping("/simulate/{uid}")
    public ResponseEntity<Map<String, Object>> simulateTag(@PathVariable String uid) {
        Map<String, Object> response = new HashMap<>();

        if (mockReader.isEmpty()) {
            response.put("success", false);
            response.put("message", "Simulación disponible solo con el lector simulado");
            response.put("errorType", "UnsupportedOperation");
            return ResponseEntity.badRequest().body(response);
        }

        if (!mockReader.get().simulateTagDetection(uid)) {
            response.put("success", false);
            response.put("message", "El lector simulado no está detectando");
            response.put("errorType", "HardwareException");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }

        response.put("success", true);
        response.put("message", "Tag simulado: " + uid);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(String operation, RuntimeException e) {
        HttpStatus status;
        if (e instanceof ValidationException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (e instanceof NotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof ConflictException) {
            status = HttpStatus.CONFLICT;
        } else if (e instanceof HardwareException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Error {}: {}", operation, e.getMessage(), e);
        }

        if (status != HttpStatus.INTERNAL_SERVER_ERROR) {
            log.warn("Error {}: {}", operation, e.getMessage());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("message", e.getMessage());
        response.put("errorType", e.getClass().getSimpleName());
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Request para iniciar una asociación.
     */
    public record AssociateRequest(String playlistId, Integer timeoutSeconds, Boolean overrideMode) {
    }
}
