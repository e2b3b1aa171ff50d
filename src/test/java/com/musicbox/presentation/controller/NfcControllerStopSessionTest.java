package com.musicbox.presentation.controller;

import com.musicbox.application.dto.AssociationSessionDto;
import com.musicbox.application.service.NfcApplicationService;
import com.musicbox.presentation.websocket.NfcWebSocketHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Respuestas de DELETE /session/{id} según el estado en que queda la sesión.
 */
class NfcControllerStopSessionTest {

    private NfcApplicationService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(NfcApplicationService.class);
        NfcController controller = new NfcController(service, mock(NfcWebSocketHandler.class), Optional.empty());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void stoppedSessionIsReported() throws Exception {
        when(service.stopAssociationUseCase("s1")).thenReturn(true);
        when(service.getSessionUseCase("s1")).thenReturn(AssociationSessionDto.builder()
                .sessionId("s1").state("STOPPED").build());

        mockMvc.perform(delete("/api/nfc/session/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.message").value("Sesión detenida"));
    }

    @Test
    void claimedSessionIsReportedAsFinishing() throws Exception {
        when(service.stopAssociationUseCase("s1")).thenReturn(false);
        when(service.getSessionUseCase("s1")).thenReturn(AssociationSessionDto.builder()
                .sessionId("s1").state("LISTENING").claimed(true).detectedTag("04f7eda4df6181").build());

        mockMvc.perform(delete("/api/nfc/session/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(false))
                .andExpect(jsonPath("$.message", containsString("terminando de asociar el tag 04f7eda4df6181")))
                .andExpect(jsonPath("$.message", not(containsString("ya había terminado"))))
                .andExpect(jsonPath("$.session.claimed").value(true));
    }

    @Test
    void finishedSessionReportsItsState() throws Exception {
        when(service.stopAssociationUseCase("s1")).thenReturn(false);
        when(service.getSessionUseCase("s1")).thenReturn(AssociationSessionDto.builder()
                .sessionId("s1").state("SUCCESS").build());

        mockMvc.perform(delete("/api/nfc/session/s1"))
                .andExpect(jsonPath("$.message").value("La sesión ya había terminado (SUCCESS)"));
    }
}
