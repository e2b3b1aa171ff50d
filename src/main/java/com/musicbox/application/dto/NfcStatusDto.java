package com.musicbox.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO para el estado completo del sistema NFC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NfcStatusDto {

    private List<AssociationSessionDto> activeSessions;
    private int sessionCount;
    private Map<String, Object> hardware;
    private boolean detecting;
    private boolean sweepRunning;
    private long knownTags;
}
