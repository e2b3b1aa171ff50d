package com.musicbox.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vista mínima de una playlist vista desde el lado NFC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistSummary {

    private String id;

    private String title;

    /** UID del tag asociado en la tabla de playlists */
    private String nfcTagId;
}
