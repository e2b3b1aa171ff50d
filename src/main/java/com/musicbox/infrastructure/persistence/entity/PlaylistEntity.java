package com.musicbox.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entidad JPA que mapea a la tabla playlists.
 */
@Entity
@Table(name = "playlists")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaylistEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "nfc_tag_id", unique = true, length = 50)
    private String nfcTagId;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
