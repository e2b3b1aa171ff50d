package com.musicbox.infrastructure.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicbox.domain.exception.CsvProcessingException;
import com.musicbox.domain.model.NfcTag;
import com.musicbox.domain.model.TagIdentifier;
import com.musicbox.domain.port.TagRepository;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adaptador para gestionar el archivo nfc_tags.csv.
 * Mantiene los tags en una cache en memoria y reescribe el archivo en cada
 * guardado. Devuelve copias para que nadie mute la cache sin pasar por
 * {@link #save(NfcTag)}.
 */
@Component
@Slf4j
public class CsvTagRegistryAdapter implements TagRepository {

    private static final String[] CSV_HEADER = {
            "uid", "associated_playlist_id", "last_detected_at", "detection_count", "metadata" };
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final String tagRegistryPath;
    private final ObjectMapper objectMapper = new ObjectMapper();

    // Cache en memoria para acceso rápido (thread-safe)
    private final Map<TagIdentifier, NfcTag> tagsCache = new ConcurrentHashMap<>();

    public CsvTagRegistryAdapter(@Value("${csv.tag-registry-path:./data/nfc_tags.csv}") String tagRegistryPath) {
        this.tagRegistryPath = tagRegistryPath;
    }

    @PostConstruct
    public void init() {
        ensureFileExists();
        loadFromFile();
    }

    /**
     * Asegura que el archivo CSV existe con el header correcto.
     */
    private void ensureFileExists() {
        Path path = Paths.get(tagRegistryPath);

        try {
            if (path.getParent() != null && !Files.exists(path.getParent())) {
                Files.createDirectories(path.getParent());
                log.info("Directorio creado: {}", path.getParent());
            }

            if (!Files.exists(path)) {
                try (CSVWriter writer = new CSVWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8))) {
                    writer.writeNext(CSV_HEADER);
                }
                log.info("Archivo de tags creado: {}", path);
            }
        } catch (IOException e) {
            throw CsvProcessingException.cannotCreate(tagRegistryPath, e);
        }
    }

    /**
     * Carga los tags desde el archivo CSV a la cache en memoria.
     */
    private synchronized void loadFromFile() {
        tagsCache.clear();
        Path path = Paths.get(tagRegistryPath);

        try (CSVReader reader = new CSVReader(new FileReader(path.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();

            // Saltar header
            for (int i = 1; i < lines.size(); i++) {
                try {
                    NfcTag tag = parseLine(lines.get(i));
                    tagsCache.put(tag.getIdentifier(), tag);
                } catch (RuntimeException e) {
                    log.warn("Error parseando línea {} del archivo de tags: {}", i + 1, e.getMessage());
                }
            }

            log.info("Cargados {} tags desde {}", tagsCache.size(), tagRegistryPath);

        } catch (IOException | CsvException e) {
            log.error("Error leyendo el archivo de tags {}: {}", tagRegistryPath, e.getMessage());
        }
    }

    /**
     * Guarda todos los tags de la cache al archivo CSV.
     */
    private synchronized void saveToFile() {
        Path path = Paths.get(tagRegistryPath);

        try (CSVWriter writer = new CSVWriter(new FileWriter(path.toFile(), StandardCharsets.UTF_8))) {
            writer.writeNext(CSV_HEADER);

            for (NfcTag tag : tagsCache.values()) {
                writer.writeNext(toLine(tag));
            }

            log.debug("Guardados {} tags en {}", tagsCache.size(), tagRegistryPath);

        } catch (IOException e) {
            log.error("Error escribiendo el archivo de tags: {}", e.getMessage());
            throw CsvProcessingException.cannotWrite(tagRegistryPath, e);
        }
    }

    private String[] toLine(NfcTag tag) {
        return new String[] {
                tag.getIdentifier().uid(),
                tag.getAssociatedPlaylistId() != null ? tag.getAssociatedPlaylistId() : "",
                tag.getLastDetectedAt() != null ? tag.getLastDetectedAt().toString() : "",
                String.valueOf(tag.getDetectionCount()),
                writeMetadata(tag.getMetadata())
        };
    }

    /**
     * Parsea una línea CSV a un NfcTag.
     */
    private NfcTag parseLine(String[] fields) {
        TagIdentifier identifier = TagIdentifier.parse(fields[0]);

        String playlistId = fields.length > 1 && !fields[1].isBlank() ? fields[1].trim() : null;

        Instant lastDetectedAt = null;
        if (fields.length > 2 && !fields[2].isBlank()) {
            try {
                lastDetectedAt = Instant.parse(fields[2].trim());
            } catch (DateTimeParseException e) {
                log.debug("Error parseando fecha: {}", fields[2]);
            }
        }

        long detectionCount = fields.length > 3 && !fields[3].isBlank() ? Long.parseLong(fields[3].trim()) : 0;
        Map<String, Object> metadata = fields.length > 4 ? readMetadata(fields[4]) : new LinkedHashMap<>();

        return NfcTag.builder()
                .identifier(identifier)
                .associatedPlaylistId(playlistId)
                .lastDetectedAt(lastDetectedAt)
                .detectionCount(detectionCount)
                .metadata(metadata)
                .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Metadata no serializable, se descarta: {}", e.getMessage());
            return "";
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Error parseando metadata: {}", json);
            return new LinkedHashMap<>();
        }
    }

    @Override
    public Optional<NfcTag> findByIdentifier(TagIdentifier identifier) {
        return Optional.ofNullable(tagsCache.get(identifier)).map(this::copyOf);
    }

    /**
     * Guarda el tag y reescribe el archivo. Si la escritura falla, la cache
     * vuelve al estado anterior para que coincida con lo que hay en disco.
     *
     * @throws CsvProcessingException si no se puede escribir el archivo
     */
    @Override
    public synchronized void save(NfcTag tag) {
        NfcTag previous = tagsCache.put(tag.getIdentifier(), copyOf(tag));
        try {
            saveToFile();
        } catch (CsvProcessingException e) {
            if (previous != null) {
                tagsCache.put(tag.getIdentifier(), previous);
            } else {
                tagsCache.remove(tag.getIdentifier());
            }
            throw e;
        }
        log.debug("Tag guardado: {} -> {}", tag.getIdentifier(), tag.getAssociatedPlaylistId());
    }

    @Override
    public List<NfcTag> findAll() {
        List<NfcTag> tags = new ArrayList<>();
        for (NfcTag tag : tagsCache.values()) {
            tags.add(copyOf(tag));
        }
        return tags;
    }

    @Override
    public long count() {
        return tagsCache.size();
    }

    /**
     * Recarga los tags desde el archivo.
     */
    public void reload() {
        loadFromFile();
    }

    private NfcTag copyOf(NfcTag tag) {
        return NfcTag.builder()
                .identifier(tag.getIdentifier())
                .associatedPlaylistId(tag.getAssociatedPlaylistId())
                .lastDetectedAt(tag.getLastDetectedAt())
                .detectionCount(tag.getDetectionCount())
                .metadata(new LinkedHashMap<>(tag.getMetadata()))
                .build();
    }
}
