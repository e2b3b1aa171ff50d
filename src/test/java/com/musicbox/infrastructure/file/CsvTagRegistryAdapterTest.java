package com.musicbox.infrastructure.file;

import com.musicbox.domain.exception.CsvProcessingException;
import com.musicbox.domain.model.NfcTag;
import com.musicbox.domain.model.TagIdentifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTagRegistryAdapterTest {

    @TempDir
    Path tempDir;

    private CsvTagRegistryAdapter open(Path file) {
        CsvTagRegistryAdapter adapter = new CsvTagRegistryAdapter(file.toString());
        adapter.init();
        return adapter;
    }

    @Test
    void createsFileWithHeader() throws Exception {
        Path file = tempDir.resolve("data/nfc_tags.csv");

        CsvTagRegistryAdapter adapter = open(file);

        assertTrue(Files.exists(file));
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("uid"));
        assertEquals(0, adapter.count());
    }

    @Test
    void savedTagsSurviveReopen() {
        Path file = tempDir.resolve("nfc_tags.csv");
        CsvTagRegistryAdapter adapter = open(file);

        NfcTag tag = NfcTag.create(TagIdentifier.parse("04:F7:ED:A4"));
        tag.markDetected(Instant.parse("2025-01-01T10:00:00Z"));
        tag.markDetected(Instant.parse("2025-01-01T10:05:00Z"));
        tag.associateWithPlaylist("p1");
        tag.getMetadata().put("label", "Dormir");
        adapter.save(tag);
        adapter.save(NfcTag.create(TagIdentifier.parse("abcd1234")));

        CsvTagRegistryAdapter reopened = open(file);

        assertEquals(2, reopened.count());
        NfcTag loaded = reopened.findByIdentifier(TagIdentifier.parse("04f7eda4")).orElseThrow();
        assertEquals("p1", loaded.getAssociatedPlaylistId());
        assertEquals(2, loaded.getDetectionCount());
        assertEquals(Instant.parse("2025-01-01T10:05:00Z"), loaded.getLastDetectedAt());
        assertEquals("Dormir", loaded.getMetadata().get("label"));

        NfcTag fresh = reopened.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow();
        assertNull(fresh.getAssociatedPlaylistId());
        assertNull(fresh.getLastDetectedAt());
        assertTrue(fresh.getMetadata().isEmpty());
    }

    @Test
    void returnedTagsAreCopies() {
        CsvTagRegistryAdapter adapter = open(tempDir.resolve("nfc_tags.csv"));
        adapter.save(NfcTag.create(TagIdentifier.parse("abcd1234")));

        NfcTag tag = adapter.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow();
        tag.associateWithPlaylist("p9");

        assertNull(adapter.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow()
                .getAssociatedPlaylistId());
    }

    @Test
    void skipsMalformedRows() throws Exception {
        Path file = tempDir.resolve("nfc_tags.csv");
        Files.write(file, List.of(
                "uid,associated_playlist_id,last_detected_at,detection_count,metadata",
                "zz,p1,,1,",
                "abcd1234,p2,not-a-date,3,{broken",
                "04f7eda4,,,x,"), StandardCharsets.UTF_8);

        CsvTagRegistryAdapter adapter = open(file);

        assertEquals(1, adapter.count());
        NfcTag tag = adapter.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow();
        assertEquals("p2", tag.getAssociatedPlaylistId());
        assertEquals(3, tag.getDetectionCount());
        assertNull(tag.getLastDetectedAt());
        assertTrue(tag.getMetadata().isEmpty());
    }

    @Test
    void reloadPicksUpExternalChanges() throws Exception {
        Path file = tempDir.resolve("nfc_tags.csv");
        CsvTagRegistryAdapter adapter = open(file);
        Files.write(file, List.of(
                "uid,associated_playlist_id,last_detected_at,detection_count,metadata",
                "abcd1234,p1,,1,"), StandardCharsets.UTF_8);

        adapter.reload();

        assertEquals(1, adapter.findAll().size());
    }

    @Test
    void failedWriteLeavesCacheAsBefore() throws Exception {
        Path file = tempDir.resolve("nfc_tags.csv");
        CsvTagRegistryAdapter adapter = open(file);
        adapter.save(NfcTag.create(TagIdentifier.parse("abcd1234")));

        // un directorio en lugar del archivo hace fallar la escritura
        Files.delete(file);
        Files.createDirectory(file);

        NfcTag bound = adapter.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow();
        bound.associateWithPlaylist("p1");
        assertThrows(CsvProcessingException.class, () -> adapter.save(bound));
        assertNull(adapter.findByIdentifier(TagIdentifier.parse("abcd1234")).orElseThrow().getAssociatedPlaylistId());

        NfcTag fresh = NfcTag.create(TagIdentifier.parse("04f7eda4"));
        assertThrows(CsvProcessingException.class, () -> adapter.save(fresh));
        assertTrue(adapter.findByIdentifier(TagIdentifier.parse("04f7eda4")).isEmpty());
        assertEquals(1, adapter.count());
    }
}
