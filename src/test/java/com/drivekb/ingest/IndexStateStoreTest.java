package com.drivekb.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.drivekb.ingest.IndexStateStore.BuildState;

class IndexStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistLastBuildAndIgnoreUnknownFields() throws Exception {
        Path path = tempDir.resolve("nested/index-state.json");
        IndexStateStore store = new IndexStateStore(path);
        assertTrue(store.load().isEmpty());

        BuildState state = new BuildState("car_manual_b", 42, "abc123", "hashing-v1-64/chunk-300-100", 1_700_000_000_000L);
        store.save(state);

        assertEquals(state, store.load().orElseThrow());

        Files.writeString(path, Files.readString(path).replace("{", "{\"legacyField\":true,"));
        assertEquals(state, store.load().orElseThrow());
    }

    @Test
    void shouldDoNothingWithoutPath() throws Exception {
        IndexStateStore store = new IndexStateStore(null);

        store.save(new BuildState("car_manual", 1, "f", "s", 0L));

        assertTrue(store.load().isEmpty());
    }

    @Test
    void shouldReplaceTruncatedFileWithoutLeavingTemporaryCopy() throws Exception {
        Path path = tempDir.resolve("index-state.json");
        Files.writeString(path, "{\"activeCollection\":\"car_ma");
        IndexStateStore store = new IndexStateStore(path);
        assertThrows(IOException.class, store::load);

        BuildState state = new BuildState("car_manual", 7, "f", "s", 1L);
        store.save(state);

        assertEquals(state, store.load().orElseThrow());
        assertFalse(Files.exists(tempDir.resolve("index-state.json.tmp")));
    }

    @Test
    void shouldFingerprintSourceDocumentContent() throws Exception {
        Path manual = tempDir.resolve("manual.txt");
        Files.writeString(manual, "abc");

        SourceDocument document = SourceDocument.read(manual);

        assertEquals("manual.txt", document.id());
        assertEquals("abc", document.content());
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", document.fingerprint());
    }
}
