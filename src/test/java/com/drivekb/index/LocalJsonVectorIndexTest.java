package com.drivekb.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.drivekb.error.ConfigurationException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.ingest.ChunkMetadata;
import com.drivekb.ingest.DocumentChunk;
import com.drivekb.runtime.Deadline;

class LocalJsonVectorIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnNearestChunksByAscendingCosineDistance() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex("car_manual", 3);
        index.upsert(List.of(
                embedded("c0", "brake", 1f, 0f, 0f),
                embedded("c1", "tire", 0f, 1f, 0f),
                embedded("c2", "brake and tire", 1f, 1f, 0f)));

        List<VectorHit> hits = index.query(new float[] { 1f, 0f, 0f }, 2, null);

        assertEquals(List.of("c0", "c2"), hits.stream().map(VectorHit::chunkId).toList());
        assertEquals(0d, hits.get(0).distance(), 1e-6);
        assertEquals(1d - Math.sqrt(0.5), hits.get(1).distance(), 1e-6);
        assertEquals(1d, hits.get(0).similarity(), 1e-6);
        assertEquals("brake", hits.get(0).text());
    }

    @Test
    void shouldReturnEveryEntryWhenTopKExceedsCollection() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex("car_manual", 3);
        index.upsert(List.of(embedded("c0", "only", 0f, 0f, 1f)));

        assertEquals(1, index.query(new float[] { 1f, 0f, 0f }, 50, null).size());
    }

    @Test
    void shouldRejectVectorsOfAnotherDimension() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex("car_manual", 3);

        assertThrows(ConfigurationException.class, () -> index.upsert(List.of(embedded("c0", "x", 1f, 0f))));
        assertThrows(ConfigurationException.class, () -> index.query(new float[] { 1f }, 1, null));
        assertEquals(0, index.count());
    }

    @Test
    void shouldPersistAndReloadCollection() {
        Path file = tempDir.resolve("vectors/car_manual.json");
        LocalJsonVectorIndex index = LocalJsonVectorIndex.open("car_manual", 3, file);
        index.upsert(List.of(embedded("c0", "brake", 1f, 0f, 0f), embedded("c1", "tire", 0f, 1f, 0f)));
        assertTrue(Files.exists(file));

        LocalJsonVectorIndex reloaded = LocalJsonVectorIndex.open("car_manual", 3, file);

        assertEquals(2, reloaded.count());
        List<StoredDocument> all = reloaded.getAll();
        assertEquals(List.of("c0", "c1"), all.stream().map(StoredDocument::chunkId).toList());
        assertEquals(new ChunkMetadata("manual.txt", 0, 0, 5, 1), all.get(0).metadata());
        assertEquals("c1", reloaded.query(new float[] { 0f, 1f, 0f }, 1, null).get(0).chunkId());

        reloaded.reset();
        assertEquals(0, reloaded.count());
        assertFalse(Files.exists(file));
    }

    @Test
    void shouldResetMissingCollectionWithoutError() {
        LocalJsonVectorIndex index = LocalJsonVectorIndex.open("never_built", 3, tempDir.resolve("never_built.json"));

        index.reset();

        assertEquals(0, index.count());
    }

    @Test
    void shouldHonourExpiredDeadline() {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex("car_manual", 3);

        assertThrows(RetrievalTimeoutException.class,
                () -> index.query(new float[] { 1f, 0f, 0f }, 1, Deadline.after(Duration.ZERO)));
    }

    static EmbeddedChunk embedded(String id, String text, float... vector) {
        ChunkMetadata metadata = new ChunkMetadata("manual.txt", 0, 0, text.length(), 1);
        return new EmbeddedChunk(new DocumentChunk(id, text, metadata), vector);
    }
}
