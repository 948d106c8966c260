package com.drivekb.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.embedding.Vectors;
import com.drivekb.error.ConfigurationException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.error.VectorStoreException;
import com.drivekb.ingest.ChunkMetadata;
import com.drivekb.runtime.Deadline;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-process vector collection with exact cosine-distance search. When a file is given, the
 * collection is written as JSON after every mutation and read back by {@link #open}.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonVectorIndex.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, IndexedChunk> chunks = new LinkedHashMap<>();
    private final String name;
    private final int dimension;
    private final Path file;

    public LocalJsonVectorIndex(String name, int dimension) {
        this(name, dimension, null);
    }

    public LocalJsonVectorIndex(String name, int dimension, Path file) {
        this.name = name;
        this.dimension = dimension;
        this.file = file;
    }

    public static LocalJsonVectorIndex open(String name, int dimension, Path file) {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex(name, dimension, file);
        if (file == null || !Files.exists(file)) {
            return index;
        }
        List<IndexedChunk> loaded;
        try {
            loaded = index.objectMapper.readValue(file.toFile(), new TypeReference<List<IndexedChunk>>() {
            });
        } catch (IOException e) {
            throw new VectorStoreException("open", "unable to read " + file, e);
        }
        for (IndexedChunk entry : loaded) {
            index.checkDimension("open", entry.embedding());
            index.chunks.put(entry.id(), entry);
        }
        log.info("Loaded {} vectors for collection {} from {}", loaded.size(), name, file);
        return index;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void upsert(List<EmbeddedChunk> embedded) {
        for (EmbeddedChunk item : embedded) {
            checkDimension("upsert", item.embedding());
        }
        for (EmbeddedChunk item : embedded) {
            chunks.put(item.id(), new IndexedChunk(item.id(), item.chunk().text(), item.chunk().metadata(), item.embedding()));
        }
        persist("upsert");
    }

    @Override
    public synchronized List<VectorHit> query(float[] embedding, int topK, Deadline deadline) {
        if (deadline != null && deadline.isExpired()) {
            throw new RetrievalTimeoutException("vector query", deadline.budget());
        }
        checkDimension("query", embedding);
        if (topK <= 0) {
            return List.of();
        }
        return chunks.values().stream()
                .map(indexed -> new VectorHit(indexed.id(), Vectors.cosineDistance(embedding, indexed.embedding()),
                        indexed.text(), indexed.metadata()))
                .sorted(Comparator.comparingDouble(VectorHit::distance).thenComparing(VectorHit::chunkId))
                .limit(topK)
                .toList();
    }

    @Override
    public synchronized void reset() {
        chunks.clear();
        if (file != null) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new VectorStoreException("reset", "unable to delete " + file, e);
            }
        }
    }

    @Override
    public synchronized int count() {
        return chunks.size();
    }

    @Override
    public synchronized List<StoredDocument> getAll() {
        List<StoredDocument> documents = new ArrayList<>(chunks.size());
        for (IndexedChunk indexed : chunks.values()) {
            documents.add(new StoredDocument(indexed.id(), indexed.text(), indexed.metadata()));
        }
        return documents;
    }

    private void checkDimension(String operation, float[] embedding) {
        if (embedding.length != dimension) {
            throw new ConfigurationException(operation, "collection " + name + " holds " + dimension
                    + "-dimensional vectors but received " + embedding.length);
        }
    }

    private void persist(String operation) {
        if (file == null) {
            return;
        }
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writeValue(file.toFile(), chunks.values());
        } catch (IOException e) {
            throw new VectorStoreException(operation, "unable to write " + file, e);
        }
    }

    public record IndexedChunk(String id, String text, ChunkMetadata metadata, float[] embedding) {
    }
}
