package com.drivekb.index;

import java.util.List;

import com.drivekb.runtime.Deadline;

/**
 * A collection of chunk embeddings queried by cosine distance. Entries are written by
 * {@link #upsert} during a build and dropped wholesale by {@link #reset}; they are never edited in
 * place.
 */
public interface VectorIndex {

    String name();

    void upsert(List<EmbeddedChunk> chunks);

    /**
     * Nearest neighbours ordered by ascending distance. A {@code topK} larger than the collection
     * returns every entry.
     *
     * @param deadline caller deadline, or {@code null} for none
     */
    List<VectorHit> query(float[] embedding, int topK, Deadline deadline);

    /**
     * Drops and recreates the backing collection. A collection that does not exist is not an error.
     */
    void reset();

    int count();

    List<StoredDocument> getAll();
}
