package com.drivekb.index;

import com.drivekb.ingest.ChunkMetadata;

public record VectorHit(String chunkId, double distance, String text, ChunkMetadata metadata) {

    /**
     * Cosine similarity, the form the hybrid fusion and the response cache compare on.
     */
    public double similarity() {
        return 1d - distance;
    }
}
