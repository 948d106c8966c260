package com.drivekb.retrieval;

import com.drivekb.ingest.ChunkMetadata;

/**
 * One fused result. {@code vectorScore} and {@code keywordScore} are the min–max normalised side
 * scores that went into {@code fusedScore}; a side that did not return the chunk contributes 0.
 */
public record RankedChunk(
        String chunkId,
        double fusedScore,
        double vectorScore,
        double keywordScore,
        String text,
        ChunkMetadata metadata) {
}
