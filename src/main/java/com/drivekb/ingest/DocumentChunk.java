package com.drivekb.ingest;

public record DocumentChunk(String id, String text, ChunkMetadata metadata) {

    public static String idFor(String sourceDocId, int sequenceIndex) {
        return sourceDocId + "#chunk_" + sequenceIndex;
    }
}
