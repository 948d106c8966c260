package com.drivekb.index;

import com.drivekb.ingest.DocumentChunk;

public record EmbeddedChunk(DocumentChunk chunk, float[] embedding) {

    public String id() {
        return chunk.id();
    }
}
