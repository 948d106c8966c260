package com.drivekb.index;

import com.drivekb.ingest.ChunkMetadata;

public record StoredDocument(String chunkId, String text, ChunkMetadata metadata) {
}
