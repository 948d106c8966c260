package com.drivekb.index;

import com.drivekb.ingest.ChunkMetadata;

public record KeywordHit(String chunkId, double score, String text, ChunkMetadata metadata) {
}
