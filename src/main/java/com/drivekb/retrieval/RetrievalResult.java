package com.drivekb.retrieval;

import java.util.List;

public record RetrievalResult(String query, List<RankedChunk> chunks, boolean degraded, String degradationReason) {

    public RetrievalResult {
        chunks = List.copyOf(chunks);
    }

    public static RetrievalResult complete(String query, List<RankedChunk> chunks) {
        return new RetrievalResult(query, chunks, false, null);
    }

    public static RetrievalResult degraded(String query, List<RankedChunk> chunks, String reason) {
        return new RetrievalResult(query, chunks, true, reason);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
