package com.drivekb.ingest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Closed metadata schema stored next to every chunk in both indexes. Offsets point into the
 * preprocessed document text.
 */
public record ChunkMetadata(
        String sourceDocId,
        int sequenceIndex,
        int startOffset,
        int endOffset,
        int tokenCount) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sourceDocId", sourceDocId);
        map.put("sequenceIndex", sequenceIndex);
        map.put("startOffset", startOffset);
        map.put("endOffset", endOffset);
        map.put("tokenCount", tokenCount);
        return map;
    }

    /**
     * Reads metadata returned by a vector store. Numbers may come back as any numeric type, missing
     * fields read as empty or zero.
     */
    public static ChunkMetadata fromMap(Map<String, ?> map) {
        if (map == null) {
            return new ChunkMetadata("", 0, 0, 0, 0);
        }
        Object sourceDocId = map.get("sourceDocId");
        return new ChunkMetadata(
                sourceDocId == null ? "" : sourceDocId.toString(),
                intValue(map.get("sequenceIndex")),
                intValue(map.get("startOffset")),
                intValue(map.get("endOffset")),
                intValue(map.get("tokenCount")));
    }

    private static int intValue(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && text.strip().matches("-?\\d{1,9}")) {
            return Integer.parseInt(text.strip());
        }
        return 0;
    }
}
