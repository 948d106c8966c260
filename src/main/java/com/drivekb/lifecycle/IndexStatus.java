package com.drivekb.lifecycle;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the knowledge base, safe to read while a build is running.
 *
 * @param documentCount        chunks in the active vector collection
 * @param keywordDocumentCount chunks in the active keyword index
 * @param lastBuildTime        when the active index set was built, or {@code null}
 * @param failureCause         message of the failure that moved the lifecycle to FAILED
 * @param configWarnings       non-fatal configuration warnings, empty when there are none
 */
public record IndexStatus(
        IndexState state,
        int documentCount,
        int keywordDocumentCount,
        int cacheSize,
        Instant lastBuildTime,
        String activeCollection,
        String failureCause,
        List<String> configWarnings) {

    public IndexStatus {
        configWarnings = configWarnings == null ? List.of() : List.copyOf(configWarnings);
    }

    public IndexStatus withRuntime(int cacheSize, List<String> configWarnings) {
        return new IndexStatus(state, documentCount, keywordDocumentCount, cacheSize, lastBuildTime, activeCollection,
                failureCause, configWarnings);
    }

    public boolean isReady() {
        return state == IndexState.READY;
    }
}
