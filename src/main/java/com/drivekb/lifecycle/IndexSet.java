package com.drivekb.lifecycle;

import java.time.Instant;

import com.drivekb.index.KeywordIndex;
import com.drivekb.index.VectorIndex;

/**
 * A vector collection and the keyword index built from the same chunk set, published together.
 */
public record IndexSet(
        VectorIndex vectorIndex,
        KeywordIndex keywordIndex,
        long generation,
        Instant builtAt,
        int documentCount) {
}
