package com.drivekb.embedding;

import java.util.List;

import com.drivekb.runtime.Deadline;

public interface EmbeddingProvider {

    /**
     * Embeds every text, returning one vector per input in input order.
     *
     * @param deadline caller deadline bounding the outbound calls, or {@code null} for none
     */
    List<float[]> embed(List<String> texts, Deadline deadline);

    int dimension();

    default List<float[]> embed(List<String> texts) {
        return embed(texts, null);
    }

    default float[] embed(String text, Deadline deadline) {
        return embed(List.of(text), deadline).get(0);
    }

    default String version() {
        return "unversioned";
    }
}
