package com.drivekb.embedding;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.drivekb.ingest.CjkCharacters;
import com.drivekb.ingest.TextSegmenter;
import com.drivekb.ingest.TokenSpan;
import com.drivekb.runtime.Deadline;

/**
 * Offline provider that hashes tokens and CJK character bigrams into a fixed number of buckets.
 * Deterministic across runs; used for local development and tests.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;
    private final TextSegmenter segmenter = new TextSegmenter();

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<float[]> embed(List<String> texts, Deadline deadline) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "hashing-v1-" + dimension;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String previousCjk = null;
        for (TokenSpan span : segmenter.segment(normalized)) {
            String token = normalized.substring(span.start(), span.end());
            int codePoint = token.codePointAt(0);
            if (CjkCharacters.isCjk(codePoint)) {
                addHashed(vector, "chr:" + token, 0.5f);
                if (previousCjk != null) {
                    addHashed(vector, "bi:" + previousCjk + token, 1.0f);
                }
                previousCjk = token;
                continue;
            }
            previousCjk = null;
            if (Character.isLetterOrDigit(codePoint)) {
                addHashed(vector, "tok:" + token, 1.0f);
            }
        }

        Vectors.normalize(vector);
        return vector;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
