package com.drivekb.embedding;

/**
 * Cosine helpers shared by the local vector index and the response cache, so both compare vectors
 * with the same metric as the Chroma collections ({@code hnsw:space = cosine}).
 */
public final class Vectors {
    private Vectors() {
    }

    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        return dot / Math.sqrt(aNorm * bNorm);
    }

    public static double cosineDistance(float[] a, float[] b) {
        return 1d - cosine(a, b);
    }

    public static void normalize(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0d) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
    }
}
