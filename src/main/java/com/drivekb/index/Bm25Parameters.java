package com.drivekb.index;

/**
 * @param k1 term-frequency saturation
 * @param b  document-length normalisation strength
 */
public record Bm25Parameters(double k1, double b) {
    public static final Bm25Parameters DEFAULT = new Bm25Parameters(1.2, 0.75);
}
