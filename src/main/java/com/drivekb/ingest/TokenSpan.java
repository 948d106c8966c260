package com.drivekb.ingest;

/**
 * One token of a document, as a half-open character range {@code [start, end)}.
 */
public record TokenSpan(int start, int end) {
}
