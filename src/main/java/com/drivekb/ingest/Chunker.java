package com.drivekb.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.drivekb.error.ConfigurationException;

/**
 * Sliding-window splitter. Each window holds at most {@code chunkSize} tokens and starts
 * {@code chunkSize - chunkOverlap} tokens after the previous one; the final window keeps whatever
 * tokens remain.
 */
public class Chunker {
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");

    private final int chunkSize;
    private final int chunkOverlap;
    private final TextPreprocessor preprocessor;
    private final TextSegmenter segmenter;

    public Chunker(int chunkSize, int chunkOverlap) {
        this(chunkSize, chunkOverlap, null);
    }

    /**
     * @param preprocessor applied before segmentation, or {@code null} to only normalise whitespace
     */
    public Chunker(int chunkSize, int chunkOverlap, TextPreprocessor preprocessor) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunker", "chunkSize must be positive but was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ConfigurationException("chunker",
                    "chunkOverlap must be in [0, chunkSize) but was " + chunkOverlap + " with chunkSize " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.preprocessor = preprocessor;
        this.segmenter = new TextSegmenter();
    }

    public List<DocumentChunk> chunk(String sourceDocId, String content) {
        String text = normalize(content);
        List<TokenSpan> tokens = segmenter.segment(text);
        List<DocumentChunk> chunks = new ArrayList<>();
        if (tokens.isEmpty()) {
            return chunks;
        }

        int step = chunkSize - chunkOverlap;
        int start = 0;
        int sequenceIndex = 0;
        while (start < tokens.size()) {
            int endExclusive = Math.min(tokens.size(), start + chunkSize);
            int startOffset = tokens.get(start).start();
            int endOffset = tokens.get(endExclusive - 1).end();
            ChunkMetadata metadata = new ChunkMetadata(
                    sourceDocId,
                    sequenceIndex,
                    startOffset,
                    endOffset,
                    endExclusive - start);
            chunks.add(new DocumentChunk(
                    DocumentChunk.idFor(sourceDocId, sequenceIndex),
                    text.substring(startOffset, endOffset),
                    metadata));
            if (endExclusive == tokens.size()) {
                break;
            }
            start += step;
            sequenceIndex++;
        }
        return chunks;
    }

    String normalize(String content) {
        String text = preprocessor == null ? content : preprocessor.preprocess(content);
        return HORIZONTAL_SPACE.matcher(text).replaceAll(" ").strip();
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int chunkOverlap() {
        return chunkOverlap;
    }
}
