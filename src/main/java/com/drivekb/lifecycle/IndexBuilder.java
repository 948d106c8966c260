package com.drivekb.lifecycle;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.embedding.EmbeddingProvider;
import com.drivekb.error.EmbeddingProviderException;
import com.drivekb.index.Bm25Parameters;
import com.drivekb.index.EmbeddedChunk;
import com.drivekb.index.KeywordIndex;
import com.drivekb.index.KeywordTokenizer;
import com.drivekb.index.StoredDocument;
import com.drivekb.index.VectorIndex;
import com.drivekb.ingest.Chunker;
import com.drivekb.ingest.DocumentChunk;
import com.drivekb.ingest.SourceDocument;

/**
 * Turns the source document into a populated vector collection and the matching keyword index.
 */
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final Chunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final KeywordTokenizer tokenizer;
    private final Bm25Parameters bm25;

    public IndexBuilder(Chunker chunker, EmbeddingProvider embeddingProvider, KeywordTokenizer tokenizer, Bm25Parameters bm25) {
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.tokenizer = tokenizer;
        this.bm25 = bm25;
    }

    /**
     * Chunks and embeds {@code document}, writes every chunk to {@code target} (which the caller
     * has already reset) and returns a keyword index over the same chunk ids.
     */
    public KeywordIndex build(SourceDocument document, VectorIndex target) {
        List<DocumentChunk> chunks = chunker.chunk(document.id(), document.content());
        log.info("Split {} into {} chunks (size={}, overlap={})",
                document.id(), chunks.size(), chunker.chunkSize(), chunker.chunkOverlap());

        List<String> texts = chunks.stream().map(DocumentChunk::text).toList();
        List<float[]> embeddings = embeddingProvider.embed(texts);
        if (embeddings.size() != chunks.size()) {
            throw new EmbeddingProviderException("build",
                    "expected " + chunks.size() + " embeddings but received " + embeddings.size(), false);
        }

        List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
        List<StoredDocument> stored = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            embedded.add(new EmbeddedChunk(chunk, embeddings.get(i)));
            stored.add(new StoredDocument(chunk.id(), chunk.text(), chunk.metadata()));
        }
        target.upsert(embedded);
        log.info("Wrote {} vectors to collection {}", embedded.size(), target.name());
        return KeywordIndex.build(stored, tokenizer, bm25);
    }

    /**
     * Keyword index over whatever an existing collection holds, used when a populated collection
     * is reused at startup.
     */
    public KeywordIndex keywordIndexFor(VectorIndex source) {
        return KeywordIndex.build(source.getAll(), tokenizer, bm25);
    }

    /**
     * Identifies the settings a collection was built with. A persisted build whose signature
     * differs is not reused.
     */
    public String signature() {
        return embeddingProvider.version() + "/chunk-" + chunker.chunkSize() + "-" + chunker.chunkOverlap();
    }
}
