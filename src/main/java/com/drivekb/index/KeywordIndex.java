package com.drivekb.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Okapi BM25 over chunk text. Instances are immutable: a changed chunk set means building a new
 * index with {@link #build}, never editing this one.
 */
public final class KeywordIndex {
    private final KeywordTokenizer tokenizer;
    private final Bm25Parameters parameters;
    private final Map<String, List<Posting>> postings;
    private final Map<String, Integer> documentLengths;
    private final Map<String, StoredDocument> documents;
    private final double averageDocumentLength;

    private KeywordIndex(KeywordTokenizer tokenizer,
            Bm25Parameters parameters,
            Map<String, List<Posting>> postings,
            Map<String, Integer> documentLengths,
            Map<String, StoredDocument> documents) {
        this.tokenizer = tokenizer;
        this.parameters = parameters;
        this.postings = postings;
        this.documentLengths = documentLengths;
        this.documents = documents;
        long totalLength = 0;
        for (int length : documentLengths.values()) {
            totalLength += length;
        }
        this.averageDocumentLength = documentLengths.isEmpty() ? 0d : (double) totalLength / documentLengths.size();
    }

    public static KeywordIndex build(List<StoredDocument> chunks, KeywordTokenizer tokenizer, Bm25Parameters parameters) {
        Map<String, List<Posting>> postings = new HashMap<>();
        Map<String, Integer> documentLengths = new LinkedHashMap<>();
        Map<String, StoredDocument> documents = new LinkedHashMap<>();
        for (StoredDocument chunk : chunks) {
            if (documents.containsKey(chunk.chunkId())) {
                throw new IllegalArgumentException("duplicate chunk id " + chunk.chunkId());
            }
            List<String> terms = tokenizer.tokenize(chunk.text());
            Map<String, Integer> frequencies = new LinkedHashMap<>();
            for (String term : terms) {
                frequencies.merge(term, 1, Integer::sum);
            }
            for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
                postings.computeIfAbsent(entry.getKey(), unused -> new ArrayList<>())
                        .add(new Posting(chunk.chunkId(), entry.getValue()));
            }
            documentLengths.put(chunk.chunkId(), terms.size());
            documents.put(chunk.chunkId(), chunk);
        }
        postings.replaceAll((term, list) -> Collections.unmodifiableList(list));
        return new KeywordIndex(tokenizer, parameters, postings, documentLengths, documents);
    }

    public static KeywordIndex empty(KeywordTokenizer tokenizer, Bm25Parameters parameters) {
        return build(List.of(), tokenizer, parameters);
    }

    /**
     * Chunks containing at least one query term, best first. Equal scores are ordered by chunk id.
     */
    public List<KeywordHit> query(String text, int topK) {
        if (topK <= 0 || documents.isEmpty()) {
            return List.of();
        }
        // repeated query terms count once
        Set<String> queryTerms = new LinkedHashSet<>(tokenizer.tokenize(text));
        Map<String, Double> scores = new HashMap<>();
        int documentCount = documents.size();
        for (String term : queryTerms) {
            List<Posting> list = postings.get(term);
            if (list == null) {
                continue;
            }
            double idf = idf(documentCount, list.size());
            for (Posting posting : list) {
                scores.merge(posting.chunkId(), idf * termWeight(posting), Double::sum);
            }
        }

        return scores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topK)
                .map(entry -> {
                    StoredDocument document = documents.get(entry.getKey());
                    return new KeywordHit(entry.getKey(), entry.getValue(), document.text(), document.metadata());
                })
                .toList();
    }

    public int documentCount() {
        return documents.size();
    }

    public double averageDocumentLength() {
        return averageDocumentLength;
    }

    public Set<String> chunkIds() {
        return Collections.unmodifiableSet(documents.keySet());
    }

    public List<Posting> postings(String term) {
        return postings.getOrDefault(term, List.of());
    }

    static double idf(int documentCount, int documentFrequency) {
        return Math.log((documentCount - documentFrequency + 0.5d) / (documentFrequency + 0.5d) + 1d);
    }

    private double termWeight(Posting posting) {
        double tf = posting.termFrequency();
        double k1 = parameters.k1();
        double b = parameters.b();
        double lengthRatio = averageDocumentLength == 0d ? 0d : documentLengths.get(posting.chunkId()) / averageDocumentLength;
        return (tf * (k1 + 1d)) / (tf + k1 * (1d - b + b * lengthRatio));
    }

    public record Posting(String chunkId, int termFrequency) {
    }
}
