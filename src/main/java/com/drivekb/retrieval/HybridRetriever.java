package com.drivekb.retrieval;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.embedding.EmbeddingProvider;
import com.drivekb.error.ConfigurationException;
import com.drivekb.error.RetrievalException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.index.KeywordHit;
import com.drivekb.index.VectorHit;
import com.drivekb.ingest.ChunkMetadata;
import com.drivekb.lifecycle.IndexSet;
import com.drivekb.runtime.AppConfig;
import com.drivekb.runtime.Deadline;

/**
 * Runs the vector and BM25 searches for a query side by side and fuses their rankings. Each side's
 * scores are min–max scaled over its own candidates, then combined as
 * {@code w * vector + (1 - w) * keyword}.
 *
 * <p>A side that fails or exceeds the sub-query timeout is dropped and the result is marked
 * degraded. Expiry of the caller's deadline is an error.
 */
public class HybridRetriever implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final Supplier<IndexSet> indexes;
    private final EmbeddingProvider embeddingProvider;
    private final AppConfig.SearchConfig config;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Clock clock;

    public HybridRetriever(Supplier<IndexSet> indexes, EmbeddingProvider embeddingProvider, AppConfig.SearchConfig config) {
        this(indexes, embeddingProvider, config, Executors.newCachedThreadPool(new RetrievalThreadFactory()), true,
                Clock.systemUTC());
    }

    HybridRetriever(Supplier<IndexSet> indexes,
            EmbeddingProvider embeddingProvider,
            AppConfig.SearchConfig config,
            ExecutorService executor,
            boolean ownsExecutor,
            Clock clock) {
        this.indexes = indexes;
        this.embeddingProvider = embeddingProvider;
        this.config = config;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.clock = clock;
    }

    public RetrievalResult query(String text, int topK) {
        return query(text, topK, RetrievalMode.HYBRID, null);
    }

    /**
     * @param topK     values {@code <= 0} use the configured default; larger values are clamped to
     *                 the configured maximum
     * @param deadline caller deadline, or {@code null} for the configured request timeout
     * @throws com.drivekb.error.IndexNotReadyException when no index set is published
     * @throws RetrievalTimeoutException                when the deadline expires first
     * @throws RetrievalException                       when every requested side fails
     */
    public RetrievalResult query(String text, int topK, RetrievalMode mode, Deadline deadline) {
        IndexSet indexSet = indexes.get();
        Deadline effective = deadline != null
                ? deadline
                : Deadline.after(Duration.ofMillis(config.getRequestTimeoutMs()), clock);
        if (effective.isExpired()) {
            throw new RetrievalTimeoutException("query", effective.budget());
        }

        int k = resolveTopK(topK);
        int pool = Math.max(k, config.getCandidatePoolSize());
        Deadline subQueryDeadline = Deadline.after(effective.cap(Duration.ofMillis(config.getSubQueryTimeoutMs())), clock);

        Future<List<VectorHit>> vectorFuture = mode == RetrievalMode.KEYWORD
                ? null
                : executor.submit(() -> vectorSearch(indexSet, text, pool, effective));
        Future<List<KeywordHit>> keywordFuture = mode == RetrievalMode.VECTOR
                ? null
                : executor.submit(() -> indexSet.keywordIndex().query(text, pool));

        SubQuery<List<VectorHit>> vector;
        SubQuery<List<KeywordHit>> keyword;
        try {
            vector = await("vector", vectorFuture, subQueryDeadline, effective);
            keyword = await("keyword", keywordFuture, subQueryDeadline, effective);
        } finally {
            cancel(vectorFuture);
            cancel(keywordFuture);
        }

        return switch (mode) {
            case VECTOR -> RetrievalResult.complete(text, vectorOnly(require(vector), k));
            case KEYWORD -> RetrievalResult.complete(text, keywordOnly(require(keyword), k));
            case HYBRID -> combine(text, vector, keyword, k);
        };
    }

    int resolveTopK(int topK) {
        if (topK <= 0) {
            return config.getDefaultTopK();
        }
        return Math.min(topK, config.getMaxTopK());
    }

    private RetrievalResult combine(String text, SubQuery<List<VectorHit>> vector, SubQuery<List<KeywordHit>> keyword, int k) {
        if (vector.failed() && keyword.failed()) {
            RetrievalException error = new RetrievalException("query",
                    "vector and keyword search both failed: " + vector.reason() + "; " + keyword.reason(), vector.cause());
            error.addSuppressed(keyword.cause());
            throw error;
        }
        if (vector.failed()) {
            log.warn("Degraded retrieval, using keyword ranking alone: {}", vector.reason());
            return RetrievalResult.degraded(text, fuse(List.of(), keyword.hits(), 0d, k), vector.reason());
        }
        if (keyword.failed()) {
            log.warn("Degraded retrieval, using vector ranking alone: {}", keyword.reason());
            return RetrievalResult.degraded(text, fuse(vector.hits(), List.of(), 1d, k), keyword.reason());
        }
        List<RankedChunk> fused = fuse(vector.hits(), keyword.hits(), config.getHybridSearchWeight(), k);
        log.debug("Hybrid query fused {} vector and {} keyword candidates into {} results",
                vector.hits().size(), keyword.hits().size(), fused.size());
        return RetrievalResult.complete(text, fused);
    }

    private List<VectorHit> vectorSearch(IndexSet indexSet, String text, int pool, Deadline deadline) {
        float[] embedding = embeddingProvider.embed(text, deadline);
        return indexSet.vectorIndex().query(embedding, pool, deadline);
    }

    /**
     * Weighted fusion of min–max normalised side scores. Vector scores are {@code 1 - distance}.
     * A chunk missing from one side scores 0 on that side. Sorted by fused score, then chunk id.
     */
    static List<RankedChunk> fuse(List<VectorHit> vectorHits, List<KeywordHit> keywordHits, double weight, int topK) {
        Map<String, Double> vectorScores = new LinkedHashMap<>();
        Map<String, Double> keywordScores = new LinkedHashMap<>();
        Map<String, Passage> passages = new LinkedHashMap<>();
        for (VectorHit hit : vectorHits) {
            vectorScores.putIfAbsent(hit.chunkId(), hit.similarity());
            passages.putIfAbsent(hit.chunkId(), new Passage(hit.text(), hit.metadata()));
        }
        for (KeywordHit hit : keywordHits) {
            keywordScores.putIfAbsent(hit.chunkId(), hit.score());
            passages.putIfAbsent(hit.chunkId(), new Passage(hit.text(), hit.metadata()));
        }

        Map<String, Double> normalizedVector = minMax(vectorScores);
        Map<String, Double> normalizedKeyword = minMax(keywordScores);
        List<RankedChunk> ranked = new ArrayList<>(passages.size());
        for (Map.Entry<String, Passage> entry : passages.entrySet()) {
            double vectorScore = normalizedVector.getOrDefault(entry.getKey(), 0d);
            double keywordScore = normalizedKeyword.getOrDefault(entry.getKey(), 0d);
            double fused = weight * vectorScore + (1d - weight) * keywordScore;
            ranked.add(new RankedChunk(entry.getKey(), fused, vectorScore, keywordScore,
                    entry.getValue().text(), entry.getValue().metadata()));
        }
        return ranked.stream()
                .sorted(Comparator.comparingDouble(RankedChunk::fusedScore).reversed()
                        .thenComparing(RankedChunk::chunkId))
                .limit(topK)
                .toList();
    }

    /**
     * Scales scores onto [0, 1]. A single score, or scores that are all equal, map to 1.0.
     */
    static Map<String, Double> minMax(Map<String, Double> scores) {
        Map<String, Double> normalized = new HashMap<>();
        if (scores.isEmpty()) {
            return normalized;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double score : scores.values()) {
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        double range = max - min;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            normalized.put(entry.getKey(), range == 0d ? 1d : (entry.getValue() - min) / range);
        }
        return normalized;
    }

    private static List<RankedChunk> vectorOnly(List<VectorHit> hits, int k) {
        return hits.stream()
                .sorted(Comparator.comparingDouble(VectorHit::distance).thenComparing(VectorHit::chunkId))
                .limit(k)
                .map(hit -> new RankedChunk(hit.chunkId(), hit.similarity(), hit.similarity(), 0d, hit.text(), hit.metadata()))
                .toList();
    }

    private static List<RankedChunk> keywordOnly(List<KeywordHit> hits, int k) {
        return hits.stream()
                .limit(k)
                .map(hit -> new RankedChunk(hit.chunkId(), hit.score(), 0d, hit.score(), hit.text(), hit.metadata()))
                .toList();
    }

    private static <T> T require(SubQuery<T> subQuery) {
        if (subQuery.failed()) {
            throw new RetrievalException("query", subQuery.reason(), subQuery.cause());
        }
        return subQuery.hits();
    }

    private static <T> SubQuery<T> await(String side, Future<T> future, Deadline subQueryDeadline, Deadline deadline) {
        if (future == null) {
            return new SubQuery<>(null, null, null);
        }
        try {
            return new SubQuery<>(future.get(subQueryDeadline.remaining().toMillis(), TimeUnit.MILLISECONDS), null, null);
        } catch (TimeoutException e) {
            if (deadline.isExpired()) {
                throw new RetrievalTimeoutException("query", deadline.budget());
            }
            return new SubQuery<>(null, side + " search timed out after " + subQueryDeadline.budget().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RetrievalTimeoutException timeout && deadline.isExpired()) {
                throw timeout;
            }
            if (cause instanceof ConfigurationException configurationError) {
                throw configurationError;
            }
            return new SubQuery<>(null, side + " search failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalException("query", "interrupted while waiting for " + side + " search", e);
        }
    }

    private static void cancel(Future<?> future) {
        if (future != null && !future.isDone()) {
            future.cancel(true);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private record Passage(String text, ChunkMetadata metadata) {
    }

    private record SubQuery<T>(T hits, String reason, Throwable cause) {
        boolean failed() {
            return reason != null;
        }
    }

    private static final class RetrievalThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "drivekb-retrieval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
