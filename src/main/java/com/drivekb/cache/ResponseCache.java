package com.drivekb.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.embedding.EmbeddingProvider;
import com.drivekb.embedding.Vectors;
import com.drivekb.runtime.Deadline;

/**
 * Memoises responses by query meaning rather than query text. A lookup embeds the query and
 * returns the stored response of the closest live entry when its cosine similarity reaches the
 * threshold; otherwise the response is computed and stored.
 *
 * <p>Entries expire {@code ttl} after creation and are dropped during the next scan. When the
 * cache grows past {@code maxSize}, the least recently accessed entry goes first.
 */
public class ResponseCache<V> {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);
    private static final Comparator<CacheEntry<?>> EVICTION_ORDER = Comparator
            .<CacheEntry<?>, Instant>comparing(CacheEntry::lastAccessedAt)
            .thenComparingLong(CacheEntry::insertionOrder);

    private final EmbeddingProvider embeddingProvider;
    private final Duration ttl;
    private final int maxSize;
    private final double similarityThreshold;
    private final boolean enabled;
    private final Clock clock;
    private final List<CacheEntry<V>> entries = new ArrayList<>();
    private long insertions;
    private long generation;

    public ResponseCache(EmbeddingProvider embeddingProvider,
            Duration ttl,
            int maxSize,
            double similarityThreshold,
            boolean enabled,
            Clock clock) {
        this.embeddingProvider = embeddingProvider;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.similarityThreshold = similarityThreshold;
        this.enabled = enabled;
        this.clock = clock;
    }

    public CacheLookup<V> lookupOrCompute(String queryText, Supplier<V> computeFn) {
        return lookupOrCompute(queryText, null, computeFn);
    }

    /**
     * @param deadline bounds the query embedding call, or {@code null} for none
     */
    public CacheLookup<V> lookupOrCompute(String queryText, Deadline deadline, Supplier<V> computeFn) {
        if (!enabled) {
            return CacheLookup.miss(computeFn.get(), 0d);
        }
        float[] queryEmbedding = embeddingProvider.embed(queryText, deadline);

        double bestSimilarity;
        long lookupGeneration;
        synchronized (this) {
            lookupGeneration = generation;
            Instant now = clock.instant();
            CacheEntry<V> best = null;
            bestSimilarity = 0d;
            Iterator<CacheEntry<V>> iterator = entries.iterator();
            while (iterator.hasNext()) {
                CacheEntry<V> entry = iterator.next();
                if (entry.isExpired(now, ttl)) {
                    iterator.remove();
                    continue;
                }
                double similarity = Vectors.cosine(queryEmbedding, entry.queryEmbedding());
                if (best == null || similarity > bestSimilarity) {
                    best = entry;
                    bestSimilarity = similarity;
                }
            }
            if (best != null && bestSimilarity >= similarityThreshold) {
                best.touch(now);
                log.debug("Response cache hit (similarity {})", bestSimilarity);
                return CacheLookup.hit(best.response(), bestSimilarity);
            }
        }

        log.debug("Response cache miss (best similarity {})", bestSimilarity);
        V value = computeFn.get();
        store(queryEmbedding, value, lookupGeneration);
        return CacheLookup.miss(value, bestSimilarity);
    }

    /**
     * Number of entries held, including expired ones not yet dropped by a scan.
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Drops every entry. A computation already running when this is called returns its value to
     * the caller but does not store it.
     */
    public synchronized void clear() {
        entries.clear();
        generation++;
    }

    private synchronized void store(float[] queryEmbedding, V value, long lookupGeneration) {
        if (lookupGeneration != generation) {
            log.debug("Discarding response computed before the cache was cleared");
            return;
        }
        entries.add(new CacheEntry<>(queryEmbedding, value, clock.instant(), insertions++));
        while (entries.size() > maxSize) {
            CacheEntry<V> victim = entries.stream().min(EVICTION_ORDER).orElseThrow();
            entries.remove(victim);
            log.debug("Evicted response cache entry last accessed at {}", victim.lastAccessedAt());
        }
    }
}
