package com.drivekb;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.cache.CacheLookup;
import com.drivekb.cache.ResponseCache;
import com.drivekb.embedding.EmbeddingProvider;
import com.drivekb.embedding.EmbeddingProviders;
import com.drivekb.error.ConfigurationException;
import com.drivekb.index.Bm25Parameters;
import com.drivekb.index.KeywordTokenizer;
import com.drivekb.index.VectorIndexFactory;
import com.drivekb.ingest.Chunker;
import com.drivekb.ingest.IndexStateStore;
import com.drivekb.ingest.TextPreprocessor;
import com.drivekb.lifecycle.IndexBuilder;
import com.drivekb.lifecycle.IndexLifecycle;
import com.drivekb.lifecycle.IndexStatus;
import com.drivekb.retrieval.ContextFormatter;
import com.drivekb.retrieval.HybridRetriever;
import com.drivekb.retrieval.RetrievalMode;
import com.drivekb.retrieval.RetrievalResult;
import com.drivekb.runtime.AppConfig;
import com.drivekb.runtime.ConfigValidator;
import com.drivekb.runtime.Deadline;

import okhttp3.OkHttpClient;

/**
 * Entry point for the rest of the application: one instance per process, built at startup and
 * passed to whatever needs retrieval. Wires the chunker, embedding provider, both indexes, the
 * lifecycle, the hybrid retriever and the response cache from one {@link AppConfig}.
 */
public class KnowledgeBase implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBase.class);

    private final IndexLifecycle lifecycle;
    private final HybridRetriever retriever;
    private final ResponseCache<String> cache;
    private final List<String> configWarnings;

    KnowledgeBase(IndexLifecycle lifecycle, HybridRetriever retriever, ResponseCache<String> cache,
            List<String> configWarnings) {
        this.lifecycle = lifecycle;
        this.retriever = retriever;
        this.cache = cache;
        this.configWarnings = List.copyOf(configWarnings);
    }

    /**
     * @throws ConfigurationException listing every problem found in {@code config}
     */
    public static KnowledgeBase create(AppConfig config) {
        requireValid(config);
        OkHttpClient httpClient = new OkHttpClient();
        EmbeddingProvider embeddingProvider = EmbeddingProviders.fromConfig(config.getEmbedding(), httpClient);
        VectorIndexFactory vectorIndexFactory = VectorIndexFactory.fromConfig(config.getVectorStore(),
                embeddingProvider.dimension(), httpClient);
        return create(config, embeddingProvider, vectorIndexFactory, Clock.systemUTC());
    }

    public static KnowledgeBase create(AppConfig config,
            EmbeddingProvider embeddingProvider,
            VectorIndexFactory vectorIndexFactory,
            Clock clock) {
        requireValid(config);
        List<String> warnings = ConfigValidator.warnings(config);
        warnings.forEach(warning -> log.warn("Configuration warning: {}", warning));
        AppConfig.TextSplitterConfig splitter = config.getTextSplitter();
        Chunker chunker = new Chunker(splitter.getChunkSize(), splitter.getChunkOverlap(),
                splitter.isUsePreprocessing() ? new TextPreprocessor(splitter.getRemovePatterns()) : null);
        IndexBuilder builder = new IndexBuilder(chunker, embeddingProvider, new KeywordTokenizer(),
                new Bm25Parameters(config.getKeyword().getK1(), config.getKeyword().getB()));
        IndexLifecycle lifecycle = new IndexLifecycle(builder,
                vectorIndexFactory,
                new IndexStateStore(isBlank(config.getStatePath()) ? null : Path.of(config.getStatePath())),
                Path.of(config.getDataFile()),
                config.getVectorStore().getCollectionName(),
                clock);
        HybridRetriever retriever = new HybridRetriever(lifecycle::current, embeddingProvider, config.getSearch());
        AppConfig.CacheConfig cacheConfig = config.getCache();
        ResponseCache<String> cache = new ResponseCache<>(embeddingProvider,
                Duration.ofMillis(cacheConfig.getTtlMs()),
                cacheConfig.getMaxSize(),
                cacheConfig.getSimilarityThreshold(),
                cacheConfig.isEnabled(),
                clock);
        log.info("Knowledge base configured: provider={} backend={} collection={} chunkSize={} overlap={} weight={}",
                config.getEmbedding().getProvider(),
                config.getVectorStore().getBackend(),
                config.getVectorStore().getCollectionName(),
                splitter.getChunkSize(),
                splitter.getChunkOverlap(),
                config.getSearch().getHybridSearchWeight());
        return new KnowledgeBase(lifecycle, retriever, cache, warnings);
    }

    /**
     * Builds or reuses the index set. Safe to call again once READY.
     *
     * @throws com.drivekb.error.IndexBuildException when the build fails
     */
    public void initialize() {
        lifecycle.initialize();
    }

    /**
     * Explicit reindex from the source document, also the retry after a failed build. Cached
     * responses were computed against the old index set and are dropped.
     */
    public void rebuild() {
        lifecycle.rebuild();
        cache.clear();
    }

    public IndexStatus getStatus() {
        return lifecycle.getStatus().withRuntime(cache.size(), configWarnings);
    }

    public RetrievalResult query(String text, int topK) {
        return retriever.query(text, topK);
    }

    public RetrievalResult query(String text, int topK, RetrievalMode mode, Deadline deadline) {
        return retriever.query(text, topK, mode, deadline);
    }

    /**
     * Reference block for the completion call, built from a hybrid query.
     */
    public String context(String text, int topK) {
        return ContextFormatter.format(query(text, topK));
    }

    public CacheLookup<String> lookupOrCompute(String text, Supplier<String> computeFn) {
        return cache.lookupOrCompute(text, computeFn);
    }

    public CacheLookup<String> lookupOrCompute(String text, Deadline deadline, Supplier<String> computeFn) {
        return cache.lookupOrCompute(text, deadline, computeFn);
    }

    @Override
    public void close() {
        retriever.close();
    }

    private static void requireValid(AppConfig config) {
        List<String> errors = ConfigValidator.validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("configure", errors);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
