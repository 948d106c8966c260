package com.drivekb.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class ConfigValidator {
    private static final Set<String> HTTP_PROVIDERS = Set.of("dashscope", "openai");
    private static final Set<String> PROVIDERS = Set.of("dashscope", "openai", "hashing");
    private static final Set<String> BACKENDS = Set.of("chroma", "local");

    private ConfigValidator() {
    }

    public static List<String> validate(AppConfig config) {
        List<String> errors = new ArrayList<>();

        AppConfig.EmbeddingConfig embedding = config.getEmbedding();
        String provider = normalize(embedding.getProvider());
        if (!PROVIDERS.contains(provider)) {
            errors.add("embedding.provider must be one of " + PROVIDERS + " but was " + embedding.getProvider());
        }
        if (HTTP_PROVIDERS.contains(provider) && isBlank(embedding.getApiKey())) {
            errors.add("DASHSCOPE_API_KEY is not set");
        }
        if (embedding.getDimensions() <= 0) {
            errors.add("embedding.dimensions must be positive");
        }
        if (embedding.getBatchSize() <= 0) {
            errors.add("embedding.batchSize must be positive");
        }
        if (embedding.getMaxRetries() < 0) {
            errors.add("embedding.maxRetries must not be negative");
        }

        String backend = normalize(config.getVectorStore().getBackend());
        if (!BACKENDS.contains(backend)) {
            errors.add("vectorStore.backend must be one of " + BACKENDS + " but was " + config.getVectorStore().getBackend());
        }
        if (isBlank(config.getVectorStore().getCollectionName())) {
            errors.add("vectorStore.collectionName must not be blank");
        }

        AppConfig.TextSplitterConfig splitter = config.getTextSplitter();
        if (splitter.getChunkSize() <= 0) {
            errors.add("textSplitter.chunkSize must be positive");
        }
        if (splitter.getChunkOverlap() < 0) {
            errors.add("textSplitter.chunkOverlap must not be negative");
        }
        if (splitter.getChunkOverlap() >= splitter.getChunkSize()) {
            errors.add("textSplitter.chunkOverlap (" + splitter.getChunkOverlap()
                    + ") must be smaller than textSplitter.chunkSize (" + splitter.getChunkSize() + ")");
        }

        if (config.getKeyword().getK1() < 0) {
            errors.add("keyword.k1 must not be negative");
        }
        if (config.getKeyword().getB() < 0 || config.getKeyword().getB() > 1) {
            errors.add("keyword.b must be within [0, 1]");
        }

        AppConfig.SearchConfig search = config.getSearch();
        if (search.getDefaultTopK() <= 0 || search.getMaxTopK() <= 0) {
            errors.add("search.defaultTopK and search.maxTopK must be positive");
        } else if (search.getDefaultTopK() > search.getMaxTopK()) {
            errors.add("search.defaultTopK must not exceed search.maxTopK");
        }
        if (search.getHybridSearchWeight() < 0 || search.getHybridSearchWeight() > 1) {
            errors.add("search.hybridSearchWeight must be within [0, 1]");
        }
        if (search.getSubQueryTimeoutMs() <= 0 || search.getRequestTimeoutMs() <= 0) {
            errors.add("search timeouts must be positive");
        }

        AppConfig.CacheConfig cache = config.getCache();
        if (cache.getMaxSize() <= 0) {
            errors.add("cache.maxSize must be positive");
        }
        if (cache.getTtlMs() <= 0) {
            errors.add("cache.ttlMs must be positive");
        }
        if (cache.getSimilarityThreshold() < 0 || cache.getSimilarityThreshold() > 1) {
            errors.add("cache.similarityThreshold must be within [0, 1]");
        }
        return errors;
    }

    /**
     * Settings that load and run but probably do not do what was meant. Reported in the status
     * view and logged at startup; they never stop the knowledge base from starting.
     */
    public static List<String> warnings(AppConfig config) {
        List<String> warnings = new ArrayList<>();
        if (isBlank(config.getStatePath())) {
            warnings.add("statePath is blank; the index is rebuilt on every start");
        }
        if ("local".equals(normalize(config.getVectorStore().getBackend()))
                && isBlank(config.getVectorStore().getLocalDirectory())) {
            warnings.add("vectorStore.localDirectory is blank; vectors are kept in memory only");
        }
        AppConfig.SearchConfig search = config.getSearch();
        if (search.getCandidatePoolSize() < search.getDefaultTopK()) {
            warnings.add("search.candidatePoolSize (" + search.getCandidatePoolSize()
                    + ") is below search.defaultTopK (" + search.getDefaultTopK() + "); the pool is widened to topK");
        }
        if (search.getSubQueryTimeoutMs() > search.getRequestTimeoutMs()) {
            warnings.add("search.subQueryTimeoutMs exceeds search.requestTimeoutMs; sub-queries stop at the request deadline");
        }
        if (config.getCache().isEnabled() && config.getCache().getSimilarityThreshold() < 0.5) {
            warnings.add("cache.similarityThreshold is below 0.5; unrelated questions may share answers");
        }
        return warnings;
    }

    static String normalize(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
