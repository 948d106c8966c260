package com.drivekb.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private String dataFile = "assets/instruction-manual/manual.txt";
    private String statePath = ".drivekb/index-state.json";
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private TextSplitterConfig textSplitter = new TextSplitterConfig();
    private KeywordConfig keyword = new KeywordConfig();
    private SearchConfig search = new SearchConfig();
    private CacheConfig cache = new CacheConfig();

    public String getDataFile() {
        return dataFile;
    }

    public void setDataFile(String dataFile) {
        this.dataFile = dataFile;
    }

    public String getStatePath() {
        return statePath;
    }

    public void setStatePath(String statePath) {
        this.statePath = statePath;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public VectorStoreConfig getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStoreConfig vectorStore) {
        this.vectorStore = vectorStore == null ? new VectorStoreConfig() : vectorStore;
    }

    public TextSplitterConfig getTextSplitter() {
        return textSplitter;
    }

    public void setTextSplitter(TextSplitterConfig textSplitter) {
        this.textSplitter = textSplitter == null ? new TextSplitterConfig() : textSplitter;
    }

    public KeywordConfig getKeyword() {
        return keyword;
    }

    public void setKeyword(KeywordConfig keyword) {
        this.keyword = keyword == null ? new KeywordConfig() : keyword;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "dashscope";
        private String baseUrl = "https://dashscope-intl.aliyuncs.com/compatible-mode/v1";
        private String apiKey = "";
        private String model = "text-embedding-v4";
        private int dimensions = 1024;
        private int batchSize = 10;
        private int maxRetries = 2;
        private long retryBackoffMs = 500;
        private long timeoutMs = 30000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VectorStoreConfig {
        private String backend = "chroma";
        private String url = "http://localhost:8100";
        private String tenant = "default_tenant";
        private String database = "default_database";
        private String collectionName = "car_manual";
        private String localDirectory = ".drivekb/vectors";
        private long timeoutMs = 10000;

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getTenant() {
            return tenant;
        }

        public void setTenant(String tenant) {
            this.tenant = tenant;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName;
        }

        public String getLocalDirectory() {
            return localDirectory;
        }

        public void setLocalDirectory(String localDirectory) {
            this.localDirectory = localDirectory;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TextSplitterConfig {
        private int chunkSize = 300;
        private int chunkOverlap = 100;
        private boolean usePreprocessing = true;
        private List<String> removePatterns = List.of(
                "PRIUS_UG_M47F64_\\(J\\)",
                "Sec_\\d+-?\\d*\\.fm",
                "Forward\\.fm");

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public boolean isUsePreprocessing() {
            return usePreprocessing;
        }

        public void setUsePreprocessing(boolean usePreprocessing) {
            this.usePreprocessing = usePreprocessing;
        }

        public List<String> getRemovePatterns() {
            return removePatterns;
        }

        public void setRemovePatterns(List<String> removePatterns) {
            this.removePatterns = removePatterns == null ? List.of() : removePatterns;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeywordConfig {
        private double k1 = 1.2;
        private double b = 0.75;

        public double getK1() {
            return k1;
        }

        public void setK1(double k1) {
            this.k1 = k1;
        }

        public double getB() {
            return b;
        }

        public void setB(double b) {
            this.b = b;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultTopK = 5;
        private int maxTopK = 20;
        private double hybridSearchWeight = 0.7;
        private int candidatePoolSize = 10;
        private long subQueryTimeoutMs = 5000;
        private long requestTimeoutMs = 15000;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMaxTopK() {
            return maxTopK;
        }

        public void setMaxTopK(int maxTopK) {
            this.maxTopK = maxTopK;
        }

        public double getHybridSearchWeight() {
            return hybridSearchWeight;
        }

        public void setHybridSearchWeight(double hybridSearchWeight) {
            this.hybridSearchWeight = hybridSearchWeight;
        }

        public int getCandidatePoolSize() {
            return candidatePoolSize;
        }

        public void setCandidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = candidatePoolSize;
        }

        public long getSubQueryTimeoutMs() {
            return subQueryTimeoutMs;
        }

        public void setSubQueryTimeoutMs(long subQueryTimeoutMs) {
            this.subQueryTimeoutMs = subQueryTimeoutMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private boolean enabled = true;
        private long ttlMs = 600000;
        private int maxSize = 100;
        private double similarityThreshold = 0.90;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }
}
