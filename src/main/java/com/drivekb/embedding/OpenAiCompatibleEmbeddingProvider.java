package com.drivekb.embedding;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.error.ConfigurationException;
import com.drivekb.error.EmbeddingProviderException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.runtime.Deadline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Client for an OpenAI-compatible {@code /embeddings} endpoint (DashScope compatible mode by
 * default). Texts are sent in sequential batches of at most {@code batchSize}; each response is
 * re-ordered by its {@code index} field before use.
 */
public class OpenAiCompatibleEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int BODY_EXCERPT = 300;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int dimensions;
    private final int batchSize;
    private final int maxRetries;
    private final Duration retryBackoff;

    public OpenAiCompatibleEmbeddingProvider(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String model,
            int dimensions,
            int batchSize,
            int maxRetries,
            Duration retryBackoff) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = stripTrailingSlash(baseUrl) + "/embeddings";
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    @Override
    public List<float[]> embed(List<String> texts, Deadline deadline) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("embed", "DASHSCOPE_API_KEY is not set");
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            vectors.addAll(embedBatchWithRetry(batch, deadline));
            log.debug("Embedded {}/{} texts", vectors.size(), texts.size());
        }
        if (vectors.size() != texts.size()) {
            throw new EmbeddingProviderException("embed",
                    "expected " + texts.size() + " embeddings but received " + vectors.size(), false);
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimensions;
    }

    @Override
    public String version() {
        return model + "-" + dimensions;
    }

    private List<float[]> embedBatchWithRetry(List<String> batch, Deadline deadline) {
        int attempt = 0;
        while (true) {
            try {
                return requestBatch(batch, deadline);
            } catch (EmbeddingProviderException e) {
                if (!e.transientFailure() || attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                long backoffMs = retryBackoff.toMillis() * attempt;
                if (deadline != null && deadline.remaining().toMillis() <= backoffMs) {
                    throw new RetrievalTimeoutException("embed",
                            "deadline leaves no room to retry after: " + e.getMessage(), e);
                }
                log.warn("Embedding batch of {} failed (attempt {}/{}), retrying in {} ms: {}",
                        batch.size(), attempt, maxRetries + 1, backoffMs, e.getMessage());
                sleep(backoffMs, e);
            }
        }
    }

    private List<float[]> requestBatch(List<String> batch, Deadline deadline) {
        Request request = buildRequest(batch);
        Call call = httpClient.newCall(request);
        if (deadline != null) {
            long remainingMs = deadline.remaining().toMillis();
            if (remainingMs <= 0) {
                throw new RetrievalTimeoutException("embed", deadline.budget());
            }
            call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);
        }

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                boolean retryable = response.code() == 429 || response.code() >= 500;
                throw new EmbeddingProviderException("embed",
                        "provider returned HTTP " + response.code() + " body=" + excerpt(payload), retryable);
            }
            return parse(payload, batch.size());
        } catch (InterruptedIOException e) {
            if (deadline != null && deadline.isExpired()) {
                throw new RetrievalTimeoutException("embed", "deadline expired during embedding call", e);
            }
            throw new EmbeddingProviderException("embed", "embedding call timed out", true, e);
        } catch (JsonProcessingException e) {
            throw new EmbeddingProviderException("embed", "malformed provider response: " + e.getOriginalMessage(), false, e);
        } catch (IOException e) {
            throw new EmbeddingProviderException("embed", "embedding call failed: " + e.getMessage(), true, e);
        }
    }

    private Request buildRequest(List<String> batch) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", batch);
        payload.put("dimensions", dimensions);
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EmbeddingProviderException("embed", "unable to encode request", false, e);
        }
        return new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(json, JSON))
                .build();
    }

    List<float[]> parse(String payload, int expected) throws IOException {
        JsonNode data = mapper.readTree(payload).path("data");
        if (!data.isArray()) {
            throw new EmbeddingProviderException("embed", "response has no data array: " + excerpt(payload), false);
        }

        List<IndexedEmbedding> items = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            JsonNode vectorNode = item.path("embedding");
            if (!vectorNode.isArray()) {
                throw new EmbeddingProviderException("embed", "response item has no embedding array", false);
            }
            if (vectorNode.size() != dimensions) {
                throw new EmbeddingProviderException("embed",
                        "dimension mismatch: expected " + dimensions + " but provider returned " + vectorNode.size(), false);
            }
            float[] vector = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            items.add(new IndexedEmbedding(item.path("index").asInt(-1), vector));
        }

        items.sort(Comparator.comparingInt(IndexedEmbedding::index));
        if (items.size() != expected) {
            throw new EmbeddingProviderException("embed",
                    "expected " + expected + " embeddings in batch but received " + items.size(), false);
        }
        List<float[]> ordered = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).index() != i) {
                throw new EmbeddingProviderException("embed",
                        "response indexes are not a permutation of 0.." + (expected - 1), false);
            }
            ordered.add(items.get(i).vector());
        }
        return ordered;
    }

    private static void sleep(long millis, EmbeddingProviderException cause) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException("embed", "interrupted while waiting to retry", false, cause);
        }
    }

    private static String excerpt(String body) {
        String flat = body.replaceAll("\\s+", " ").strip();
        return flat.length() > BODY_EXCERPT ? flat.substring(0, BODY_EXCERPT) + "..." : flat;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record IndexedEmbedding(int index, float[] vector) {
    }
}
