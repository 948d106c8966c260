package com.drivekb.index;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.error.ConfigurationException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.error.VectorStoreException;
import com.drivekb.ingest.ChunkMetadata;
import com.drivekb.runtime.Deadline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Collection in a Chroma server, spoken to over its v2 REST API. The collection id is resolved
 * (get-or-create) on first use and cached until the next {@link #reset()}.
 */
public class ChromaVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(ChromaVectorIndex.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int UPSERT_BATCH = 100;
    private static final int PAGE_SIZE = 500;
    private static final int BODY_EXCERPT = 300;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl collectionsUrl;
    private final String name;
    private final int dimension;
    private String collectionId;

    public ChromaVectorIndex(OkHttpClient httpClient, String baseUrl, String tenant, String database, String name,
            int dimension) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new ConfigurationException("vector store", "invalid Chroma url: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.collectionsUrl = base.newBuilder()
                .addPathSegments("api/v2/tenants")
                .addPathSegment(tenant)
                .addPathSegment("databases")
                .addPathSegment(database)
                .addPathSegment("collections")
                .build();
        this.name = name;
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void upsert(List<EmbeddedChunk> chunks) {
        for (EmbeddedChunk chunk : chunks) {
            checkDimension("upsert", chunk.embedding());
        }
        String id = collectionId();
        for (int from = 0; from < chunks.size(); from += UPSERT_BATCH) {
            List<EmbeddedChunk> batch = chunks.subList(from, Math.min(chunks.size(), from + UPSERT_BATCH));
            List<String> ids = new ArrayList<>(batch.size());
            List<float[]> embeddings = new ArrayList<>(batch.size());
            List<String> documents = new ArrayList<>(batch.size());
            List<Map<String, Object>> metadatas = new ArrayList<>(batch.size());
            for (EmbeddedChunk chunk : batch) {
                ids.add(chunk.id());
                embeddings.add(chunk.embedding());
                documents.add(chunk.chunk().text());
                metadatas.add(chunk.chunk().metadata().toMap());
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("ids", ids);
            body.put("embeddings", embeddings);
            body.put("documents", documents);
            body.put("metadatas", metadatas);
            execute("upsert", post(url(id, "upsert"), body), null);
            log.debug("Upserted {}/{} chunks into {}", from + batch.size(), chunks.size(), name);
        }
    }

    @Override
    public List<VectorHit> query(float[] embedding, int topK, Deadline deadline) {
        checkDimension("query", embedding);
        if (topK <= 0) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query_embeddings", List.of(embedding));
        body.put("n_results", topK);
        body.put("include", List.of("documents", "metadatas", "distances"));
        JsonNode result = execute("query", post(url(collectionId(), "query"), body), deadline);

        JsonNode ids = result.path("ids").path(0);
        JsonNode documents = result.path("documents").path(0);
        JsonNode metadatas = result.path("metadatas").path(0);
        JsonNode distances = result.path("distances").path(0);
        List<VectorHit> hits = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            hits.add(new VectorHit(ids.get(i).asText(), distances.path(i).asDouble(),
                    documents.path(i).asText(""), metadata(metadatas.path(i))));
        }
        return hits;
    }

    @Override
    public synchronized void reset() {
        Request request = new Request.Builder()
                .url(collectionsUrl.newBuilder().addPathSegment(name).build())
                .delete()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String payload = bodyOf(response);
            if (response.isSuccessful()) {
                log.info("Deleted Chroma collection {}", name);
            } else if (response.code() == 404 || payload.contains("does not exist")) {
                log.warn("Chroma collection {} does not exist, nothing to delete", name);
            } else {
                throw new VectorStoreException("reset", response.code(), excerpt(payload));
            }
        } catch (IOException e) {
            throw new VectorStoreException("reset", "unable to delete collection " + name, e);
        }
        collectionId = null;
        collectionId();
    }

    @Override
    public int count() {
        Request request = new Request.Builder().url(url(collectionId(), "count")).get().build();
        return execute("count", request, null).asInt();
    }

    @Override
    public List<StoredDocument> getAll() {
        String id = collectionId();
        List<StoredDocument> documents = new ArrayList<>();
        int offset = 0;
        while (true) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("limit", PAGE_SIZE);
            body.put("offset", offset);
            body.put("include", List.of("documents", "metadatas"));
            JsonNode page = execute("get", post(url(id, "get"), body), null);
            JsonNode ids = page.path("ids");
            for (int i = 0; i < ids.size(); i++) {
                documents.add(new StoredDocument(ids.get(i).asText(), page.path("documents").path(i).asText(""),
                        metadata(page.path("metadatas").path(i))));
            }
            if (ids.size() < PAGE_SIZE) {
                return documents;
            }
            offset += ids.size();
        }
    }

    private synchronized String collectionId() {
        if (collectionId == null) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("name", name);
            body.put("metadata", Map.of("hnsw:space", "cosine"));
            body.put("get_or_create", true);
            JsonNode created = execute("get collection", post(collectionsUrl, body), null);
            String id = created.path("id").asText("");
            if (id.isEmpty()) {
                throw new VectorStoreException("get collection", "response carries no collection id", null);
            }
            collectionId = id;
            log.debug("Using Chroma collection {} ({})", name, id);
        }
        return collectionId;
    }

    private JsonNode execute(String operation, Request request, Deadline deadline) {
        Call call = httpClient.newCall(request);
        if (deadline != null) {
            long remainingMs = deadline.remaining().toMillis();
            if (remainingMs <= 0) {
                throw new RetrievalTimeoutException("vector " + operation, deadline.budget());
            }
            call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);
        }
        try (Response response = call.execute()) {
            String payload = bodyOf(response);
            if (!response.isSuccessful()) {
                throw new VectorStoreException(operation, response.code(), excerpt(payload));
            }
            return mapper.readTree(payload);
        } catch (InterruptedIOException e) {
            if (deadline != null && deadline.isExpired()) {
                throw new RetrievalTimeoutException("vector " + operation, "deadline expired during vector store call", e);
            }
            throw new VectorStoreException(operation, "vector store call timed out", e);
        } catch (IOException e) {
            throw new VectorStoreException(operation, "vector store call failed: " + e.getMessage(), e);
        }
    }

    private Request post(HttpUrl url, Map<String, Object> body) {
        try {
            return new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new VectorStoreException("encode", "unable to encode request", e);
        }
    }

    private HttpUrl url(String id, String action) {
        return collectionsUrl.newBuilder().addPathSegment(id).addPathSegment(action).build();
    }

    private ChunkMetadata metadata(JsonNode node) {
        if (!node.isObject()) {
            return ChunkMetadata.fromMap(null);
        }
        return ChunkMetadata.fromMap(mapper.convertValue(node, new TypeReference<Map<String, Object>>() {
        }));
    }

    private void checkDimension(String operation, float[] embedding) {
        if (embedding.length != dimension) {
            throw new ConfigurationException(operation, "collection " + name + " holds " + dimension
                    + "-dimensional vectors but received " + embedding.length);
        }
    }

    private static String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private static String excerpt(String body) {
        String flat = body.replaceAll("\\s+", " ").strip();
        return flat.length() > BODY_EXCERPT ? flat.substring(0, BODY_EXCERPT) + "..." : flat;
    }
}
