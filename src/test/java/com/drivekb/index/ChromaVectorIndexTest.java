package com.drivekb.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.drivekb.error.ConfigurationException;
import com.drivekb.error.VectorStoreException;
import com.drivekb.ingest.ChunkMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

class ChromaVectorIndexTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String COLLECTIONS = "/api/v2/tenants/default_tenant/databases/default_database/collections";

    @Test
    void shouldIgnoreMissingCollectionOnResetAndRecreateIt() {
        FakeChroma chroma = new FakeChroma();
        ChromaVectorIndex index = index(chroma, 3);

        index.reset();

        assertEquals(List.of("DELETE " + COLLECTIONS + "/car_manual", "POST " + COLLECTIONS), chroma.requests);
        JsonNode create = chroma.bodies.get(0);
        assertEquals("car_manual", create.path("name").asText());
        assertEquals("cosine", create.path("metadata").path("hnsw:space").asText());
        assertTrue(create.path("get_or_create").asBoolean());
    }

    @Test
    void shouldUpsertAndQueryThroughCollectionId() {
        FakeChroma chroma = new FakeChroma();
        ChromaVectorIndex index = index(chroma, 3);

        index.upsert(List.of(
                LocalJsonVectorIndexTest.embedded("manual.txt#chunk_0", "brake", 1f, 0f, 0f),
                LocalJsonVectorIndexTest.embedded("manual.txt#chunk_1", "tire", 0f, 1f, 0f)));
        List<VectorHit> hits = index.query(new float[] { 1f, 0f, 0f }, 5, null);

        assertEquals(2, chroma.stored.size());
        assertEquals("POST " + COLLECTIONS + "/col-1/upsert", chroma.requests.get(1));
        assertEquals("POST " + COLLECTIONS + "/col-1/query", chroma.requests.get(2));
        assertEquals(5, chroma.bodies.get(2).path("n_results").asInt());
        assertEquals(2, hits.size());
        assertEquals("manual.txt#chunk_0", hits.get(0).chunkId());
        assertEquals(0.0, hits.get(0).distance(), 1e-9);
        assertEquals("brake", hits.get(0).text());
        assertEquals(new ChunkMetadata("manual.txt", 0, 0, 5, 1), hits.get(0).metadata());
        assertEquals(2, index.count());
    }

    @Test
    void shouldPageThroughGetAll() {
        FakeChroma chroma = new FakeChroma();
        ChromaVectorIndex index = index(chroma, 3);
        List<EmbeddedChunk> chunks = new ArrayList<>();
        for (int i = 0; i < 501; i++) {
            chunks.add(LocalJsonVectorIndexTest.embedded("manual.txt#chunk_" + i, "text " + i, 1f, 0f, 0f));
        }
        index.upsert(chunks);

        List<StoredDocument> all = index.getAll();

        assertEquals(501, all.size());
        assertEquals("manual.txt#chunk_500", all.get(500).chunkId());
        long getCalls = chroma.requests.stream().filter(request -> request.endsWith("/get")).count();
        assertEquals(2, getCalls);
    }

    @Test
    void shouldSurfaceServerErrorsWithStatus() {
        FakeChroma chroma = new FakeChroma();
        chroma.failUpsertWith = 500;
        ChromaVectorIndex index = index(chroma, 3);

        VectorStoreException error = assertThrows(VectorStoreException.class,
                () -> index.upsert(List.of(LocalJsonVectorIndexTest.embedded("c0", "x", 1f, 0f, 0f))));

        assertEquals(500, error.statusCode());
        assertEquals("upsert", error.operation());
    }

    @Test
    void shouldRejectMismatchedDimensionBeforeCallingServer() {
        FakeChroma chroma = new FakeChroma();
        ChromaVectorIndex index = index(chroma, 4);

        assertThrows(ConfigurationException.class,
                () -> index.upsert(List.of(LocalJsonVectorIndexTest.embedded("c0", "x", 1f, 0f, 0f))));
        assertTrue(chroma.requests.isEmpty());
    }

    private static ChromaVectorIndex index(FakeChroma chroma, int dimension) {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(chroma).build();
        return new ChromaVectorIndex(client, "http://chroma.test:8100", "default_tenant", "default_database",
                "car_manual", dimension);
    }

    /**
     * In-memory stand-in for the Chroma v2 collection endpoints used by the index.
     */
    private static final class FakeChroma implements Interceptor {
        private final List<String> requests = new ArrayList<>();
        private final List<JsonNode> bodies = new ArrayList<>();
        private final Map<String, JsonNode[]> stored = new LinkedHashMap<>();
        private int failUpsertWith;

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            String path = request.url().encodedPath();
            requests.add(request.method() + " " + path);
            JsonNode body = MAPPER.createObjectNode();
            if (request.body() != null && request.body().contentLength() > 0) {
                Buffer buffer = new Buffer();
                request.body().writeTo(buffer);
                body = MAPPER.readTree(buffer.readUtf8());
                bodies.add(body);
            }

            if (request.method().equals("DELETE")) {
                return reply(request, 404, "{\"error\":\"NotFoundError\",\"message\":\"Collection [car_manual] does not exists\"}");
            }
            if (path.equals(COLLECTIONS)) {
                return reply(request, 200, "{\"id\":\"col-1\",\"name\":\"" + body.path("name").asText() + "\"}");
            }
            if (path.endsWith("/upsert")) {
                if (failUpsertWith != 0) {
                    return reply(request, failUpsertWith, "{\"error\":\"InternalError\"}");
                }
                for (int i = 0; i < body.path("ids").size(); i++) {
                    stored.put(body.path("ids").get(i).asText(),
                            new JsonNode[] { body.path("documents").get(i), body.path("metadatas").get(i) });
                }
                return reply(request, 200, "{}");
            }
            if (path.endsWith("/count")) {
                return reply(request, 200, String.valueOf(stored.size()));
            }
            if (path.endsWith("/query")) {
                ObjectNode result = MAPPER.createObjectNode();
                ArrayNode ids = result.putArray("ids").addArray();
                ArrayNode documents = result.putArray("documents").addArray();
                ArrayNode metadatas = result.putArray("metadatas").addArray();
                ArrayNode distances = result.putArray("distances").addArray();
                double distance = 0d;
                for (Map.Entry<String, JsonNode[]> entry : stored.entrySet()) {
                    ids.add(entry.getKey());
                    documents.add(entry.getValue()[0]);
                    metadatas.add(entry.getValue()[1]);
                    distances.add(distance);
                    distance += 0.5d;
                }
                return reply(request, 200, MAPPER.writeValueAsString(result));
            }
            if (path.endsWith("/get")) {
                int limit = body.path("limit").asInt();
                int offset = body.path("offset").asInt();
                ObjectNode result = MAPPER.createObjectNode();
                ArrayNode ids = result.putArray("ids");
                ArrayNode documents = result.putArray("documents");
                ArrayNode metadatas = result.putArray("metadatas");
                List<Map.Entry<String, JsonNode[]>> entries = new ArrayList<>(stored.entrySet());
                for (int i = offset; i < Math.min(entries.size(), offset + limit); i++) {
                    ids.add(entries.get(i).getKey());
                    documents.add(entries.get(i).getValue()[0]);
                    metadatas.add(entries.get(i).getValue()[1]);
                }
                return reply(request, 200, MAPPER.writeValueAsString(result));
            }
            return reply(request, 404, "{\"error\":\"unexpected " + path + "\"}");
        }

        private static Response reply(Request request, int code, String body) {
            return new Response.Builder()
                    .request(request)
                    .protocol(Protocol.HTTP_1_1)
                    .code(code)
                    .message("fake")
                    .body(ResponseBody.create(body, MediaType.get("application/json")))
                    .build();
        }
    }
}
