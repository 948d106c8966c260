package com.drivekb.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.junit.jupiter.api.Test;

import com.drivekb.error.ConfigurationException;
import com.drivekb.error.EmbeddingProviderException;
import com.drivekb.error.RetrievalTimeoutException;
import com.drivekb.runtime.AppConfig;
import com.drivekb.runtime.Deadline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

class OpenAiCompatibleEmbeddingProviderTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void shouldReorderReversedBatchesByIndexField() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, reversedEmbeddings(request, 3)));
        OpenAiCompatibleEmbeddingProvider provider = provider(endpoint, 3, 2, 0);

        List<String> texts = List.of("0", "1", "2", "3", "4");
        List<float[]> vectors = provider.embed(texts);

        assertEquals(texts.size(), vectors.size());
        for (int i = 0; i < texts.size(); i++) {
            assertEquals(3, vectors.get(i).length);
            assertEquals(i, vectors.get(i)[0], 0.0001f);
        }
        assertEquals(3, endpoint.calls.get());
        assertEquals(List.of(2, 2, 1), endpoint.batchSizes);
    }

    @Test
    void shouldSendModelDimensionsAndBearerToken() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, reversedEmbeddings(request, 3)));

        provider(endpoint, 3, 10, 0).embed(List.of("7"));

        JsonNode body = endpoint.lastBody;
        assertEquals("text-embedding-v4", body.path("model").asText());
        assertEquals(3, body.path("dimensions").asInt());
        assertEquals("7", body.path("input").get(0).asText());
        assertEquals("Bearer test-key", endpoint.lastAuthorization);
        assertEquals("/v1/embeddings", endpoint.lastPath);
    }

    @Test
    void shouldFailOnDimensionMismatchWithoutRetrying() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, reversedEmbeddings(request, 2)));
        OpenAiCompatibleEmbeddingProvider provider = provider(endpoint, 3, 10, 2);

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider.embed(List.of("1")));

        assertFalse(error.transientFailure());
        assertTrue(error.getMessage().contains("dimension mismatch"));
        assertEquals(1, endpoint.calls.get());
    }

    @Test
    void shouldRetryTransientServerErrors() {
        AtomicInteger attempts = new AtomicInteger();
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> attempts.incrementAndGet() == 1
                ? reply(503, "{\"error\":\"overloaded\"}")
                : reply(200, reversedEmbeddings(request, 3)));

        List<float[]> vectors = provider(endpoint, 3, 10, 2).embed(List.of("5", "6"));

        assertEquals(2, vectors.size());
        assertEquals(5f, vectors.get(0)[0], 0.0001f);
        assertEquals(2, endpoint.calls.get());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(429, "{\"error\":\"rate limited\"}"));

        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider(endpoint, 3, 10, 2).embed(List.of("1")));

        assertTrue(error.transientFailure());
        assertEquals(3, endpoint.calls.get());
    }

    @Test
    void shouldNotRetryClientErrorsOrMalformedPayloads() {
        FakeEmbeddingEndpoint badRequest = new FakeEmbeddingEndpoint(request -> reply(400, "{\"error\":\"bad input\"}"));
        assertThrows(EmbeddingProviderException.class, () -> provider(badRequest, 3, 10, 2).embed(List.of("1")));
        assertEquals(1, badRequest.calls.get());

        FakeEmbeddingEndpoint malformed = new FakeEmbeddingEndpoint(request -> reply(200, "{not json"));
        EmbeddingProviderException error = assertThrows(EmbeddingProviderException.class,
                () -> provider(malformed, 3, 10, 2).embed(List.of("1")));
        assertFalse(error.transientFailure());
        assertEquals(1, malformed.calls.get());
    }

    @Test
    void shouldRejectMissingCredential() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, reversedEmbeddings(request, 3)));
        OpenAiCompatibleEmbeddingProvider provider = new OpenAiCompatibleEmbeddingProvider(endpoint.client(),
                "https://embeddings.test/v1", " ", "text-embedding-v4", 3, 10, 0, Duration.ZERO);

        assertThrows(ConfigurationException.class, () -> provider.embed(List.of("1")));
        assertEquals(0, endpoint.calls.get());

        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        assertThrows(ConfigurationException.class, () -> EmbeddingProviders.fromConfig(config, new OkHttpClient()));
    }

    @Test
    void shouldFailFastWhenDeadlineAlreadyExpired() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, reversedEmbeddings(request, 3)));

        assertThrows(RetrievalTimeoutException.class,
                () -> provider(endpoint, 3, 10, 0).embed(List.of("1"), Deadline.after(Duration.ZERO)));
        assertEquals(0, endpoint.calls.get());
    }

    @Test
    void shouldReturnNothingForEmptyInput() {
        FakeEmbeddingEndpoint endpoint = new FakeEmbeddingEndpoint(request -> reply(200, "{}"));

        assertTrue(provider(endpoint, 3, 10, 0).embed(List.of()).isEmpty());
        assertEquals(0, endpoint.calls.get());
    }

    private static OpenAiCompatibleEmbeddingProvider provider(FakeEmbeddingEndpoint endpoint, int dimensions, int batchSize,
            int maxRetries) {
        return new OpenAiCompatibleEmbeddingProvider(endpoint.client(), "https://embeddings.test/v1/", "test-key",
                "text-embedding-v4", dimensions, batchSize, maxRetries, Duration.ZERO);
    }

    /**
     * Answers with the embeddings in reverse order; each vector starts with its input text parsed
     * as a number.
     */
    private static String reversedEmbeddings(JsonNode request, int dimensions) {
        JsonNode input = request.path("input");
        StringBuilder data = new StringBuilder();
        for (int i = input.size() - 1; i >= 0; i--) {
            if (data.length() > 0) {
                data.append(',');
            }
            data.append("{\"index\":").append(i).append(",\"embedding\":[").append(input.get(i).asText());
            for (int d = 1; d < dimensions; d++) {
                data.append(",0.5");
            }
            data.append("]}");
        }
        return "{\"object\":\"list\",\"data\":[" + data + "],\"model\":\"text-embedding-v4\"}";
    }

    private static FakeReply reply(int code, String body) {
        return new FakeReply(code, body);
    }

    private record FakeReply(int code, String body) {
    }

    private static final class FakeEmbeddingEndpoint implements Interceptor {
        private final Function<JsonNode, FakeReply> handler;
        private final AtomicInteger calls = new AtomicInteger();
        private final List<Integer> batchSizes = new ArrayList<>();
        private JsonNode lastBody;
        private String lastAuthorization;
        private String lastPath;

        private FakeEmbeddingEndpoint(Function<JsonNode, FakeReply> handler) {
            this.handler = handler;
        }

        OkHttpClient client() {
            return new OkHttpClient.Builder().addInterceptor(this).build();
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            calls.incrementAndGet();
            Buffer buffer = new Buffer();
            request.body().writeTo(buffer);
            lastBody = MAPPER.readTree(buffer.readUtf8());
            lastAuthorization = request.header("Authorization");
            lastPath = request.url().encodedPath();
            batchSizes.add(lastBody.path("input").size());

            FakeReply reply = handler.apply(lastBody);
            return new Response.Builder()
                    .request(request)
                    .protocol(Protocol.HTTP_1_1)
                    .code(reply.code())
                    .message("fake")
                    .body(ResponseBody.create(reply.body(), MediaType.get("application/json")))
                    .build();
        }
    }
}
