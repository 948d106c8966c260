package com.drivekb.embedding;

import java.time.Duration;
import java.util.Locale;

import com.drivekb.error.ConfigurationException;
import com.drivekb.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private EmbeddingProviders() {
    }

    public static EmbeddingProvider fromConfig(AppConfig.EmbeddingConfig config, OkHttpClient httpClient) {
        String provider = config.getProvider() == null ? "" : config.getProvider().strip().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingProvider(config.getDimensions());
            case "dashscope", "openai" -> {
                if (config.getApiKey() == null || config.getApiKey().isBlank()) {
                    throw new ConfigurationException("embedding", "DASHSCOPE_API_KEY is not set");
                }
                OkHttpClient client = httpClient.newBuilder()
                        .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                        .build();
                yield new OpenAiCompatibleEmbeddingProvider(
                        client,
                        config.getBaseUrl(),
                        config.getApiKey(),
                        config.getModel(),
                        config.getDimensions(),
                        config.getBatchSize(),
                        config.getMaxRetries(),
                        Duration.ofMillis(config.getRetryBackoffMs()));
            }
            default -> throw new ConfigurationException("embedding", "unknown embedding provider: " + config.getProvider());
        };
    }
}
