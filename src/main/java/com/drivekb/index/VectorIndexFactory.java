package com.drivekb.index;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import com.drivekb.error.ConfigurationException;
import com.drivekb.runtime.AppConfig;

import okhttp3.OkHttpClient;

/**
 * Opens a named collection on the configured backend. The lifecycle asks for one handle per
 * collection slot it builds into.
 */
@FunctionalInterface
public interface VectorIndexFactory {

    VectorIndex open(String collectionName);

    static VectorIndexFactory fromConfig(AppConfig.VectorStoreConfig config, int dimension, OkHttpClient httpClient) {
        String backend = config.getBackend() == null ? "" : config.getBackend().trim().toLowerCase(Locale.ROOT);
        return switch (backend) {
            case "chroma" -> {
                OkHttpClient client = httpClient.newBuilder()
                        .callTimeout(Duration.ofMillis(config.getTimeoutMs()))
                        .build();
                yield name -> new ChromaVectorIndex(client, config.getUrl(), config.getTenant(), config.getDatabase(),
                        name, dimension);
            }
            case "local" -> {
                String directory = config.getLocalDirectory();
                if (directory == null || directory.isBlank()) {
                    yield name -> new LocalJsonVectorIndex(name, dimension);
                }
                yield name -> LocalJsonVectorIndex.open(name, dimension, Path.of(directory).resolve(name + ".json"));
            }
            default -> throw new ConfigurationException("vector store", "unsupported vector store backend: " + config.getBackend());
        };
    }
}
