package com.drivekb.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads {@link AppConfig} from YAML and applies the environment overrides
 * ({@code DASHSCOPE_API_KEY}, {@code CHROMA_URL}, {@code DRIVEKB_DATA_FILE}).
 */
public class AppConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AppConfigLoader.class);

    static final String API_KEY_ENV = "DASHSCOPE_API_KEY";
    static final String CHROMA_URL_ENV = "CHROMA_URL";
    static final String DATA_FILE_ENV = "DRIVEKB_DATA_FILE";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    public AppConfigLoader() {
        this(System.getenv());
    }

    public AppConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public AppConfig load(Path config) throws IOException {
        AppConfig appConfig;
        if (config == null || !Files.exists(config)) {
            log.info("Config file {} not found; using defaults", config);
            appConfig = new AppConfig();
        } else {
            appConfig = mapper.readValue(config.toFile(), AppConfig.class);
        }
        applyEnvironment(appConfig);
        return appConfig;
    }

    void applyEnvironment(AppConfig config) {
        String apiKey = environment.get(API_KEY_ENV);
        if (apiKey != null && !apiKey.isBlank()) {
            config.getEmbedding().setApiKey(apiKey);
        }
        String chromaUrl = environment.get(CHROMA_URL_ENV);
        if (chromaUrl != null && !chromaUrl.isBlank()) {
            config.getVectorStore().setUrl(chromaUrl);
        }
        String dataFile = environment.get(DATA_FILE_ENV);
        if (dataFile != null && !dataFile.isBlank()) {
            config.setDataFile(dataFile);
        }
    }
}
