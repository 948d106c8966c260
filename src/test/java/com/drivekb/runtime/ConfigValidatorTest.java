package com.drivekb.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {

    @Test
    void shouldAcceptOfflineConfig() {
        AppConfig config = new AppConfig();
        config.getEmbedding().setProvider("hashing");
        config.getVectorStore().setBackend("local");

        assertTrue(ConfigValidator.validate(config).isEmpty());
    }

    @Test
    void shouldRequireApiKeyForHostedProvider() {
        AppConfig config = new AppConfig();

        assertEquals(List.of("DASHSCOPE_API_KEY is not set"), ConfigValidator.validate(config));

        config.getEmbedding().setApiKey("sk-test");
        assertTrue(ConfigValidator.validate(config).isEmpty());
    }

    @Test
    void shouldHaveNoWarningsForDefaults() {
        assertTrue(ConfigValidator.warnings(new AppConfig()).isEmpty());
    }

    @Test
    void shouldWarnAboutSettingsThatRunButMisbehave() {
        AppConfig config = new AppConfig();
        config.getEmbedding().setProvider("hashing");
        config.setStatePath("");
        config.getVectorStore().setBackend("Local");
        config.getVectorStore().setLocalDirectory(null);
        config.getSearch().setDefaultTopK(8);
        config.getSearch().setCandidatePoolSize(4);
        config.getSearch().setSubQueryTimeoutMs(20000);
        config.getCache().setSimilarityThreshold(0.3);

        List<String> warnings = ConfigValidator.warnings(config);

        assertTrue(ConfigValidator.validate(config).isEmpty());
        assertEquals(5, warnings.size(), warnings.toString());
        assertTrue(warnings.get(0).startsWith("statePath"));
        assertTrue(warnings.get(1).startsWith("vectorStore.localDirectory"));
        assertTrue(warnings.get(2).startsWith("search.candidatePoolSize (4)"));
        assertTrue(warnings.get(3).startsWith("search.subQueryTimeoutMs"));
        assertTrue(warnings.get(4).startsWith("cache.similarityThreshold"));
    }

    @Test
    void shouldCollectEveryProblem() {
        AppConfig config = new AppConfig();
        config.getEmbedding().setProvider("word2vec");
        config.getVectorStore().setBackend("faiss");
        config.getTextSplitter().setChunkOverlap(300);
        config.getKeyword().setB(1.5);
        config.getSearch().setDefaultTopK(50);
        config.getCache().setSimilarityThreshold(-0.1);

        List<String> errors = ConfigValidator.validate(config);

        assertEquals(6, errors.size(), errors.toString());
        assertTrue(errors.get(0).startsWith("embedding.provider"));
        assertTrue(errors.get(1).startsWith("vectorStore.backend"));
        assertTrue(errors.get(2).startsWith("textSplitter.chunkOverlap"));
        assertTrue(errors.get(3).startsWith("keyword.b"));
        assertTrue(errors.get(4).startsWith("search.defaultTopK"));
        assertTrue(errors.get(5).startsWith("cache.similarityThreshold"));
    }
}
