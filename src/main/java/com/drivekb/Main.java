package com.drivekb;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.cache.CacheLookup;
import com.drivekb.error.KnowledgeBaseException;
import com.drivekb.ingest.IndexStateStore;
import com.drivekb.ingest.IndexStateStore.BuildState;
import com.drivekb.lifecycle.IndexStatus;
import com.drivekb.retrieval.ContextFormatter;
import com.drivekb.retrieval.RankedChunk;
import com.drivekb.retrieval.RetrievalMode;
import com.drivekb.retrieval.RetrievalResult;
import com.drivekb.runtime.AppConfig;
import com.drivekb.runtime.AppConfigLoader;
import com.drivekb.runtime.ConfigValidator;
import com.drivekb.runtime.Deadline;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "drive-kb",
        mixinStandardHelpOptions = true,
        version = "drive-kb 0.1.0",
        description = "Builds and queries the instruction-manual knowledge base used by the driving assistant.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--top-k", description = "Results to return; 0 uses search.defaultTopK", defaultValue = "0")
    int topK;

    @Option(names = "--retrieval-mode", description = "Ranking used in retrieve mode: ${COMPLETION-CANDIDATES}", defaultValue = "HYBRID")
    RetrievalMode retrievalMode;

    @Option(names = "--data-file", description = "Manual text file to index (overrides dataFile)")
    Path dataFile;

    private final InputStream in;
    private final PrintStream out;

    enum Mode {
        ingest,
        rebuild,
        retrieve,
        status,
        interactive
    }

    public Main() {
        this(System.in, System.out);
    }

    Main(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = new AppConfigLoader().load(Path.of(configPath));
        if (dataFile != null) {
            config.setDataFile(dataFile.toString());
        }
        log.info("Starting drive-kb in {} mode", mode);
        log.info("Using config file: {}", configPath);

        List<String> configErrors = ConfigValidator.validate(config);
        if (!configErrors.isEmpty()) {
            configErrors.forEach(error -> log.error("Invalid configuration: {}", error));
            return 2;
        }
        if (mode == Mode.retrieve && (query == null || query.isBlank())) {
            log.error("--query is required in retrieve mode");
            return 2;
        }

        try (KnowledgeBase knowledgeBase = KnowledgeBase.create(config)) {
            switch (mode) {
                case ingest -> {
                    knowledgeBase.initialize();
                    printStatus(knowledgeBase.getStatus());
                }
                case rebuild -> {
                    knowledgeBase.rebuild();
                    printStatus(knowledgeBase.getStatus());
                }
                case status -> {
                    printStatus(knowledgeBase.getStatus());
                    printLastBuild(config);
                }
                case retrieve -> {
                    knowledgeBase.initialize();
                    RetrievalResult result = knowledgeBase.query(query, topK, retrievalMode,
                            Deadline.after(Duration.ofMillis(config.getSearch().getRequestTimeoutMs())));
                    printResult(result);
                }
                case interactive -> {
                    knowledgeBase.initialize();
                    runInteractive(knowledgeBase);
                }
            }
        } catch (KnowledgeBaseException e) {
            log.error("{} failed: {}", mode, e.getMessage(), e);
            return 1;
        }
        return 0;
    }

    private void runInteractive(KnowledgeBase knowledgeBase) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("drive-kb ready. Type a question, /status for index status, /exit to quit.");
        while (true) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.trim()) || "/quit".equals(line.trim())) {
                break;
            }
            String question = line.trim();
            if (question.isEmpty()) {
                continue;
            }
            if ("/status".equals(question)) {
                printStatus(knowledgeBase.getStatus());
                continue;
            }
            try {
                CacheLookup<String> answer = knowledgeBase.lookupOrCompute(question,
                        () -> knowledgeBase.context(question, topK));
                out.println(answer.value());
                log.info("query.telemetry cacheHit={} similarity={}", answer.hit(),
                        String.format(Locale.ROOT, "%.4f", answer.similarity()));
            } catch (KnowledgeBaseException e) {
                log.warn("Query failed: {}", e.getMessage());
                out.println("error: " + e.getMessage());
            }
        }
    }

    private void printResult(RetrievalResult result) {
        if (result.degraded()) {
            out.println("(degraded: " + result.degradationReason() + ")");
        }
        List<RankedChunk> chunks = result.chunks();
        for (int i = 0; i < chunks.size(); i++) {
            RankedChunk chunk = chunks.get(i);
            out.printf(Locale.ROOT, "#%d %s fused=%.4f vector=%.4f keyword=%.4f%n",
                    i + 1, chunk.chunkId(), chunk.fusedScore(), chunk.vectorScore(), chunk.keywordScore());
        }
        out.println(ContextFormatter.format(result));
    }

    private void printLastBuild(AppConfig config) throws IOException {
        if (config.getStatePath() == null || config.getStatePath().isBlank()) {
            return;
        }
        Optional<BuildState> lastBuild = new IndexStateStore(Path.of(config.getStatePath())).load();
        if (lastBuild.isEmpty()) {
            out.println("lastBuild=none");
            return;
        }
        BuildState state = lastBuild.get();
        out.printf(Locale.ROOT, "lastBuild collection=%s chunks=%d builtAt=%s fingerprint=%s%n",
                state.activeCollection(),
                state.documentCount(),
                Instant.ofEpochMilli(state.lastBuildEpochMs()),
                state.sourceFingerprint());
    }

    private void printStatus(IndexStatus status) {
        out.printf(Locale.ROOT, "state=%s documents=%d keywordDocuments=%d cacheSize=%d lastBuild=%s collection=%s%n",
                status.state(),
                status.documentCount(),
                status.keywordDocumentCount(),
                status.cacheSize(),
                status.lastBuildTime() == null ? "never" : status.lastBuildTime(),
                status.activeCollection() == null ? "none" : status.activeCollection());
        if (status.failureCause() != null) {
            out.println("failure=" + status.failureCause());
        }
        status.configWarnings().forEach(warning -> out.println("warning=" + warning));
    }
}
