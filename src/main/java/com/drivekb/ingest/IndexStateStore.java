package com.drivekb.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Persists what the last successful build published, so a restart can reuse a populated vector
 * collection instead of embedding the manual again.
 */
public class IndexStateStore {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path path;

    public IndexStateStore(Path path) {
        this.path = path;
    }

    public Optional<BuildState> load() throws IOException {
        if (path == null || !Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(path.toFile(), BuildState.class));
    }

    public void save(BuildState state) throws IOException {
        if (path == null) {
            return;
        }
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        // written beside the target and renamed, so readers never see a partial file
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
        Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path path() {
        return path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BuildState(
            String activeCollection,
            int documentCount,
            String sourceFingerprint,
            String buildSignature,
            long lastBuildEpochMs) {
    }
}
