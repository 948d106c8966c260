package com.drivekb.lifecycle;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.drivekb.error.IndexBuildException;
import com.drivekb.error.IndexNotReadyException;
import com.drivekb.index.KeywordIndex;
import com.drivekb.index.VectorIndex;
import com.drivekb.index.VectorIndexFactory;
import com.drivekb.ingest.IndexStateStore;
import com.drivekb.ingest.IndexStateStore.BuildState;
import com.drivekb.ingest.SourceDocument;

/**
 * Owns the active {@link IndexSet} and the state machine around building it:
 * UNINITIALIZED to INITIALIZING to READY, or FAILED when a build throws.
 *
 * <p>Builds alternate between two collections, {@code <name>} and {@code <name>_b}. A build
 * fills the slot that is not active and publishes the new set with one reference swap, so a
 * query holding the previous set keeps a complete pair. The retired slot is reset by the build
 * after next.
 *
 * <p>Builds are serialised; {@link #getStatus()} and {@link #current()} never wait for one.
 */
public class IndexLifecycle {
    private static final Logger log = LoggerFactory.getLogger(IndexLifecycle.class);
    static final String ALTERNATE_SUFFIX = "_b";

    private final IndexBuilder builder;
    private final VectorIndexFactory vectorIndexFactory;
    private final IndexStateStore stateStore;
    private final Path sourcePath;
    private final String collectionName;
    private final Clock clock;

    private final AtomicReference<IndexSet> active = new AtomicReference<>();
    private volatile IndexState state = IndexState.UNINITIALIZED;
    private volatile String failureCause;
    private long generation;

    public IndexLifecycle(IndexBuilder builder,
            VectorIndexFactory vectorIndexFactory,
            IndexStateStore stateStore,
            Path sourcePath,
            String collectionName,
            Clock clock) {
        this.builder = builder;
        this.vectorIndexFactory = vectorIndexFactory;
        this.stateStore = stateStore;
        this.sourcePath = sourcePath;
        this.collectionName = collectionName;
        this.clock = clock;
    }

    /**
     * Makes the index set ready, reusing the collection recorded by the last build when the source
     * document and build settings are unchanged. Does nothing when already READY.
     *
     * @throws IndexBuildException when the build fails, or when a previous build failed and no
     *                             {@link #rebuild()} has been requested since
     */
    public synchronized void initialize() {
        if (state == IndexState.READY) {
            return;
        }
        if (state == IndexState.FAILED) {
            throw new IndexBuildException("initialize", "previous build failed (" + failureCause + "), call rebuild to retry");
        }
        transitionTo(IndexState.INITIALIZING);
        try {
            SourceDocument document = SourceDocument.read(sourcePath);
            Optional<IndexSet> reused = tryReuse(document);
            if (reused.isPresent()) {
                publish(reused.get());
                log.info("Reused collection {} with {} chunks", reused.get().vectorIndex().name(),
                        reused.get().documentCount());
                return;
            }
            buildAndPublish(document, collectionName);
        } catch (IOException | RuntimeException e) {
            throw fail("initialize", e);
        }
    }

    /**
     * Full rebuild from the source document into the inactive collection slot. Allowed from any
     * state; from FAILED this is the retry.
     */
    public synchronized void rebuild() {
        IndexSet previous = active.get();
        transitionTo(IndexState.INITIALIZING);
        try {
            SourceDocument document = SourceDocument.read(sourcePath);
            buildAndPublish(document, inactiveSlot(previous));
        } catch (IOException | RuntimeException e) {
            throw fail("rebuild", e);
        }
    }

    /**
     * The published index set.
     *
     * @throws IndexNotReadyException unless the lifecycle is READY
     */
    public IndexSet current() {
        IndexState observed = state;
        IndexSet indexSet = active.get();
        if (observed != IndexState.READY || indexSet == null) {
            throw new IndexNotReadyException("query", observed);
        }
        return indexSet;
    }

    public IndexState state() {
        return state;
    }

    public IndexStatus getStatus() {
        IndexState observed = state;
        IndexSet indexSet = active.get();
        if (indexSet == null) {
            return new IndexStatus(observed, 0, 0, 0, null, null, failureCause, null);
        }
        return new IndexStatus(observed,
                indexSet.documentCount(),
                indexSet.keywordIndex().documentCount(),
                0,
                indexSet.builtAt(),
                indexSet.vectorIndex().name(),
                failureCause,
                null);
    }

    private Optional<IndexSet> tryReuse(SourceDocument document) {
        Optional<BuildState> persisted = readState();
        if (persisted.isEmpty()) {
            return Optional.empty();
        }
        BuildState previous = persisted.get();
        if (!isSlot(previous.activeCollection())
                || !document.fingerprint().equals(previous.sourceFingerprint())
                || !builder.signature().equals(previous.buildSignature())) {
            log.info("Source or build settings changed since the last build, rebuilding");
            return Optional.empty();
        }
        VectorIndex vectorIndex = vectorIndexFactory.open(previous.activeCollection());
        int count = vectorIndex.count();
        if (count == 0 || count != previous.documentCount()) {
            log.info("Collection {} holds {} chunks but the last build recorded {}, rebuilding",
                    previous.activeCollection(), count, previous.documentCount());
            return Optional.empty();
        }
        KeywordIndex keywordIndex = builder.keywordIndexFor(vectorIndex);
        if (keywordIndex.documentCount() != count) {
            log.warn("Collection {} returned {} of {} chunks, rebuilding",
                    previous.activeCollection(), keywordIndex.documentCount(), count);
            return Optional.empty();
        }
        return Optional.of(new IndexSet(vectorIndex, keywordIndex, ++generation,
                Instant.ofEpochMilli(previous.lastBuildEpochMs()), count));
    }

    private void buildAndPublish(SourceDocument document, String slot) throws IOException {
        log.info("Building index set into collection {} from {}", slot, document.path());
        VectorIndex vectorIndex = vectorIndexFactory.open(slot);
        vectorIndex.reset();
        KeywordIndex keywordIndex = builder.build(document, vectorIndex);
        int count = vectorIndex.count();
        if (count != keywordIndex.documentCount()) {
            throw new IndexBuildException("build", "collection " + slot + " holds " + count
                    + " chunks but the keyword index holds " + keywordIndex.documentCount());
        }

        Instant builtAt = clock.instant();
        stateStore.save(new BuildState(slot, count, document.fingerprint(), builder.signature(), builtAt.toEpochMilli()));
        IndexSet indexSet = new IndexSet(vectorIndex, keywordIndex, ++generation, builtAt, count);
        publish(indexSet);
        log.info("Index set {} ready: {} chunks in {}", indexSet.generation(), count, slot);
    }

    private void publish(IndexSet indexSet) {
        active.set(indexSet);
        failureCause = null;
        transitionTo(IndexState.READY);
    }

    private IndexBuildException fail(String operation, Exception cause) {
        failureCause = cause.getMessage();
        transitionTo(IndexState.FAILED);
        log.error("Index {} failed: {}", operation, cause.getMessage(), cause);
        if (cause instanceof IndexBuildException buildException) {
            return buildException;
        }
        return new IndexBuildException(operation, "index build failed: " + cause.getMessage(), cause);
    }

    private void transitionTo(IndexState next) {
        log.info("Index state {} -> {}", state, next);
        state = next;
    }

    String inactiveSlot(IndexSet current) {
        if (current == null) {
            return readState().map(BuildState::activeCollection)
                    .filter(collectionName::equals)
                    .map(unused -> collectionName + ALTERNATE_SUFFIX)
                    .orElse(collectionName);
        }
        return current.vectorIndex().name().equals(collectionName) ? collectionName + ALTERNATE_SUFFIX : collectionName;
    }

    /**
     * The persisted build state, or empty when there is none or it cannot be read. An unreadable
     * file only costs the reuse; the next successful build overwrites it.
     */
    private Optional<BuildState> readState() {
        try {
            return stateStore.load();
        } catch (IOException e) {
            log.warn("Ignoring unreadable build state {}: {}", stateStore.path(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isSlot(String name) {
        return collectionName.equals(name) || (collectionName + ALTERNATE_SUFFIX).equals(name);
    }
}
