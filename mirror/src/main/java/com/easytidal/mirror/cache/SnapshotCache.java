package com.easytidal.mirror.cache;

import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.graph.JobGraph;
import com.easytidal.mirror.store.JsonFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * File-backed cache holding a single {@link Snapshot}.
 *
 * Expiry is measured from the timestamp stored inside the file, not from
 * the file's modification time, so copying or touching the file doesn't
 * change whether it is fresh.
 *
 * <p>Validity and loading are separate calls: {@link #load()} returns
 * whatever is on disk, expired or not, and the caller decides whether a
 * stale snapshot is acceptable.
 *
 * <p>There is no in-process locking. Concurrent {@link #save} calls are
 * serialised by the atomic rename: the last writer wins and readers never
 * see a partial file.
 */
@Component
public class SnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

    private final Path         file;
    private final Duration     ttl;
    private final ObjectMapper json;
    private final Clock        clock;

    @Autowired
    public SnapshotCache(MirrorProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(properties.cache().file(), properties.cache().ttl(), objectMapper, clock);
    }

    public SnapshotCache(Path file, Duration ttl, ObjectMapper objectMapper, Clock clock) {
        this.file  = file;
        this.ttl   = ttl;
        this.json  = objectMapper;
        this.clock = clock;
    }

    /** True iff a snapshot is stored and {@code now < createdAt + ttl}. */
    public boolean isValid() {
        return load().map(this::isFresh).orElse(false);
    }

    /** Whether the given snapshot is still within the TTL. */
    public boolean isFresh(Snapshot snapshot) {
        return clock.instant().isBefore(snapshot.createdAt().plus(ttl));
    }

    /** The stored snapshot, regardless of age. */
    public Optional<Snapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            SnapshotDocument doc = json.readValue(file.toFile(), SnapshotDocument.class);
            if (doc.jobs() == null || doc.graph() == null || doc.timestamp() == null) {
                throw new CacheIOException("Cache file " + file + " is incomplete", null);
            }
            checkElements(doc);
            return Optional.of(new Snapshot(doc.jobs(), JobGraph.fromNodeLink(doc.graph()), doc.timestamp()));
        } catch (IOException e) {
            throw new CacheIOException("Failed to read cache file " + file, e);
        }
    }

    /** Replace the stored snapshot in one atomic step. */
    public void save(Snapshot snapshot) {
        SnapshotDocument doc = new SnapshotDocument(
                snapshot.jobs(), snapshot.graph().toNodeLink(), snapshot.createdAt());
        try {
            JsonFiles.writeAtomically(file, json, doc);
        } catch (IOException e) {
            throw new CacheIOException("Failed to write cache file " + file, e);
        }
        log.info("Cached snapshot of {} jobs ({}) at {}", snapshot.jobs().size(), snapshot.graph(), file);
    }

    /** Drop the stored snapshot; a no-op when there is none. */
    public void invalidate() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Invalidated snapshot cache {}", file);
            }
        } catch (IOException e) {
            throw new CacheIOException("Failed to delete cache file " + file, e);
        }
    }

    public Duration ttl() {
        return ttl;
    }

    private void checkElements(SnapshotDocument doc) {
        boolean broken = doc.jobs().contains(null)
                || doc.graph().nodes().stream().anyMatch(n -> n.id() == null)
                || doc.graph().links().stream().anyMatch(l -> l.source() == null || l.target() == null);
        if (broken) {
            throw new CacheIOException("Cache file " + file + " contains null jobs, nodes or links", null);
        }
    }
}
