package com.easytidal.mirror.history;

import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.store.JsonFiles;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only log of job status observations, capped at a fixed number of
 * entries (oldest dropped first) and stored as a JSON array.
 *
 * Every append rewrites the whole file: load, add, trim to the newest
 * {@code cap} entries, write back. That is O(n) per call, so callers that
 * record many entries at once should use {@link #appendAll}.
 *
 * <p>Appends are funnelled through a single writer thread. Request threads
 * submit their batch and wait for it, which keeps the read-modify-write
 * cycle from interleaving without any locks in the callers. Reads go
 * straight to the file; the atomic rename on write means they always see a
 * complete document.
 *
 * <p>This serialises writers within one JVM only. Two processes sharing
 * one history file can still lose each other's entries.
 */
@Component
public class HistoryLog {

    private static final Logger log = LoggerFactory.getLogger(HistoryLog.class);

    public static final int DEFAULT_CAP = 1000;

    private static final TypeReference<List<HistoryEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Path         file;
    private final int          cap;
    private final ObjectMapper json;

    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "history-writer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public HistoryLog(MirrorProperties properties, ObjectMapper objectMapper) {
        this(properties.history().file(), properties.history().cap(), objectMapper);
    }

    public HistoryLog(Path file, int cap, ObjectMapper objectMapper) {
        if (cap < 1) throw new IllegalArgumentException("cap must be positive: " + cap);
        this.file = file;
        this.cap  = cap;
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    public void append(HistoryEntry entry) {
        appendAll(List.of(entry));
    }

    /**
     * Append a batch in one read-modify-write cycle. Blocks until the entries
     * are on disk.
     *
     * @throws HistoryIOException if the file can't be read or written, or the log is closed
     */
    public void appendAll(List<HistoryEntry> entries) {
        if (entries.isEmpty()) return;
        List<HistoryEntry> batch = List.copyOf(entries);
        Future<?> done;
        try {
            done = writer.submit(() -> {
                writeBatch(batch);
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new HistoryIOException("History log is closed", e);
        }
        try {
            done.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof HistoryIOException hio) throw hio;
            throw new HistoryIOException("History append failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HistoryIOException("Interrupted while appending to history", e);
        }
    }

    /** Runs on the writer thread only. */
    private void writeBatch(List<HistoryEntry> batch) {
        List<HistoryEntry> all = new ArrayList<>(loadAll());
        all.addAll(batch);
        int dropped = Math.max(0, all.size() - cap);
        List<HistoryEntry> kept = dropped == 0 ? all : all.subList(dropped, all.size());
        try {
            JsonFiles.writeAtomically(file, json, kept);
        } catch (IOException e) {
            throw new HistoryIOException("Failed to write history file " + file, e);
        }
        log.debug("Appended {} history entries ({} evicted, {} retained)", batch.size(), dropped, kept.size());
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** Every stored entry, oldest first. A missing file reads as empty. */
    public List<HistoryEntry> loadAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<HistoryEntry> entries = json.readValue(file.toFile(), ENTRY_LIST);
            if (entries == null) {
                return List.of();
            }
            if (entries.contains(null)) {
                throw new HistoryIOException("History file " + file + " contains null entries", null);
            }
            return entries;
        } catch (IOException e) {
            throw new HistoryIOException("Failed to read history file " + file, e);
        }
    }

    /**
     * The newest {@code limit} entries for one job, matched on name or id,
     * oldest first.
     */
    public List<HistoryEntry> queryByJob(String nameOrId, int limit) {
        List<HistoryEntry> matched = loadAll().stream()
                .filter(e -> e.matches(nameOrId))
                .toList();
        return tail(matched, limit);
    }

    /** The newest {@code limit} entries overall, oldest first. */
    public List<HistoryEntry> queryAll(int limit) {
        return tail(loadAll(), limit);
    }

    /** Distinct job names present in the log, sorted. */
    public SortedSet<String> jobNames() {
        SortedSet<String> names = new TreeSet<>();
        loadAll().forEach(e -> names.add(e.jobName()));
        return names;
    }

    public int cap() {
        return cap;
    }

    @PreDestroy
    public void close() {
        writer.shutdown();
    }

    private static List<HistoryEntry> tail(List<HistoryEntry> entries, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must not be negative: " + limit);
        int from = Math.max(0, entries.size() - limit);
        return List.copyOf(entries.subList(from, entries.size()));
    }
}
