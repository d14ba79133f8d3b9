package com.easytidal.mirror.service;

import com.easytidal.mirror.cache.Snapshot;
import com.easytidal.mirror.cache.SnapshotCache;
import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.graph.DependencyGraphBuilder;
import com.easytidal.mirror.graph.JobGraph;
import com.easytidal.mirror.history.HistoryEntry;
import com.easytidal.mirror.history.HistoryLog;
import com.easytidal.mirror.layout.HierarchicalLayout;
import com.easytidal.mirror.layout.Point;
import com.easytidal.mirror.model.Job;
import com.easytidal.mirror.model.JobStatus;
import com.easytidal.mirror.scheduler.SchedulerException;
import com.easytidal.mirror.scheduler.TidalClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.function.Supplier;

/**
 * The query surface the web layer talks to.
 *
 * Decides between the cached snapshot and a rebuild, and records one
 * history entry per job whenever a snapshot is rebuilt.
 *
 * Failure policy:
 *   - listing jobs or building the graph: fail fast, nothing is cached,
 *     the caller gets the original exception with its kind;
 *   - fetching a single job's status: logged and skipped, the remaining
 *     jobs still get history entries.
 * There is no fallback to stale or sample data.
 */
@Service
public class JobGraphService {

    private static final Logger log = LoggerFactory.getLogger(JobGraphService.class);

    private final TidalClient            client;
    private final DependencyGraphBuilder builder;
    private final SnapshotCache          cache;
    private final HistoryLog             history;
    private final HierarchicalLayout     layout;
    private final MirrorProperties       properties;
    private final Clock                  clock;
    private final MeterRegistry          meters;

    public JobGraphService(TidalClient client,
                           DependencyGraphBuilder builder,
                           SnapshotCache cache,
                           HistoryLog history,
                           HierarchicalLayout layout,
                           MirrorProperties properties,
                           Clock clock,
                           MeterRegistry meters) {
        this.client     = client;
        this.builder    = builder;
        this.cache      = cache;
        this.history    = history;
        this.layout     = layout;
        this.properties = properties;
        this.clock      = clock;
        this.meters     = meters;
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    /**
     * The current snapshot: from the cache while it is within its TTL,
     * otherwise rebuilt from the scheduler (which also records history).
     *
     * @throws SchedulerException if a rebuild was needed and the scheduler failed
     */
    public SnapshotView getSnapshot() {
        Optional<Snapshot> cached = cache.load().filter(cache::isFresh);
        if (cached.isPresent()) {
            meters.counter("easytidal.cache.requests", "result", "hit").increment();
            log.debug("Serving snapshot from cache (created {})", cached.get().createdAt());
            return SnapshotView.of(cached.get(), DataSource.CACHE);
        }
        meters.counter("easytidal.cache.requests", "result", "miss").increment();
        log.info("Snapshot cache missing or expired, fetching from Tidal");
        return SnapshotView.of(rebuild(), DataSource.FRESH);
    }

    /**
     * Drop the cache and rebuild it from the scheduler unconditionally,
     * recording a history entry per job.
     */
    public Snapshot refresh() {
        log.info("Forced refresh requested");
        cache.invalidate();
        try {
            Snapshot snapshot = rebuild();
            meters.counter("easytidal.refresh", "outcome", "success").increment();
            return snapshot;
        } catch (RuntimeException e) {
            meters.counter("easytidal.refresh", "outcome", "failure").increment();
            log.error("Refresh failed: {}", e.getMessage());
            throw e;
        }
    }

    private Snapshot rebuild() {
        List<Job> jobs = client.listJobs(properties.scheduler().directory());
        JobGraph graph = Timer.builder("easytidal.graph.build")
                .register(meters)
                .record(() -> builder.build(jobs, client::listTriggers));
        Snapshot snapshot = new Snapshot(jobs, graph, clock.instant());
        cache.save(snapshot);
        recordStatuses(jobs);
        return snapshot;
    }

    /**
     * Fetch each job's current status and append it to the history log in
     * one batch. Jobs whose status can't be fetched are skipped.
     *
     * @return number of entries recorded
     */
    int recordStatuses(List<Job> jobs) {
        boolean captureOutput = properties.history().captureOutput();
        List<HistoryEntry> entries = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            JobStatus status;
            try {
                status = client.getStatus(job.id());
            } catch (SchedulerException e) {
                meters.counter("easytidal.status.skipped", "kind", e.getKind().name().toLowerCase(Locale.ROOT)).increment();
                log.warn("Failed to get status for job '{}' ({}): {}", job.name(), job.id(), e.getMessage());
                continue;
            }
            String output   = captureOutput ? fetchQuietly(() -> client.getOutput(job.id()), job, "output") : null;
            String errorLog = captureOutput && status == JobStatus.FAILED
                    ? fetchQuietly(() -> client.getLog(job.id(), "stderr"), job, "stderr")
                    : null;
            entries.add(new HistoryEntry(clock.instant(), job.id(), job.name(), status, output, errorLog));
        }
        history.appendAll(entries);
        log.info("Recorded status for {}/{} jobs", entries.size(), jobs.size());
        return entries.size();
    }

    /** Output is a nice-to-have on a history entry; losing it must not lose the status. */
    private String fetchQuietly(Supplier<String> call, Job job, String what) {
        try {
            return call.get();
        } catch (SchedulerException e) {
            log.warn("Could not fetch {} for job '{}': {}", what, job.name(), e.getMessage());
            return null;
        }
    }

    // ------------------------------------------------------------------
    // Layout
    // ------------------------------------------------------------------

    public Map<String, Point> layout(JobGraph graph) {
        return layout.layout(graph);
    }

    public Map<String, Integer> levels(JobGraph graph) {
        return layout.assignLevels(graph);
    }

    // ------------------------------------------------------------------
    // History and output
    // ------------------------------------------------------------------

    public List<HistoryEntry> historyFor(String jobNameOrId, int limit) {
        return history.queryByJob(jobNameOrId, limit);
    }

    public List<HistoryEntry> recentHistory(int limit) {
        return history.queryAll(limit);
    }

    public SortedSet<String> historyJobNames() {
        return history.jobNames();
    }

    public String jobOutput(String jobId) {
        return client.getOutput(jobId);
    }
}
