package com.easytidal.mirror.api;

import com.easytidal.mirror.api.dto.HistoryResponse;
import com.easytidal.mirror.api.dto.JobsResponse;
import com.easytidal.mirror.api.dto.LayoutResponse;
import com.easytidal.mirror.api.dto.OutputResponse;
import com.easytidal.mirror.api.dto.RefreshResponse;
import com.easytidal.mirror.cache.Snapshot;
import com.easytidal.mirror.service.JobGraphService;
import com.easytidal.mirror.service.SnapshotView;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * REST API over the mirrored job graph and its history.
 *
 * GET  /api/jobs               : jobs and trigger edges (cached or fresh)
 * POST /api/refresh            : drop the cache and rebuild from Tidal
 * GET  /api/layout             : levels and x/y positions for the graph
 * GET  /api/history            : recent history, optionally for one job
 * GET  /api/history/jobs       : job names that have history
 * GET  /api/jobs/{id}/history  : recent history for one job id
 * GET  /api/jobs/{id}/output   : execution output fetched from Tidal
 *
 * Errors are turned into JSON by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class JobGraphController {

    private final JobGraphService service;
    private final Clock           clock;

    public JobGraphController(JobGraphService service, Clock clock) {
        this.service = service;
        this.clock   = clock;
    }

    @GetMapping("/jobs")
    public JobsResponse jobs() {
        return JobsResponse.from(service.getSnapshot(), clock.instant());
    }

    /**
     * Force a rebuild. Example:
     *   curl -X POST http://localhost:8080/api/refresh
     */
    @PostMapping("/refresh")
    public RefreshResponse refresh() {
        Snapshot snapshot = service.refresh();
        return new RefreshResponse(true, "Data refreshed successfully",
                snapshot.jobs().size(), snapshot.graph().edgeCount(), clock.instant());
    }

    /**
     * Returns 422 if the trigger data contains a cycle.
     */
    @GetMapping("/layout")
    public LayoutResponse layout() {
        SnapshotView view = service.getSnapshot();
        return new LayoutResponse(
                service.levels(view.graph()),
                service.layout(view.graph()),
                view.graph().edges(),
                view.source());
    }

    @GetMapping("/history")
    public HistoryResponse history(@RequestParam(name = "job", required = false) String job,
                                   @RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (job == null || job.isBlank()) {
            return new HistoryResponse(null, service.recentHistory(limit));
        }
        return new HistoryResponse(job, service.historyFor(job, limit));
    }

    @GetMapping("/history/jobs")
    public List<String> historyJobNames() {
        return List.copyOf(service.historyJobNames());
    }

    @GetMapping("/jobs/{id}/history")
    public HistoryResponse jobHistory(@PathVariable String id,
                                      @RequestParam(name = "limit", defaultValue = "10") int limit) {
        return new HistoryResponse(id, service.historyFor(id, limit));
    }

    @GetMapping("/jobs/{id}/output")
    public OutputResponse jobOutput(@PathVariable String id) {
        return new OutputResponse(id, service.jobOutput(id));
    }
}
