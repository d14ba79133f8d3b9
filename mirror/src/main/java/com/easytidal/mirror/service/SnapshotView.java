package com.easytidal.mirror.service;

import com.easytidal.mirror.cache.Snapshot;
import com.easytidal.mirror.graph.JobGraph;
import com.easytidal.mirror.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * A snapshot as returned to callers, tagged with whether it was served from
 * the cache or rebuilt for this request.
 *
 * The graph is a private copy; changing it never affects the snapshot it
 * came from.
 */
public record SnapshotView(List<Job> jobs, JobGraph graph, DataSource source, Instant createdAt) {

    static SnapshotView of(Snapshot snapshot, DataSource source) {
        return new SnapshotView(snapshot.jobs(), snapshot.graph().copy(), source, snapshot.createdAt());
    }
}
