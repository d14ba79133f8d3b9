package com.easytidal.mirror.cache;

import com.easytidal.mirror.graph.JobGraph;
import com.easytidal.mirror.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A job list and the graph derived from it, captured at one instant.
 * The two are always stored and loaded together.
 */
public record Snapshot(List<Job> jobs, JobGraph graph, Instant createdAt) {

    public Snapshot {
        jobs = List.copyOf(jobs);
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
