package com.easytidal.mirror.api.dto;

import com.easytidal.mirror.graph.Edge;
import com.easytidal.mirror.model.Job;
import com.easytidal.mirror.service.DataSource;
import com.easytidal.mirror.service.SnapshotView;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Response body for GET /api/jobs.
 *
 * implicitNodes lists trigger targets that are not in the job list; the
 * dashboard shows them greyed out since they have no status.
 */
public record JobsResponse(
        List<Job>   jobs,
        List<Edge>  dependencies,
        Set<String> implicitNodes,
        DataSource  dataSource,
        int         jobCount,
        int         edgeCount,
        Instant     snapshotTime,
        Instant     timestamp
) {
    public static JobsResponse from(SnapshotView view, Instant now) {
        return new JobsResponse(
                view.jobs(),
                view.graph().edges(),
                view.graph().implicitNodes(view.jobs()),
                view.source(),
                view.jobs().size(),
                view.graph().edgeCount(),
                view.createdAt(),
                now
        );
    }
}
