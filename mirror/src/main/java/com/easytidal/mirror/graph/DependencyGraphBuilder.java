package com.easytidal.mirror.graph;

import com.easytidal.mirror.model.Job;
import com.easytidal.mirror.model.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Turns a job list plus per-job trigger lookups into a {@link JobGraph}.
 *
 * One trigger lookup is made per job. The build is fail-fast: if any lookup
 * throws, the exception propagates untouched and no graph is produced, so a
 * half-built graph can never reach the cache.
 *
 * A trigger may name a job that is not in the list. The edge is kept and the
 * target becomes an implicit node. That usually points at stale or
 * cross-directory data upstream, so it is logged rather than rejected.
 */
@Component
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public JobGraph build(List<Job> jobs, TriggerLookup triggers) {
        JobGraph graph = new JobGraph();
        for (Job job : jobs) {
            graph.addNode(job.name());
            List<Trigger> fired = triggers.triggersFor(job.id());
            for (Trigger t : fired) {
                graph.addEdge(job.name(), t.triggeredJobName());
            }
        }

        Set<String> implicit = graph.implicitNodes(jobs);
        if (!implicit.isEmpty()) {
            log.warn("{} trigger target(s) are not in the job list and have no status: {}",
                    implicit.size(), implicit);
        }
        log.info("Built dependency graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}
