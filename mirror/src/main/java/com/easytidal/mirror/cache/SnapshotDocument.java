package com.easytidal.mirror.cache;

import com.easytidal.mirror.graph.NodeLinkGraph;
import com.easytidal.mirror.model.Job;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

/**
 * On-disk shape of the cache file: {"jobs": [...], "graph": {...}, "timestamp": "..."}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SnapshotDocument(List<Job> jobs, NodeLinkGraph graph, Instant timestamp) {}
