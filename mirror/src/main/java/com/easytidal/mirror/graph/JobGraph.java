package com.easytidal.mirror.graph;

import com.easytidal.mirror.model.Job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Directed graph over job names.
 *
 * Nodes and edges keep insertion order, which the layout uses to order
 * nodes within a column. Cycles are representable; it is up to consumers
 * (the layout) to reject them.
 *
 * Not thread-safe. Instances handed out by the cache are never mutated.
 */
public class JobGraph {

    private final Map<String, Set<String>> successors   = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();

    /** Add a node; adding an existing node is a no-op. */
    public void addNode(String name) {
        successors.computeIfAbsent(name, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(name, k -> new LinkedHashSet<>());
    }

    /** Add an edge, creating either endpoint if it doesn't exist yet. */
    public void addEdge(String source, String target) {
        addNode(source);
        addNode(target);
        successors.get(source).add(target);
        predecessors.get(target).add(source);
    }

    public boolean containsNode(String name) {
        return successors.containsKey(name);
    }

    /** All nodes in insertion order. */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(successors.keySet());
    }

    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        successors.forEach((source, targets) ->
                targets.forEach(target -> edges.add(new Edge(source, target))));
        return edges;
    }

    public Set<String> predecessors(String name) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(name, Set.of()));
    }

    public Set<String> successors(String name) {
        return Collections.unmodifiableSet(successors.getOrDefault(name, Set.of()));
    }

    public int nodeCount() {
        return successors.size();
    }

    public int edgeCount() {
        return successors.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return successors.isEmpty();
    }

    /**
     * Nodes that exist only because a trigger pointed at them: they are not
     * in the given job list, so they have no status and no history.
     */
    public Set<String> implicitNodes(List<Job> jobs) {
        Set<String> known = jobs.stream().map(Job::name).collect(Collectors.toSet());
        return successors.keySet().stream()
                .filter(n -> !known.contains(n))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // ------------------------------------------------------------------
    // Node-link conversion
    // ------------------------------------------------------------------

    public NodeLinkGraph toNodeLink() {
        List<NodeLinkGraph.Node> nodes = successors.keySet().stream()
                .map(NodeLinkGraph.Node::new)
                .toList();
        List<NodeLinkGraph.Link> links = edges().stream()
                .map(e -> new NodeLinkGraph.Link(e.source(), e.target()))
                .toList();
        return new NodeLinkGraph(true, false, nodes, links);
    }

    public static JobGraph fromNodeLink(NodeLinkGraph data) {
        JobGraph graph = new JobGraph();
        data.nodes().forEach(n -> graph.addNode(n.id()));
        data.links().forEach(l -> graph.addEdge(l.source(), l.target()));
        return graph;
    }

    /** Deep copy; snapshot views hand these out so callers can't alter a cached snapshot's graph. */
    public JobGraph copy() {
        return fromNodeLink(toNodeLink());
    }

    @Override
    public String toString() {
        return "JobGraph{nodes=" + nodeCount() + ", edges=" + edgeCount() + "}";
    }
}
