package com.easytidal.mirror.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Serialised form of a {@link JobGraph}: an explicit node list plus an
 * explicit list of source/target links. Keeps the cache file readable and
 * diff-able.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeLinkGraph(
        boolean    directed,
        boolean    multigraph,
        List<Node> nodes,
        List<Link> links
) {

    public NodeLinkGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Link(String source, String target) {}
}
