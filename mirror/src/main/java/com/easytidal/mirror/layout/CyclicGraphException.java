package com.easytidal.mirror.layout;

import java.util.List;

/**
 * Thrown when a graph handed to the layout contains a cycle, so that
 * longest-path levels are undefined.
 */
public class CyclicGraphException extends RuntimeException {

    private final List<String> cycle;

    /**
     * @param cycle the nodes on the cycle, starting and ending with the same node
     */
    public CyclicGraphException(List<String> cycle) {
        super("Dependency graph contains a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() { return cycle; }
}
