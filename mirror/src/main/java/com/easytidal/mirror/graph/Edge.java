package com.easytidal.mirror.graph;

/** A directed trigger link between two job names. */
public record Edge(String source, String target) {}
