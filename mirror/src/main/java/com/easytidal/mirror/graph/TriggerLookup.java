package com.easytidal.mirror.graph;

import com.easytidal.mirror.model.Trigger;

import java.util.List;

/**
 * Source of trigger data for the graph builder. {@code TidalClient::listTriggers}
 * is the production implementation.
 */
@FunctionalInterface
public interface TriggerLookup {

    List<Trigger> triggersFor(String jobId);
}
