package com.easytidal.mirror.layout;

import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.graph.JobGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Left-to-right layered layout for dependency graphs.
 *
 * A node's level is the length of the longest trigger chain reaching it:
 * roots sit at level 0, every other node one column right of its deepest
 * predecessor. Columns are {@code horizontalSpacing} apart; nodes in a
 * column are spaced {@code verticalSpacing} apart and centred on y = 0.
 *
 * <p>Levels are computed with an explicit stack rather than recursion, so
 * deep chains can't overflow the thread stack. A node met again while it is
 * still on the stack closes a cycle and fails the layout with
 * {@link CyclicGraphException}.
 */
@Component
public class HierarchicalLayout {

    private final double horizontalSpacing;
    private final double verticalSpacing;

    public HierarchicalLayout(MirrorProperties properties) {
        this(properties.layout().horizontalSpacing(), properties.layout().verticalSpacing());
    }

    public HierarchicalLayout(double horizontalSpacing, double verticalSpacing) {
        this.horizontalSpacing = horizontalSpacing;
        this.verticalSpacing   = verticalSpacing;
    }

    /**
     * Coordinates for every node of the graph. Empty graph gives an empty map.
     *
     * @throws CyclicGraphException if the graph has a cycle
     */
    public Map<String, Point> layout(JobGraph graph) {
        Map<String, Integer> levels = assignLevels(graph);

        // Columns in level order; within a column, graph insertion order.
        Map<Integer, List<String>> columns = new TreeMap<>();
        for (String node : graph.nodes()) {
            columns.computeIfAbsent(levels.get(node), k -> new ArrayList<>()).add(node);
        }

        Map<String, Point> positions = new LinkedHashMap<>();
        columns.forEach((level, nodes) -> {
            double x = level * horizontalSpacing;
            int size = nodes.size();
            for (int i = 0; i < size; i++) {
                double y = (i - size / 2.0 + 0.5) * verticalSpacing;
                positions.put(nodes.get(i), new Point(x, y));
            }
        });
        return positions;
    }

    /**
     * Longest-path level of every node, in graph insertion order.
     *
     * @throws CyclicGraphException if the graph has a cycle
     */
    public Map<String, Integer> assignLevels(JobGraph graph) {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String start : graph.nodes()) {
            if (!levels.containsKey(start)) {
                walk(graph, start, levels);
            }
        }

        Map<String, Integer> ordered = new LinkedHashMap<>();
        graph.nodes().forEach(n -> ordered.put(n, levels.get(n)));
        return ordered;
    }

    /**
     * Depth-first over predecessors from {@code start}. A node's level is
     * recorded once all of its predecessors have one.
     */
    private static void walk(JobGraph graph, String start, Map<String, Integer> levels) {
        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        stack.push(new Frame(start, graph.predecessors(start).iterator()));
        onStack.add(start);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.pending.hasNext()) {
                String pred = top.pending.next();
                if (levels.containsKey(pred)) {
                    continue;
                }
                if (onStack.contains(pred)) {
                    throw new CyclicGraphException(cyclePath(stack, pred));
                }
                stack.push(new Frame(pred, graph.predecessors(pred).iterator()));
                onStack.add(pred);
            } else {
                int level = 0;
                for (String pred : graph.predecessors(top.node)) {
                    level = Math.max(level, levels.get(pred) + 1);
                }
                levels.put(top.node, level);
                onStack.remove(top.node);
                stack.pop();
            }
        }
    }

    /**
     * Each frame on the stack is a predecessor of the frame below it, so
     * reading top to bottom follows trigger edges. {@code repeated} triggers
     * the top frame and sits further down, which closes the loop.
     */
    private static List<String> cyclePath(Deque<Frame> stack, String repeated) {
        List<String> chain = new ArrayList<>();
        chain.add(repeated);
        for (Frame f : stack) {          // top to bottom
            chain.add(f.node);
            if (f.node.equals(repeated)) break;
        }
        return chain;
    }

    private static final class Frame {
        final String           node;
        final Iterator<String> pending;

        Frame(String node, Iterator<String> pending) {
            this.node    = node;
            this.pending = pending;
        }
    }
}
