package com.bko.planner.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of generation tasks for one plan request. Node ids are unique; edges are derived
 * from each node's dependencies.
 */
@Slf4j
public final class TaskGraph {

    private final String graphId;
    private final Map<String, TaskNode> nodes;

    public TaskGraph(String graphId, List<TaskNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Task graph " + graphId + " has no nodes.");
        }
        Map<String, TaskNode> index = new LinkedHashMap<>();
        for (TaskNode node : nodes) {
            if (index.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate task id " + node.id() + " in graph " + graphId + ".");
            }
        }
        this.graphId = graphId;
        this.nodes = Collections.unmodifiableMap(index);
    }

    public String getGraphId() {
        return graphId;
    }

    public List<TaskNode> getNodes() {
        return List.copyOf(nodes.values());
    }

    public Optional<TaskNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Edges as {@code [from, to]} pairs, in node declaration order.
     */
    public List<List<String>> edges() {
        List<List<String>> edges = new ArrayList<>();
        for (TaskNode node : nodes.values()) {
            node.dependencies().stream().sorted().forEach(dep -> edges.add(List.of(dep, node.id())));
        }
        return edges;
    }

    /**
     * Topological order computed with Kahn's algorithm. Ties are broken by declaration order.
     * Nodes that never reach in-degree zero (cycles, or dependencies on unknown ids) are appended
     * afterwards in declaration order so that every task is scheduled exactly once.
     */
    public List<TaskNode> executionOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (TaskNode node : nodes.values()) {
            inDegree.put(node.id(), node.dependencies().size());
            for (String dep : node.dependencies()) {
                dependents.computeIfAbsent(dep, key -> new ArrayList<>()).add(node.id());
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        nodes.keySet().stream().filter(id -> inDegree.get(id) == 0).forEach(queue::add);

        Set<String> ordered = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            ordered.add(current);
            for (String dependent : dependents.getOrDefault(current, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (ordered.size() < nodes.size()) {
            List<String> stranded = nodes.keySet().stream().filter(id -> !ordered.contains(id)).toList();
            log.warn("Graph {} has {} tasks unreachable by in-degree propagation; appending {}.",
                    graphId, stranded.size(), stranded);
            ordered.addAll(stranded);
        }
        return ordered.stream().map(nodes::get).toList();
    }
}
