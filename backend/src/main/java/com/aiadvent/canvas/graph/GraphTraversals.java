package com.aiadvent.canvas.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/** Breadth-first reachability helpers shared by validation and planning. */
public final class GraphTraversals {

  private GraphTraversals() {
    throw new AssertionError("Utility class");
  }

  /** Nodes reachable from {@code start} along outgoing edges, {@code start} included. */
  public static Set<String> forward(WorkflowGraph graph, String start) {
    return walk(graph, start, graph::outgoing, WorkflowEdge::targetNodeId, id -> true);
  }

  /**
   * Nodes reachable from {@code start} without passing through a node rejected by {@code enter}.
   * Rejected nodes are not part of the result.
   */
  public static Set<String> forward(WorkflowGraph graph, String start, Predicate<String> enter) {
    return walk(graph, start, graph::outgoing, WorkflowEdge::targetNodeId, enter);
  }

  /** Nodes that reach {@code start} along outgoing edges, {@code start} included. */
  public static Set<String> backward(WorkflowGraph graph, String start) {
    return walk(graph, start, graph::incoming, WorkflowEdge::sourceNodeId, id -> true);
  }

  /** Nodes lying on some cycle through {@code loopNodeId}, the loop node itself excluded. */
  public static Set<String> loopBody(WorkflowGraph graph, String loopNodeId) {
    Set<String> body = new LinkedHashSet<>(forward(graph, loopNodeId));
    body.retainAll(backward(graph, loopNodeId));
    body.remove(loopNodeId);
    return body;
  }

  private static Set<String> walk(
      WorkflowGraph graph,
      String start,
      Function<String, List<WorkflowEdge>> edges,
      Function<WorkflowEdge, String> next,
      Predicate<String> enter) {
    Set<String> visited = new LinkedHashSet<>();
    if (!graph.contains(start)) {
      return visited;
    }
    Deque<String> queue = new ArrayDeque<>();
    queue.add(start);
    visited.add(start);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      for (WorkflowEdge edge : edges.apply(current)) {
        String neighbour = next.apply(edge);
        if (graph.contains(neighbour) && enter.test(neighbour) && visited.add(neighbour)) {
          queue.add(neighbour);
        }
      }
    }
    return visited;
  }
}
