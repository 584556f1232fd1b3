package com.aiadvent.canvas.graph;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.validation.WorkflowGraphParsingException;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the canvas for one compile call. Adjacency lists keep edge insertion
 * order; callers that need an order independent of the input arrays sort on top of them.
 */
public final class WorkflowGraph {

  private final List<WorkflowNode> nodes;
  private final List<WorkflowEdge> edges;
  private final Map<String, WorkflowNode> nodesById;
  private final Map<String, List<WorkflowEdge>> outgoing;
  private final Map<String, List<WorkflowEdge>> incoming;

  public WorkflowGraph(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
    if (nodes == null) {
      throw WorkflowGraphParsingException.single(
          CompileDiagnostic.error(
              WorkflowIssueCodes.GRAPH_MALFORMED, "Node list must not be null", null, null));
    }
    if (edges == null) {
      throw WorkflowGraphParsingException.single(
          CompileDiagnostic.error(
              WorkflowIssueCodes.GRAPH_MALFORMED, "Edge list must not be null", null, null));
    }

    Map<String, WorkflowNode> index = new LinkedHashMap<>();
    for (WorkflowNode node : nodes) {
      if (node == null) {
        throw WorkflowGraphParsingException.single(
            CompileDiagnostic.error(
                WorkflowIssueCodes.NODE_NULL, "Node entry must not be null", null, null));
      }
      if (index.putIfAbsent(node.id(), node) != null) {
        throw WorkflowGraphParsingException.single(
            CompileDiagnostic.error(
                WorkflowIssueCodes.NODE_DUPLICATE,
                "Duplicate node id: " + node.id(),
                node.id(),
                null));
      }
    }

    Map<String, List<WorkflowEdge>> out = new LinkedHashMap<>();
    Map<String, List<WorkflowEdge>> in = new LinkedHashMap<>();
    for (WorkflowEdge edge : edges) {
      if (edge == null) {
        throw WorkflowGraphParsingException.single(
            CompileDiagnostic.error(
                WorkflowIssueCodes.EDGE_NULL, "Edge entry must not be null", null, null));
      }
      out.computeIfAbsent(edge.sourceNodeId(), key -> new ArrayList<>()).add(edge);
      in.computeIfAbsent(edge.targetNodeId(), key -> new ArrayList<>()).add(edge);
    }

    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    this.nodesById = Collections.unmodifiableMap(index);
    this.outgoing = freeze(out);
    this.incoming = freeze(in);
  }

  public List<WorkflowNode> nodes() {
    return nodes;
  }

  public List<WorkflowEdge> edges() {
    return edges;
  }

  public Optional<WorkflowNode> node(String nodeId) {
    return Optional.ofNullable(nodesById.get(nodeId));
  }

  public WorkflowNode requireNode(String nodeId) {
    WorkflowNode node = nodesById.get(nodeId);
    if (node == null) {
      throw new IllegalArgumentException("Node not found: " + nodeId);
    }
    return node;
  }

  public boolean contains(String nodeId) {
    return nodesById.containsKey(nodeId);
  }

  public List<WorkflowEdge> outgoing(String nodeId) {
    return outgoing.getOrDefault(nodeId, List.of());
  }

  public List<WorkflowEdge> incoming(String nodeId) {
    return incoming.getOrDefault(nodeId, List.of());
  }

  /**
   * Outgoing edges in an order that does not depend on the input arrays: {@code true} before
   * {@code false} for conditions, by slot for parallel blocks, by target id otherwise. Edge id
   * breaks every remaining tie.
   */
  public List<WorkflowEdge> sortedOutgoing(String nodeId) {
    NodeKind kind = node(nodeId).map(WorkflowNode::kind).orElse(null);
    Comparator<WorkflowEdge> order;
    if (kind == NodeKind.CONDITION) {
      order = Comparator.comparingInt(WorkflowGraph::branchRank);
    } else if (kind == NodeKind.PARALLEL) {
      order = Comparator.comparing(WorkflowEdge::outputSlot, Comparator.nullsLast(Comparator.<String>naturalOrder()));
    } else {
      order = Comparator.comparing(WorkflowEdge::targetNodeId);
    }
    return outgoing(nodeId).stream()
        .sorted(order.thenComparing(WorkflowEdge::targetNodeId).thenComparing(WorkflowEdge::id))
        .toList();
  }

  /** Incoming edges ordered by source id, then edge id. */
  public List<WorkflowEdge> sortedIncoming(String nodeId) {
    return incoming(nodeId).stream()
        .sorted(Comparator.comparing(WorkflowEdge::sourceNodeId).thenComparing(WorkflowEdge::id))
        .toList();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public int size() {
    return nodes.size();
  }

  private static int branchRank(WorkflowEdge edge) {
    if (WorkflowEdge.TRUE_BRANCH.equals(edge.branchLabel())) {
      return 0;
    }
    return WorkflowEdge.FALSE_BRANCH.equals(edge.branchLabel()) ? 1 : 2;
  }

  private static Map<String, List<WorkflowEdge>> freeze(Map<String, List<WorkflowEdge>> source) {
    Map<String, List<WorkflowEdge>> frozen = new LinkedHashMap<>();
    source.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
    return Collections.unmodifiableMap(frozen);
  }

  @Override
  public String toString() {
    return "WorkflowGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
  }
}
