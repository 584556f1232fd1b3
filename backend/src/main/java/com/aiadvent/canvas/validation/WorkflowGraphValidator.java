package com.aiadvent.canvas.validation;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.config.WorkflowCompilerProperties;
import com.aiadvent.canvas.graph.ConditionConfig;
import com.aiadvent.canvas.graph.FeedbackLoopConfig;
import com.aiadvent.canvas.graph.GraphTraversals;
import com.aiadvent.canvas.graph.NodeKind;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the structural invariants of a canvas graph. Every violation is collected; nothing here
 * stops at the first problem.
 */
@Component
public class WorkflowGraphValidator {

  private static final Logger log = LoggerFactory.getLogger(WorkflowGraphValidator.class);

  private enum Colour {
    WHITE,
    GRAY,
    BLACK
  }

  private final WorkflowCompilerProperties properties;

  public WorkflowGraphValidator(WorkflowCompilerProperties properties) {
    this.properties = properties;
  }

  public GraphValidationResult validate(WorkflowGraph graph) {
    if (graph == null) {
      throw new IllegalArgumentException("Workflow graph must not be null");
    }
    List<CompileDiagnostic> errors = new ArrayList<>();
    List<CompileDiagnostic> warnings = new ArrayList<>();

    if (graph.size() > properties.getMaxNodes()) {
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.GRAPH_TOO_LARGE,
              "Workflow has %d blocks; at most %d are supported"
                  .formatted(graph.size(), properties.getMaxNodes()),
              null,
              null));
    }

    checkEdges(graph, errors);
    String triggerId = checkTriggers(graph, errors);
    checkReachability(graph, errors);
    for (WorkflowNode node : graph.nodes()) {
      switch (node.kind()) {
        case CONDITION -> checkCondition(graph, node, errors, warnings);
        case PARALLEL -> checkParallel(graph, node, errors);
        case FEEDBACK_LOOP -> checkLoop(graph, node, errors, warnings);
        default -> {
          // no shape constraints
        }
      }
    }
    checkAccidentalCycles(graph, errors);

    if (!errors.isEmpty()) {
      log.debug("Workflow graph rejected with {} structural error(s)", errors.size());
      return new GraphValidationResult(null, errors, warnings);
    }
    return new GraphValidationResult(new ValidatedGraph(graph, triggerId), List.of(), warnings);
  }

  private void checkEdges(WorkflowGraph graph, List<CompileDiagnostic> errors) {
    Set<String> seenIds = new HashSet<>();
    for (WorkflowEdge edge : graph.edges()) {
      if (!seenIds.add(edge.id())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.EDGE_DUPLICATE,
                "Duplicate edge id: " + edge.id(),
                null,
                edge.id()));
      }
      if (!graph.contains(edge.sourceNodeId())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.EDGE_DANGLING,
                "Edge '%s' starts at unknown block '%s'".formatted(edge.id(), edge.sourceNodeId()),
                null,
                edge.id()));
      }
      if (!graph.contains(edge.targetNodeId())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.EDGE_DANGLING,
                "Edge '%s' points to unknown block '%s'".formatted(edge.id(), edge.targetNodeId()),
                null,
                edge.id()));
      }
    }
  }

  private String checkTriggers(WorkflowGraph graph, List<CompileDiagnostic> errors) {
    List<WorkflowNode> triggers =
        graph.nodes().stream().filter(node -> node.kind() == NodeKind.TRIGGER).toList();
    if (triggers.isEmpty()) {
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.TRIGGER_MISSING,
              "Workflow must contain exactly one trigger block",
              null,
              null));
      return null;
    }
    for (int index = 1; index < triggers.size(); index++) {
      WorkflowNode extra = triggers.get(index);
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.TRIGGER_DUPLICATE,
              "Workflow has more than one trigger; '%s' duplicates '%s'"
                  .formatted(extra.id(), triggers.get(0).id()),
              extra.id(),
              null));
    }
    for (WorkflowNode trigger : triggers) {
      for (WorkflowEdge edge : graph.incoming(trigger.id())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.TRIGGER_HAS_INCOMING,
                "Trigger '%s' must not have incoming edges".formatted(trigger.id()),
                trigger.id(),
                edge.id()));
      }
    }
    return triggers.get(0).id();
  }

  private void checkReachability(WorkflowGraph graph, List<CompileDiagnostic> errors) {
    Set<String> reached = new HashSet<>();
    boolean anyTrigger = false;
    for (WorkflowNode node : graph.nodes()) {
      if (node.kind() == NodeKind.TRIGGER) {
        anyTrigger = true;
        reached.addAll(GraphTraversals.forward(graph, node.id()));
      }
    }
    if (!anyTrigger) {
      return;
    }
    for (WorkflowNode node : graph.nodes()) {
      if (!reached.contains(node.id())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.NODE_UNREACHABLE,
                "Block '%s' is not reachable from the trigger".formatted(node.id()),
                node.id(),
                null));
      }
    }
  }

  private void checkCondition(
      WorkflowGraph graph,
      WorkflowNode node,
      List<CompileDiagnostic> errors,
      List<CompileDiagnostic> warnings) {
    List<WorkflowEdge> outgoing = graph.outgoing(node.id());
    if (outgoing.size() != 2) {
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.CONDITION_EDGE_COUNT,
              "Condition '%s' must have exactly two outgoing edges, found %d"
                  .formatted(node.id(), outgoing.size()),
              node.id(),
              null));
    }
    Set<String> labels = new HashSet<>();
    for (WorkflowEdge edge : outgoing) {
      String label = edge.branchLabel();
      boolean known = WorkflowEdge.TRUE_BRANCH.equals(label) || WorkflowEdge.FALSE_BRANCH.equals(label);
      if (!known) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.CONDITION_BRANCH_LABEL,
                "Edge '%s' leaving condition '%s' must be labelled true or false"
                    .formatted(edge.id(), node.id()),
                node.id(),
                edge.id()));
      } else if (!labels.add(label)) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.CONDITION_BRANCH_LABEL,
                "Condition '%s' has two '%s' branches".formatted(node.id(), label),
                node.id(),
                edge.id()));
      }
    }
    ConditionConfig config = (ConditionConfig) node.config();
    if (config.expression().isEmpty()) {
      warnings.add(
          CompileDiagnostic.warning(
              WorkflowIssueCodes.CONDITION_EXPRESSION_EMPTY,
              "Condition '%s' has no expression and always takes the false branch"
                  .formatted(node.id()),
              node.id()));
    }
  }

  private void checkParallel(WorkflowGraph graph, WorkflowNode node, List<CompileDiagnostic> errors) {
    List<WorkflowEdge> outgoing = graph.outgoing(node.id());
    if (outgoing.size() < 2) {
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.PARALLEL_EDGE_COUNT,
              "Parallel block '%s' needs at least two outgoing edges, found %d"
                  .formatted(node.id(), outgoing.size()),
              node.id(),
              null));
    }
    Set<String> slots = new HashSet<>();
    for (WorkflowEdge edge : outgoing) {
      if (edge.outputSlot() == null) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.PARALLEL_SLOT_MISSING,
                "Edge '%s' leaving parallel block '%s' must name an output slot"
                    .formatted(edge.id(), node.id()),
                node.id(),
                edge.id()));
      } else if (!slots.add(edge.outputSlot())) {
        errors.add(
            CompileDiagnostic.error(
                WorkflowIssueCodes.PARALLEL_SLOT_DUPLICATE,
                "Parallel block '%s' uses output slot '%s' twice"
                    .formatted(node.id(), edge.outputSlot()),
                node.id(),
                edge.id()));
      }
    }
  }

  private void checkLoop(
      WorkflowGraph graph,
      WorkflowNode node,
      List<CompileDiagnostic> errors,
      List<CompileDiagnostic> warnings) {
    FeedbackLoopConfig config = (FeedbackLoopConfig) node.config();
    if (config.maxIterations() < 1 || config.maxIterations() > properties.getMaxLoopIterations()) {
      errors.add(
          CompileDiagnostic.error(
              WorkflowIssueCodes.LOOP_BOUND_INVALID,
              "Feedback loop '%s' must allow between 1 and %d iterations, got %d"
                  .formatted(node.id(), properties.getMaxLoopIterations(), config.maxIterations()),
              node.id(),
              null));
    }
    if (GraphTraversals.loopBody(graph, node.id()).isEmpty()) {
      warnings.add(
          CompileDiagnostic.warning(
              WorkflowIssueCodes.LOOP_WITHOUT_BODY,
              "Feedback loop '%s' does not close a cycle; its body is empty".formatted(node.id()),
              node.id()));
    }
  }

  /**
   * Three-colour depth-first search that never enters feedback loop nodes, so every back-edge it
   * meets closes a cycle made only of ordinary blocks.
   */
  private void checkAccidentalCycles(WorkflowGraph graph, List<CompileDiagnostic> errors) {
    Map<String, Colour> colours = new HashMap<>();
    for (WorkflowNode node : graph.nodes()) {
      colours.put(node.id(), Colour.WHITE);
    }
    for (WorkflowNode root : graph.nodes()) {
      if (root.kind() == NodeKind.FEEDBACK_LOOP || colours.get(root.id()) != Colour.WHITE) {
        continue;
      }
      Deque<Frame> stack = new ArrayDeque<>();
      List<String> path = new ArrayList<>();
      colours.put(root.id(), Colour.GRAY);
      stack.push(new Frame(root.id(), graph.outgoing(root.id())));
      path.add(root.id());
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.next >= frame.edges.size()) {
          colours.put(frame.nodeId, Colour.BLACK);
          stack.pop();
          path.remove(path.size() - 1);
          continue;
        }
        WorkflowEdge edge = frame.edges.get(frame.next++);
        String target = edge.targetNodeId();
        WorkflowNode targetNode = graph.node(target).orElse(null);
        if (targetNode == null || targetNode.kind() == NodeKind.FEEDBACK_LOOP) {
          continue;
        }
        Colour colour = colours.get(target);
        if (colour == Colour.GRAY) {
          errors.add(accidentalCycle(edge, path.subList(path.indexOf(target), path.size())));
        } else if (colour == Colour.WHITE) {
          colours.put(target, Colour.GRAY);
          stack.push(new Frame(target, graph.outgoing(target)));
          path.add(target);
        }
      }
    }
  }

  private CompileDiagnostic accidentalCycle(WorkflowEdge backEdge, List<String> cycle) {
    Set<String> members = new LinkedHashSet<>(cycle);
    String rendered =
        members.stream().collect(Collectors.joining(" -> ")) + " -> " + backEdge.targetNodeId();
    return CompileDiagnostic.error(
        WorkflowIssueCodes.ACCIDENTAL_CYCLE,
        "Cycle %s does not pass through a feedback loop (edge '%s')"
            .formatted(rendered, backEdge.id()),
        backEdge.sourceNodeId(),
        backEdge.id());
  }

  private static final class Frame {
    private final String nodeId;
    private final List<WorkflowEdge> edges;
    private int next;

    private Frame(String nodeId, List<WorkflowEdge> edges) {
      this.nodeId = nodeId;
      this.edges = edges;
    }
  }
}
