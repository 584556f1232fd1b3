package com.aiadvent.canvas.plan;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.graph.FeedbackLoopConfig;
import com.aiadvent.canvas.graph.GraphTraversals;
import com.aiadvent.canvas.graph.NodeKind;
import com.aiadvent.canvas.graph.ParallelConfig;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import com.aiadvent.canvas.validation.ValidatedGraph;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a validated graph into a {@link Block} tree. The walk starts at the trigger and follows
 * successors in the graph's canonical edge order. One visited set covers the whole plan, so every
 * node is placed exactly once; a node reached a second time becomes a {@link Block.Ref}.
 *
 * <p>Where arms of a branch, fan-out or plain multi-successor node converge, the shared nodes are
 * lifted out of the arms and planned after the construct. Feedback loop bodies are the nodes on a
 * cycle through the loop node; reaching a body node before its loop node plans the whole loop at
 * that point. A condition arm that leaves a loop body stops the loop, and its target runs after
 * the loop only when that arm was taken.
 */
@Component
public class ControlFlowPlanner {

  private static final Logger log = LoggerFactory.getLogger(ControlFlowPlanner.class);

  public ControlFlowPlan plan(ValidatedGraph validatedGraph) {
    if (validatedGraph == null) {
      throw new IllegalArgumentException("Validated graph must not be null");
    }
    Planning planning = new Planning(validatedGraph.graph());
    Scope top = Scope.top();
    List<Block> roots = new ArrayList<>();
    roots.add(planning.planNode(validatedGraph.triggerId(), top));

    List<String> leftovers =
        validatedGraph.graph().nodes().stream()
            .map(WorkflowNode::id)
            .filter(id -> !planning.visited.contains(id))
            .sorted()
            .toList();
    for (String id : leftovers) {
      if (!planning.visited.contains(id)) {
        log.debug("Node '{}' was not reached by the structured walk; appending it", id);
        roots.add(planning.planNode(id, top));
      }
    }
    return new ControlFlowPlan(sequence(roots), planning.diagnostics);
  }

  static Block sequence(List<Block> blocks) {
    List<Block> kept = new ArrayList<>();
    for (Block block : blocks) {
      if (block instanceof Block.Steps steps) {
        kept.addAll(steps.blocks());
      } else if (!(block instanceof Block.End)) {
        kept.add(block);
      }
    }
    if (kept.isEmpty()) {
      return Block.End.INSTANCE;
    }
    return kept.size() == 1 ? kept.get(0) : new Block.Steps(kept);
  }

  /**
   * Where the walk currently is: the nodes it may enter ({@code null} means all), the loop whose
   * body is being planned, the nodes reserved for an enclosing construct, and the nodes that had to
   * be pushed past the enclosing loop. {@code breakable} is false where a {@code break} could not
   * reach the loop, such as inside a fan-out branch.
   */
  private record Scope(
      Set<String> allowed,
      String loopId,
      Set<String> stops,
      Set<String> deferred,
      boolean breakable) {

    static Scope top() {
      return new Scope(null, null, Set.of(), new LinkedHashSet<>(), false);
    }

    static Scope loopBody(Set<String> body, String loopId, Set<String> deferred) {
      return new Scope(body, loopId, Set.of(), deferred, true);
    }

    boolean admits(String nodeId) {
      return allowed == null || allowed.contains(nodeId);
    }

    Scope withStops(Set<String> extra) {
      Set<String> merged = new HashSet<>(stops);
      merged.addAll(extra);
      return new Scope(allowed, loopId, merged, deferred, breakable);
    }

    Scope unbreakable() {
      return breakable ? new Scope(allowed, loopId, stops, deferred, false) : this;
    }
  }

  private record Arms(List<Block> arms, Block next) {}

  /** The condition arm through which a node left a loop body. */
  private record ExitGuard(String conditionNodeId, boolean whenTrue) {}

  private static final class Planning {

    private final WorkflowGraph graph;
    private final Set<String> visited = new HashSet<>();
    private final List<CompileDiagnostic> diagnostics = new ArrayList<>();
    private final Map<String, Set<String>> loopBodies = new TreeMap<>();
    private final Map<String, ExitGuard> exitGuards = new HashMap<>();
    private final Set<String> unguardedExits = new HashSet<>();

    private Planning(WorkflowGraph graph) {
      this.graph = graph;
      for (WorkflowNode node : graph.nodes()) {
        if (node.kind() == NodeKind.FEEDBACK_LOOP) {
          loopBodies.put(node.id(), GraphTraversals.loopBody(graph, node.id()));
        }
      }
    }

    private Block planNode(String nodeId, Scope scope) {
      if (nodeId.equals(scope.loopId()) || scope.stops().contains(nodeId)) {
        return Block.End.INSTANCE;
      }
      if (!scope.admits(nodeId)) {
        unguardedExits.add(nodeId);
        if (scope.deferred().add(nodeId)) {
          diagnostics.add(
              CompileDiagnostic.info(
                  WorkflowIssueCodes.LOOP_EXIT_DEFERRED,
                  "Block '%s' leaves the body of feedback loop '%s'; it runs after the loop"
                      .formatted(nodeId, scope.loopId()),
                  nodeId));
        }
        return Block.End.INSTANCE;
      }
      if (visited.contains(nodeId)) {
        diagnostics.add(
            CompileDiagnostic.info(
                WorkflowIssueCodes.BRANCH_JOIN,
                "Block '%s' is reached from more than one path; it runs once, where it was first scheduled"
                    .formatted(nodeId),
                nodeId));
        return new Block.Ref(nodeId);
      }

      WorkflowNode node = graph.requireNode(nodeId);
      if (node.kind() == NodeKind.FEEDBACK_LOOP) {
        return planLoop(nodeId, scope, null);
      }
      String enclosingLoop = enclosingUnplannedLoop(nodeId, scope);
      if (enclosingLoop != null) {
        return planLoop(enclosingLoop, scope, nodeId);
      }

      visited.add(nodeId);
      List<String> successors = successors(nodeId);
      return switch (node.kind()) {
        case CONDITION -> {
          String onTrue = branchTarget(nodeId, WorkflowEdge.TRUE_BRANCH);
          String onFalse = branchTarget(nodeId, WorkflowEdge.FALSE_BRANCH);
          Block trueExit = leavesLoop(onTrue, scope) ? deferExit(onTrue, nodeId, true, scope) : null;
          Block falseExit =
              leavesLoop(onFalse, scope) ? deferExit(onFalse, nodeId, false, scope) : null;
          List<String> targets = new ArrayList<>();
          targets.add(trueExit == null ? onTrue : null);
          targets.add(falseExit == null ? onFalse : null);
          Arms arms = planArms(nodeId, targets, scope, false);
          yield new Block.Branch(
              nodeId,
              trueExit != null ? trueExit : arms.arms().get(0),
              falseExit != null ? falseExit : arms.arms().get(1),
              arms.next());
        }
        case PARALLEL -> {
          List<String> targets =
              graph.sortedOutgoing(nodeId).stream().map(WorkflowEdge::targetNodeId).toList();
          Arms arms = planArms(nodeId, targets, scope, true);
          yield new Block.Fan(
              nodeId, arms.arms(), ((ParallelConfig) node.config()).mergeStrategy(), arms.next());
        }
        default -> {
          if (successors.isEmpty()) {
            yield new Block.Seq(nodeId, Block.End.INSTANCE);
          }
          if (successors.size() == 1) {
            yield new Block.Seq(nodeId, planNode(successors.get(0), scope));
          }
          Arms arms = planArms(nodeId, successors, scope, false);
          List<Block> rest = new ArrayList<>(arms.arms());
          rest.add(arms.next());
          yield new Block.Seq(nodeId, sequence(rest));
        }
      };
    }

    /**
     * Plans a feedback loop. {@code entry} is the body node the walk arrived at when the loop node
     * itself had not been reached yet; it then opens the body.
     */
    private Block planLoop(String loopId, Scope scope, String entry) {
      visited.add(loopId);
      FeedbackLoopConfig config = (FeedbackLoopConfig) graph.requireNode(loopId).config();

      Set<String> body = new LinkedHashSet<>(loopBodies.getOrDefault(loopId, Set.of()));
      if (scope.allowed() != null) {
        body.retainAll(scope.allowed());
      }
      if (scope.loopId() != null) {
        body.remove(scope.loopId());
      }

      Set<String> deferred = new LinkedHashSet<>();
      Scope bodyScope = Scope.loopBody(body, loopId, deferred);
      List<Block> bodyParts = new ArrayList<>();
      if (entry != null) {
        bodyParts.add(planNode(entry, bodyScope));
        bodyScope = bodyScope.withStops(Set.of(entry));
      }
      List<String> bodyStarts = new ArrayList<>();
      List<String> exits = new ArrayList<>();
      for (String successor : successors(loopId)) {
        if (body.contains(successor)) {
          bodyStarts.add(successor);
        } else if (!successor.equals(loopId)) {
          exits.add(successor);
        }
      }
      bodyParts.add(planTargets(loopId, bodyStarts, bodyScope));

      List<String> guardedExits = new ArrayList<>();
      for (String node : deferred) {
        if (exits.contains(node)) {
          continue;
        }
        if (guardOf(node) != null) {
          guardedExits.add(node);
        } else {
          exits.add(node);
        }
      }
      List<Block> after = new ArrayList<>();
      after.add(planTargets(loopId, exits, scope));
      for (String node : guardedExits) {
        ExitGuard guard = guardOf(node);
        if (visited.contains(node) || !graph.contains(node)) {
          continue;
        }
        if (!scope.admits(node)) {
          // Still outside the enclosing loop: pass it on with its guard.
          scope.deferred().add(node);
          continue;
        }
        Block guarded = planNode(node, scope);
        if (!(guarded instanceof Block.End)) {
          after.add(new Block.Guarded(guard.conditionNodeId(), guard.whenTrue(), guarded));
        }
      }
      return new Block.Loop(
          loopId,
          sequence(bodyParts),
          config.maxIterations(),
          config.stopCondition(),
          sequence(after));
    }

    private boolean leavesLoop(String target, Scope scope) {
      return target != null
          && scope.loopId() != null
          && scope.breakable()
          && graph.contains(target)
          && !visited.contains(target)
          && !scope.admits(target)
          && !target.equals(scope.loopId())
          && !scope.stops().contains(target);
    }

    /** Records {@code target} as leaving the loop through one condition arm, which then breaks. */
    private Block deferExit(String target, String conditionId, boolean whenTrue, Scope scope) {
      ExitGuard guard = new ExitGuard(conditionId, whenTrue);
      ExitGuard previous = exitGuards.putIfAbsent(target, guard);
      if (previous != null && !previous.equals(guard)) {
        unguardedExits.add(target);
      }
      scope.deferred().add(target);
      diagnostics.add(
          CompileDiagnostic.info(
              WorkflowIssueCodes.LOOP_EXIT_DEFERRED,
              "The '%s' branch of '%s' leaves feedback loop '%s'; the loop stops there and '%s' runs after it"
                  .formatted(
                      whenTrue ? WorkflowEdge.TRUE_BRANCH : WorkflowEdge.FALSE_BRANCH,
                      conditionId,
                      scope.loopId(),
                      target),
              target));
      return new Block.Exit(scope.loopId());
    }

    private ExitGuard guardOf(String nodeId) {
      return unguardedExits.contains(nodeId) ? null : exitGuards.get(nodeId);
    }

    private Block planTargets(String ownerId, List<String> targets, Scope scope) {
      if (targets.isEmpty()) {
        return Block.End.INSTANCE;
      }
      if (targets.size() == 1) {
        return planNode(targets.get(0), scope);
      }
      Arms arms = planArms(ownerId, targets, scope, false);
      List<Block> all = new ArrayList<>(arms.arms());
      all.add(arms.next());
      return sequence(all);
    }

    /**
     * Plans each arm, first reserving the nodes that two or more arms can reach. The reserved nodes
     * whose predecessors all lie outside the reserved set are planned afterwards as {@code next};
     * the rest follow from them. Isolated arms run apart from the enclosing loop and cannot leave
     * it early.
     */
    private Arms planArms(String ownerId, List<String> targets, Scope scope, boolean isolated) {
      List<Set<String>> reaches = new ArrayList<>();
      for (String target : targets) {
        reaches.add(target != null && enterable(target, scope) ? reach(target, scope) : Set.of());
      }
      Map<String, Integer> hits = new HashMap<>();
      for (Set<String> reach : reaches) {
        for (String id : reach) {
          hits.merge(id, 1, Integer::sum);
        }
      }
      Set<String> joins = new HashSet<>();
      hits.forEach((id, count) -> {
        if (count > 1) {
          joins.add(id);
        }
      });

      Scope armScope = joins.isEmpty() ? scope : scope.withStops(joins);
      if (isolated) {
        armScope = armScope.unbreakable();
      }
      List<Block> arms = new ArrayList<>();
      for (String target : targets) {
        arms.add(target != null ? planNode(target, armScope) : Block.End.INSTANCE);
      }
      if (joins.isEmpty()) {
        return new Arms(arms, Block.End.INSTANCE);
      }

      List<String> frontier = frontier(joins);
      for (String join : frontier) {
        String message =
            targets.contains(join)
                ? "Paths leaving '%s' converge on '%s'; the branch starting at it is left empty and it runs once after all of them"
                : "Paths leaving '%s' converge on '%s'; it runs once after all of them";
        diagnostics.add(
            CompileDiagnostic.info(
                WorkflowIssueCodes.BRANCH_JOIN, message.formatted(ownerId, join), join));
      }
      return new Arms(arms, planTargets(ownerId, frontier, scope));
    }

    private List<String> frontier(Set<String> joins) {
      List<String> frontier = new ArrayList<>();
      for (String join : joins) {
        boolean fedByJoin =
            graph.incoming(join).stream()
                .map(WorkflowEdge::sourceNodeId)
                .anyMatch(source -> !source.equals(join) && joins.contains(source));
        if (!fedByJoin) {
          frontier.add(join);
        }
      }
      if (frontier.isEmpty()) {
        frontier.add(joins.stream().min(Comparator.naturalOrder()).orElseThrow());
      }
      frontier.sort(Comparator.naturalOrder());
      return frontier;
    }

    private boolean enterable(String nodeId, Scope scope) {
      return graph.contains(nodeId)
          && !visited.contains(nodeId)
          && scope.admits(nodeId)
          && !nodeId.equals(scope.loopId())
          && !scope.stops().contains(nodeId);
    }

    private Set<String> reach(String start, Scope scope) {
      return GraphTraversals.forward(graph, start, id -> enterable(id, scope));
    }

    /**
     * Largest not yet planned loop whose body contains {@code nodeId} and that the scope may enter.
     * A loop whose body holds a loop already planned or open nests inside that one and is skipped.
     */
    private String enclosingUnplannedLoop(String nodeId, Scope scope) {
      String best = null;
      int bestSize = -1;
      for (Map.Entry<String, Set<String>> entry : loopBodies.entrySet()) {
        String loopId = entry.getKey();
        if (loopId.equals(nodeId)
            || visited.contains(loopId)
            || !entry.getValue().contains(nodeId)
            || !enterable(loopId, scope)
            || containsPlannedLoop(entry.getValue())) {
          continue;
        }
        if (entry.getValue().size() > bestSize) {
          best = loopId;
          bestSize = entry.getValue().size();
        }
      }
      return best;
    }

    private boolean containsPlannedLoop(Set<String> body) {
      return body.stream().anyMatch(id -> visited.contains(id) && loopBodies.containsKey(id));
    }

    private String branchTarget(String conditionId, String label) {
      return graph.outgoing(conditionId).stream()
          .filter(edge -> label.equals(edge.branchLabel()))
          .map(WorkflowEdge::targetNodeId)
          .findFirst()
          .orElse(null);
    }

    private List<String> successors(String nodeId) {
      return graph.sortedOutgoing(nodeId).stream()
          .map(WorkflowEdge::targetNodeId)
          .distinct()
          .toList();
    }
  }
}
