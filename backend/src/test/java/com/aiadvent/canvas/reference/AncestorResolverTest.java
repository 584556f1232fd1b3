package com.aiadvent.canvas.reference;

import static com.aiadvent.canvas.TestWorkflowGraphFactory.agent;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.branch;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.condition;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.edge;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.graph;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.loop;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.trigger;
import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AncestorResolverTest {

  private final AncestorResolver resolver = new AncestorResolver();

  @Test
  void listsChainAncestorsNearestFirstWithInputLast() {
    WorkflowGraph graph =
        graph(
            List.of(
                agent("n1", null, "f1"),
                agent("n2", null, "f2"),
                agent("n3", null, "f3"),
                agent("n4", null, "f4")),
            List.of(edge("n1", "n2"), edge("n2", "n3"), edge("n3", "n4")));

    List<AncestorInfo> ancestors = resolver.ancestorsOf(graph, "n4");

    assertThat(ancestors)
        .extracting(AncestorInfo::nodeId)
        .containsExactly("n3", "n2", "n1", AncestorInfo.INPUT_ID);
    assertThat(ancestors.get(0).fields()).containsExactly("f3");
    assertThat(ancestors.get(3).label()).isEqualTo(AncestorInfo.INPUT_LABEL);
    assertThat(ancestors.get(3).fields()).isEmpty();
  }

  @Test
  void includesConditionOnBothBranches() {
    WorkflowGraph graph =
        graph(
            List.of(trigger("t"), condition("c1", "True"), agent("a_yes"), agent("a_no")),
            List.of(
                edge("t", "c1"), branch("c1", "a_yes", "true"), branch("c1", "a_no", "false")));

    assertThat(resolver.ancestorsOf(graph, "a_yes"))
        .extracting(AncestorInfo::nodeId)
        .containsExactly("c1", "t", AncestorInfo.INPUT_ID);
    assertThat(resolver.ancestorsOf(graph, "a_no"))
        .extracting(AncestorInfo::nodeId)
        .contains("c1");
  }

  @Test
  void terminatesOnCyclesAndNeverListsStartNode() {
    List<WorkflowNode> nodes = new ArrayList<>();
    List<WorkflowEdge> edges = new ArrayList<>();
    nodes.add(trigger("t"));
    String previous = "t";
    for (int i = 0; i < 5; i++) {
      String loopId = "loop" + i;
      String workerId = "worker" + i;
      nodes.add(loop(loopId, 2, ""));
      nodes.add(agent(workerId));
      edges.add(edge(previous, loopId));
      edges.add(edge(loopId, workerId));
      edges.add(edge(workerId, loopId));
      previous = loopId;
    }
    WorkflowGraph graph = graph(nodes, edges);

    List<AncestorInfo> ancestors = resolver.ancestorsOf(graph, "worker4");

    assertThat(ancestors).extracting(AncestorInfo::nodeId).doesNotHaveDuplicates();
    assertThat(ancestors).extracting(AncestorInfo::nodeId).doesNotContain("worker4");
    assertThat(ancestors).hasSize(nodes.size());
    assertThat(ancestors.get(ancestors.size() - 1).nodeId()).isEqualTo(AncestorInfo.INPUT_ID);
  }

  @Test
  void exposesGenericOutputAndLoopIterations() {
    WorkflowGraph graph =
        graph(
            List.of(trigger("t"), loop("L", 3, ""), agent("w")),
            List.of(edge("t", "L"), edge("L", "w"), edge("w", "L")));

    List<AncestorInfo> ancestors = resolver.ancestorsOf(graph, "w");

    assertThat(ancestors.get(0).nodeId()).isEqualTo("L");
    assertThat(ancestors.get(0).fields()).containsExactly("output", "iterations");
    assertThat(ancestors.get(1).fields()).containsExactly("output");
  }

  @Test
  void unknownNodeYieldsOnlyWorkflowInput() {
    WorkflowGraph graph = graph(List.of(trigger("t")), List.of());

    assertThat(resolver.ancestorsOf(graph, "missing"))
        .extracting(AncestorInfo::nodeId)
        .containsExactly(AncestorInfo.INPUT_ID);
  }
}
