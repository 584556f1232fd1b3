package com.aiadvent.canvas.plan;

import static com.aiadvent.canvas.TestWorkflowGraphFactory.agent;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.branch;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.condition;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.edge;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.graph;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.loop;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.parallel;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.slot;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.graph.MergeStrategy;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import com.aiadvent.canvas.validation.ValidatedGraph;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ControlFlowPlannerTest {

  private static final Block END = Block.End.INSTANCE;

  private final ControlFlowPlanner planner = new ControlFlowPlanner();

  @Test
  void plansLinearChainAsNestedSequence() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), agent("a"), agent("b")),
            List.of(edge("t", "a"), edge("a", "b")));

    assertThat(plan.root())
        .isEqualTo(new Block.Seq("t", new Block.Seq("a", new Block.Seq("b", END))));
    assertThat(plan.diagnostics()).isEmpty();
  }

  @Test
  void plansConditionArmsByLabelNotEdgeOrder() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), condition("c", "'yes' in input_text"), agent("a"), agent("z")),
            List.of(edge("t", "c"), branch("c", "a", "false"), branch("c", "z", "true")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Branch("c", new Block.Seq("z", END), new Block.Seq("a", END), END)));
  }

  @Test
  void liftsConvergingConditionArmsAfterTheBranch() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), condition("c", "True"), agent("a"), agent("b"), agent("j")),
            List.of(
                edge("t", "c"),
                branch("c", "a", "true"),
                branch("c", "b", "false"),
                edge("a", "j"),
                edge("b", "j")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Branch(
                    "c", new Block.Seq("a", END), new Block.Seq("b", END), new Block.Seq("j", END))));
    assertThat(plan.diagnostics())
        .extracting(CompileDiagnostic::code, CompileDiagnostic::severity, CompileDiagnostic::nodeId)
        .containsExactly(
            tuple(WorkflowIssueCodes.BRANCH_JOIN, CompileDiagnostic.Severity.INFO, "j"));
  }

  @Test
  void plansFanOutInSlotOrderWithJoinAfterwards() {
    ControlFlowPlan plan =
        plan(
            List.of(
                trigger("t"),
                parallel("p", MergeStrategy.FIRST),
                agent("a"),
                agent("b"),
                agent("j")),
            List.of(
                edge("t", "p"),
                slot("p", "b", "1"),
                slot("p", "a", "2"),
                edge("a", "j"),
                edge("b", "j")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Fan(
                    "p",
                    List.of(new Block.Seq("b", END), new Block.Seq("a", END)),
                    MergeStrategy.FIRST,
                    new Block.Seq("j", END))));
  }

  @Test
  void plansLoopWhoseNodeComesFirst() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), loop("L", 3, "'done' in out_w['output']"), agent("w"), agent("after")),
            List.of(edge("t", "L"), edge("L", "w"), edge("w", "L"), edge("L", "after")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Loop(
                    "L",
                    new Block.Seq("w", END),
                    3,
                    "'done' in out_w['output']",
                    new Block.Seq("after", END))));
  }

  @Test
  void hoistsLoopWhenBodyIsReachedBeforeLoopNode() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), agent("draft"), loop("L", 2, null), agent("publish")),
            List.of(
                edge("t", "draft"),
                edge("draft", "L"),
                edge("L", "draft"),
                edge("L", "publish")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Loop(
                    "L", new Block.Seq("draft", END), 2, "", new Block.Seq("publish", END))));
  }

  @Test
  void defersNodesThatLeaveTheLoopBody() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), loop("L", 2, null), agent("w"), agent("side"), agent("done")),
            List.of(
                edge("t", "L"),
                edge("L", "w"),
                edge("w", "L"),
                edge("w", "side"),
                edge("L", "done")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Loop(
                    "L",
                    new Block.Seq("w", END),
                    2,
                    "",
                    new Block.Steps(List.of(new Block.Seq("done", END), new Block.Seq("side", END))))));
    assertThat(plan.diagnostics())
        .extracting(CompileDiagnostic::code, CompileDiagnostic::nodeId)
        .containsExactly(tuple(WorkflowIssueCodes.LOOP_EXIT_DEFERRED, "side"));
  }

  @Test
  void nestsInnerLoopInsideTheOuterLoopBody() {
    ControlFlowPlan plan =
        plan(
            List.of(
                trigger("t"),
                loop("L1", 3, null),
                agent("x"),
                loop("L2", 2, null),
                agent("y"),
                agent("done")),
            List.of(
                edge("t", "L1"),
                edge("L1", "x"),
                edge("x", "L2"),
                edge("L2", "y"),
                edge("y", "L2"),
                edge("L2", "L1"),
                edge("L1", "done")));

    Block inner = new Block.Loop("L2", new Block.Seq("y", END), 2, "", END);
    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Loop(
                    "L1", new Block.Seq("x", inner), 3, "", new Block.Seq("done", END))));
    assertThat(plan.diagnostics()).isEmpty();
  }

  @Test
  void conditionArmLeavingTheLoopBreaksAndGuardsItsTarget() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), loop("L", 2, null), condition("c", "True"), agent("w"), agent("done")),
            List.of(
                edge("t", "L"),
                edge("L", "c"),
                branch("c", "w", "true"),
                edge("w", "L"),
                branch("c", "done", "false")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Loop(
                    "L",
                    new Block.Branch("c", new Block.Seq("w", END), new Block.Exit("L"), END),
                    2,
                    "",
                    new Block.Guarded("c", false, new Block.Seq("done", END)))));
    assertThat(plan.diagnostics())
        .extracting(CompileDiagnostic::code, CompileDiagnostic::nodeId)
        .containsExactly(tuple(WorkflowIssueCodes.LOOP_EXIT_DEFERRED, "done"));
  }

  @Test
  void fanOutBranchInsideLoopDefersItsExitWithoutBreaking() {
    ControlFlowPlan plan =
        plan(
            List.of(
                trigger("t"),
                loop("L", 2, null),
                parallel("p", MergeStrategy.ALL),
                condition("c", "True"),
                agent("w"),
                agent("done")),
            List.of(
                edge("t", "L"),
                edge("L", "p"),
                slot("p", "c", "1"),
                slot("p", "w", "2"),
                branch("c", "done", "true"),
                branch("c", "L", "false"),
                edge("w", "L")));

    Block.Loop loop = (Block.Loop) ((Block.Seq) plan.root()).next();
    Block.Fan fan = (Block.Fan) loop.body();
    assertThat(fan.branches())
        .containsExactly(new Block.Branch("c", END, END, END), new Block.Seq("w", END));
    assertThat(loop.next()).isEqualTo(new Block.Seq("done", END));
  }

  @Test
  void saysWhichFanOutBranchWasEmptiedByAJoin() {
    ControlFlowPlan plan =
        plan(
            List.of(trigger("t"), parallel("p", MergeStrategy.ALL), agent("a"), agent("b")),
            List.of(edge("t", "p"), slot("p", "a", "1"), slot("p", "b", "2"), edge("a", "b")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Seq(
                "t",
                new Block.Fan(
                    "p",
                    List.of(new Block.Seq("a", END), END),
                    MergeStrategy.ALL,
                    new Block.Seq("b", END))));
    assertThat(plan.diagnostics())
        .singleElement()
        .satisfies(
            diagnostic -> {
              assertThat(diagnostic.code()).isEqualTo(WorkflowIssueCodes.BRANCH_JOIN);
              assertThat(diagnostic.nodeId()).isEqualTo("b");
              assertThat(diagnostic.message()).contains("the branch starting at it is left empty");
            });
  }

  @Test
  void appendsNodesTheWalkNeverReached() {
    ControlFlowPlan plan =
        plan(List.of(trigger("t"), agent("a"), agent("orphan")), List.of(edge("t", "a")));

    assertThat(plan.root())
        .isEqualTo(
            new Block.Steps(
                List.of(new Block.Seq("t", new Block.Seq("a", END)), new Block.Seq("orphan", END))));
  }

  @Test
  void sameGraphInAnyOrderYieldsSamePlan() {
    List<WorkflowNode> nodes =
        List.of(trigger("t"), condition("c", "True"), agent("a"), agent("b"), agent("j"));
    List<WorkflowEdge> edges =
        List.of(
            edge("t", "c"),
            branch("c", "a", "true"),
            branch("c", "b", "false"),
            edge("a", "j"),
            edge("b", "j"));

    ControlFlowPlan forward = plan(nodes, edges);
    ControlFlowPlan reversed = plan(reverse(nodes), reverse(edges));

    assertThat(reversed).isEqualTo(forward);
  }

  @Test
  void sequenceFlattensStepsAndDropsEnds() {
    Block a = new Block.Seq("a", END);
    Block b = new Block.Seq("b", END);

    assertThat(ControlFlowPlanner.sequence(List.of(END, new Block.Steps(List.of(a)), END, b)))
        .isEqualTo(new Block.Steps(List.of(a, b)));
    assertThat(ControlFlowPlanner.sequence(List.of(END, a))).isEqualTo(a);
    assertThat(ControlFlowPlanner.sequence(List.of(END))).isEqualTo(END);
  }

  private ControlFlowPlan plan(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
    WorkflowGraph graph = graph(nodes, edges);
    return planner.plan(new ValidatedGraph(graph, "t"));
  }

  private static <T> List<T> reverse(List<T> items) {
    List<T> copy = new ArrayList<>(items);
    Collections.reverse(copy);
    return copy;
  }
}
