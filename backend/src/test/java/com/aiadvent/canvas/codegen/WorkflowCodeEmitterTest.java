package com.aiadvent.canvas.codegen;

import static com.aiadvent.canvas.TestWorkflowGraphFactory.agent;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.branch;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.condition;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.edge;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.graph;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.loop;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.parallel;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.slot;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.tool;
import static com.aiadvent.canvas.TestWorkflowGraphFactory.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.aiadvent.canvas.TestWorkflowGraphFactory;
import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.graph.MergeStrategy;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import com.aiadvent.canvas.plan.Block;
import com.aiadvent.canvas.plan.ControlFlowPlanner;
import com.aiadvent.canvas.validation.ValidatedGraph;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.Test;

class WorkflowCodeEmitterTest {

  private final WorkflowCodeEmitter emitter = TestWorkflowGraphFactory.emitter();
  private final ControlFlowPlanner planner = new ControlFlowPlanner();

  @Test
  void emitsCompleteProgramForLinearChain() {
    String code =
        emit(List.of(trigger("t"), agent("a")), List.of(edge("t", "a"))).code();

    assertThat(code)
        .isEqualTo(
            """
            import asyncio

            from agentchord.runtime import run_agent


            async def workflow(input_text: str):
                (out_a, out_t) = (None,) * 2
                # Trigger: manual
                out_t = {"output": input_text}
                # Agent: a
                out_a = await run_agent(
                    name="a",
                    role="assistant",
                    model="gpt-4o-mini",
                    temperature=0.7,
                    max_tokens=4096,
                    input=input_text,
                )
                return out_a


            if __name__ == "__main__":
                print(asyncio.run(workflow("Your input here")))
            """);
  }

  @Test
  void triggerOnlyProgramImportsNoRuntimeCalls() {
    String code = emit(List.of(trigger("t")), List.of()).code();

    assertThat(code).startsWith("import asyncio\n\n\nasync def workflow(input_text: str):\n");
    assertThat(code).contains("    (out_t,) = (None,) * 1\n");
    assertThat(code).contains("    return out_t\n");
    assertThat(code).doesNotContain("from agentchord.runtime");
  }

  @Test
  void emitsIfWithoutElseWhenFalseArmIsEmpty() {
    String code =
        emit(
                List.of(trigger("t"), condition("c", "'urgent' in {{input}}"), agent("a")),
                List.of(edge("t", "c"), branch("c", "a", "true")))
            .code();

    assertThat(code)
        .contains(
            """
                # Condition: 'urgent' in {{input}}
                out_c = {"output": bool('urgent' in input_text)}
                if out_c["output"]:
                    # Agent: a
                    out_a = await run_agent(
            """);
    assertThat(code).doesNotContain("else:");
    assertThat(code).contains("            input=input_text,\n");
    assertThat(code).contains("    return (out_a if out_c[\"output\"] else None)\n");
  }

  @Test
  void emptyConditionExpressionEvaluatesToFalse() {
    String code =
        emit(
                List.of(trigger("t"), condition("c", " "), agent("yes"), agent("no")),
                List.of(edge("t", "c"), branch("c", "yes", "true"), branch("c", "no", "false")))
            .code();

    assertThat(code).contains("    out_c = {\"output\": bool(False)}\n");
    assertThat(code).contains("    else:\n        # Agent: no\n");
  }

  @Test
  void gathersAllBranchesInSlotOrder() {
    String code =
        emit(
                List.of(trigger("t"), parallel("p", MergeStrategy.ALL), agent("a"), agent("b")),
                List.of(edge("t", "p"), slot("p", "b", "1"), slot("p", "a", "2")))
            .code();

    assertThat(code)
        .contains(
            """
                # Parallel: 2 branches, merge all
                async def branch_p_1():
                    nonlocal out_b
                    # Agent: b
            """);
    assertThat(code).contains("        return out_b\n    async def branch_p_2():\n        nonlocal out_a\n");
    assertThat(code)
        .contains(
            """
                results_p = await asyncio.gather(branch_p_1(), branch_p_2())
                out_p = {"output": list(results_p)}
                return out_p
            """);
  }

  @Test
  void racesBranchesForFirstMergeAndCancelsTheRest() {
    String code =
        emit(
                List.of(trigger("t"), parallel("p", MergeStrategy.FIRST), agent("a"), agent("b")),
                List.of(edge("t", "p"), slot("p", "a", "1"), slot("p", "b", "2")))
            .code();

    assertThat(code)
        .contains(
            """
                tasks_p = [asyncio.ensure_future(branch_p_1()), asyncio.ensure_future(branch_p_2())]
                done_p, pending_p = await asyncio.wait(tasks_p, return_when=asyncio.FIRST_COMPLETED)
                for task in pending_p:
                    task.cancel()
                winner_p = next(task for task in tasks_p if task in done_p)
                out_p = {"output": winner_p.result()}
            """);
  }

  @Test
  void boundsLoopAndFeedsBodyOutputBackIn() {
    String code =
        emit(
                List.of(
                    trigger("t"), loop("L", 3, "'ok' in {{w}}"), agent("w"), agent("done")),
                List.of(edge("t", "L"), edge("L", "w"), edge("w", "L"), edge("L", "done")))
            .code();

    assertThat(code)
        .contains(
            """
                # Feedback loop: up to 3 iteration(s)
                iterations_L = 0
                for iteration_L in range(3):
                    iterations_L = iteration_L + 1
                    # Agent: w
            """);
    assertThat(code)
        .contains(
            "            input=next((value[\"output\"] for value in (out_w,) if value is not None), input_text),\n");
    assertThat(code)
        .contains(
            """
                    if 'ok' in out_w['output']:
                        break
                out_L = {"output": (out_w["output"] if out_w is not None else None), "iterations": iterations_L}
                # Agent: done
            """);
    assertThat(code).contains("        input=out_L['output'],\n");
    assertThat(code).contains("    return out_done\n");
    assertWellFormed(code);
  }

  @Test
  void footerLoopFeedsPreviousPassBeforeUpstreamOutput() {
    String code =
        emit(
                List.of(trigger("t"), agent("w"), loop("L", 2, null), agent("after")),
                List.of(edge("t", "w"), edge("w", "L"), edge("L", "w"), edge("L", "after")))
            .code();

    assertThat(code)
        .contains(
            """
                for iteration_L in range(2):
                    iterations_L = iteration_L + 1
                    # Agent: w
            """);
    assertThat(code)
        .contains(
            "            input=next((value[\"output\"] for value in (out_w, out_t) if value is not None), input_text),\n");
    assertThat(code).contains("        input=out_L['output'],\n");
    assertWellFormed(code);
  }

  @Test
  void loopEnteredFromConditionArmStartsFromConditionInput() {
    String code =
        emit(
                List.of(trigger("t"), condition("c", "True"), loop("L", 2, null), agent("w")),
                List.of(
                    edge("t", "c"), branch("c", "L", "true"), edge("L", "w"), edge("w", "L")))
            .code();

    assertThat(code)
        .contains(
            """
                if out_c["output"]:
                    # Feedback loop: up to 2 iteration(s)
                    iterations_L = 0
                    for iteration_L in range(2):
            """);
    assertThat(code)
        .contains(
            "                input=next((value[\"output\"] for value in (out_w,) if value is not None), input_text),\n");
    assertThat(code).doesNotContain("input=out_w['output']");
    assertWellFormed(code);
  }

  @Test
  void loopInsideFanOutBranchStartsFromFanInput() {
    String code =
        emit(
                List.of(
                    trigger("t"),
                    parallel("p", MergeStrategy.ALL),
                    loop("L", 2, null),
                    agent("w"),
                    agent("z")),
                List.of(
                    edge("t", "p"),
                    slot("p", "L", "1"),
                    slot("p", "z", "2"),
                    edge("L", "w"),
                    edge("w", "L")))
            .code();

    assertThat(code)
        .contains(
            """
                async def branch_p_1():
                    nonlocal out_L, out_w
                    # Feedback loop: up to 2 iteration(s)
            """);
    assertThat(code)
        .contains(
            "                input=next((value[\"output\"] for value in (out_w,) if value is not None), input_text),\n");
    assertThat(code).contains("        return out_L\n    async def branch_p_2():\n");
    assertWellFormed(code);
  }

  @Test
  void nestsInnerLoopInsideOuterLoopAndRestartsIt() {
    String code =
        emit(
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
                    edge("L1", "done")))
            .code();

    assertThat(code)
        .contains(
            """
                for iteration_L1 in range(3):
                    iterations_L1 = iteration_L1 + 1
                    # Agent: x
            """);
    assertThat(code)
        .contains(
            "            input=next((value[\"output\"] for value in (out_L2,) if value is not None), input_text),\n");
    assertThat(code)
        .contains(
            """
                    # Feedback loop: up to 2 iteration(s)
                    out_y = None
                    iterations_L2 = 0
                    for iteration_L2 in range(2):
                        iterations_L2 = iteration_L2 + 1
                        # Agent: y
            """);
    assertThat(code)
        .contains(
            "                input=next((value[\"output\"] for value in (out_y,) if value is not None), out_x['output']),\n");
    assertThat(code)
        .contains(
            """
                    out_L2 = {"output": (out_y["output"] if out_y is not None else None), "iterations": iterations_L2}
                out_L1 = {"output": (out_L2["output"] if out_L2 is not None else None), "iterations": iterations_L1}
                # Agent: done
            """);
    assertWellFormed(code);
  }

  @Test
  void conditionArmLeavingLoopBreaksAndGuardsWhatFollows() {
    String code =
        emit(
                List.of(
                    trigger("t"),
                    loop("L", 2, null),
                    condition("c", "True"),
                    agent("w"),
                    agent("done")),
                List.of(
                    edge("t", "L"),
                    edge("L", "c"),
                    branch("c", "w", "true"),
                    edge("w", "L"),
                    branch("c", "done", "false")))
            .code();

    assertThat(code)
        .contains(
            """
                    out_c = {"output": bool(True)}
                    if out_c["output"]:
                        # Agent: w
            """);
    assertThat(code)
        .contains(
            "                input=next((value[\"output\"] for value in (out_w,) if value is not None), input_text),\n");
    assertThat(code).contains("        else:\n            break\n    out_L = {");
    assertThat(code)
        .contains(
            """
                if out_c is not None and not out_c["output"]:
                    # Agent: done
                    out_done = await run_agent(
            """);
    assertThat(code)
        .contains(
            "    return (out_done if out_c is not None and not out_c[\"output\"] else None)\n");
    assertThat(code.split("out_done = await", -1)).hasSize(2);
    assertWellFormed(code);
  }

  @Test
  void rendersToolParametersWithTemplates() {
    ObjectNode parameters = new ObjectMapper().createObjectNode();
    parameters.put("query", "{{input}} news");
    parameters.put("limit", 5);
    parameters.putArray("tags").add("daily").add(true);

    String code =
        emit(List.of(trigger("t"), tool("s", "search", parameters)), List.of(edge("t", "s"))).code();

    assertThat(code)
        .contains(
            """
                # Tool: search (Search)
                out_s = await run_tool(
                    server="server-1",
                    tool="search",
                    arguments={"query": str(input_text) + " news", "limit": 5, "tags": ["daily", True]},
                )
            """);
    assertThat(code).contains("from agentchord.runtime import run_tool\n");
  }

  @Test
  void keepsUnresolvedPlaceholdersAndReportsThem() {
    EmittedProgram program =
        emit(
            List.of(trigger("t"), agent("a", "Use {{ghost.output}}")),
            List.of(edge("t", "a")));

    assertThat(program.code()).contains("        input=\"Use {{ghost.output}}\",\n");
    assertThat(program.warnings())
        .extracting(CompileDiagnostic::code, CompileDiagnostic::nodeId)
        .containsExactly(tuple(WorkflowIssueCodes.TEMPLATE_UNKNOWN_NODE, "a"));
  }

  @Test
  void referenceToPlannedNodeIsACommentNotASecondCall() {
    WorkflowGraph graph = graph(List.of(trigger("t"), agent("a")), List.of(edge("t", "a")));
    Block root =
        new Block.Steps(
            List.of(
                new Block.Seq("t", new Block.Seq("a", Block.End.INSTANCE)), new Block.Ref("a")));

    String code = emitter.emit(root, graph);

    assertThat(code).contains("    # 'a' already ran above (out_a)\n    return out_a\n");
    assertThat(code.split("out_a = await", -1)).hasSize(2);
  }

  @Test
  void breaksBindingNameCollisionsByNodeId() {
    String code =
        emit(
                List.of(trigger("t"), agent("a_b"), agent("a-b")),
                List.of(edge("t", "a-b"), edge("a-b", "a_b")))
            .code();

    assertThat(code).contains("(out_a_b, out_a_b_2, out_t) = (None,) * 3");
    assertThat(code).contains("    out_a_b = await run_agent(\n        name=\"a-b\",\n");
    assertThat(code).contains("        input=out_a_b['output'],\n");
  }

  /**
   * Checks the block structure of the emitted Python: every header line opens an indented block
   * and {@code break} only appears inside a {@code for} of the same function.
   */
  private static void assertWellFormed(String code) {
    List<String> lines = code.lines().filter(line -> !line.isBlank()).toList();
    Deque<Opener> openers = new ArrayDeque<>();
    for (int index = 0; index < lines.size(); index++) {
      String line = lines.get(index);
      int indent = line.length() - line.stripLeading().length();
      String statement = line.strip();
      while (!openers.isEmpty() && openers.peek().indent() >= indent) {
        openers.pop();
      }
      if (statement.equals("break")) {
        Opener enclosing =
            openers.stream()
                .filter(opener -> !opener.keyword().equals("other"))
                .findFirst()
                .orElse(null);
        assertThat(enclosing).as("break at line %d", index).isNotNull();
        assertThat(enclosing.keyword()).as("break at line %d", index).isEqualTo("for");
      }
      if (statement.endsWith(":") && !statement.startsWith("#")) {
        assertThat(index + 1).as("body after '%s'", statement).isLessThan(lines.size());
        String next = lines.get(index + 1);
        assertThat(next.length() - next.stripLeading().length())
            .as("body after '%s'", statement)
            .isGreaterThan(indent);
        String keyword =
            statement.startsWith("for ") ? "for" : statement.contains("def ") ? "def" : "other";
        openers.push(new Opener(indent, keyword));
      }
    }
  }

  private record Opener(int indent, String keyword) {}

  private EmittedProgram emit(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
    WorkflowGraph graph = graph(nodes, edges);
    Block root = planner.plan(new ValidatedGraph(graph, "t")).root();
    return emitter.emitProgram(root, graph);
  }
}
