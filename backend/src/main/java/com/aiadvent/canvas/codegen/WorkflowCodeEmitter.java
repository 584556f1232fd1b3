package com.aiadvent.canvas.codegen;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.config.WorkflowCompilerProperties;
import com.aiadvent.canvas.graph.AgentConfig;
import com.aiadvent.canvas.graph.ConditionConfig;
import com.aiadvent.canvas.graph.FeedbackLoopConfig;
import com.aiadvent.canvas.graph.MergeStrategy;
import com.aiadvent.canvas.graph.MultiAgentTeamConfig;
import com.aiadvent.canvas.graph.MultiAgentTeamConfig.TeamMember;
import com.aiadvent.canvas.graph.NodeConfigVisitor;
import com.aiadvent.canvas.graph.NodeKind;
import com.aiadvent.canvas.graph.OutputField;
import com.aiadvent.canvas.graph.ParallelConfig;
import com.aiadvent.canvas.graph.RetrievalConfig;
import com.aiadvent.canvas.graph.ToolCallConfig;
import com.aiadvent.canvas.graph.TriggerConfig;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import com.aiadvent.canvas.plan.Block;
import com.aiadvent.canvas.reference.AncestorInfo;
import com.aiadvent.canvas.reference.AncestorResolver;
import com.aiadvent.canvas.reference.BindingNames;
import com.aiadvent.canvas.reference.ResolvedTemplate;
import com.aiadvent.canvas.reference.TemplateResolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the asyncio Python program for a planned workflow. The block tree is walked once and
 * every node gets exactly one binding statement {@code out_<id> = ...}, written where the plan
 * places it. All bindings are pre-declared at the top of the entry function so that nested branch
 * functions can rebind them with {@code nonlocal}.
 */
@Component
public class WorkflowCodeEmitter {

  private static final Logger log = LoggerFactory.getLogger(WorkflowCodeEmitter.class);

  static final String RUN_AGENT = "run_agent";
  static final String RUN_TOOL = "run_tool";
  static final String RUN_RETRIEVAL = "run_retrieval";
  static final String RUN_TEAM = "run_team";

  private static final String OUTPUT = AncestorInfo.DEFAULT_FIELD;
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final WorkflowCompilerProperties properties;
  private final AncestorResolver ancestorResolver;
  private final TemplateResolver templateResolver;

  public WorkflowCodeEmitter(
      WorkflowCompilerProperties properties,
      AncestorResolver ancestorResolver,
      TemplateResolver templateResolver) {
    this.properties = properties;
    this.ancestorResolver = ancestorResolver;
    this.templateResolver = templateResolver;
  }

  public String emit(Block root, WorkflowGraph graph) {
    return emitProgram(root, graph).code();
  }

  public EmittedProgram emitProgram(Block root, WorkflowGraph graph) {
    if (root == null || graph == null) {
      throw new IllegalArgumentException("Plan and graph must not be null");
    }
    Emission emission = new Emission(graph);
    emission.block(root);
    String terminal = emission.terminal(root);
    emission.body.line("return " + (terminal != null ? terminal : "None"));

    PythonSourceWriter program = new PythonSourceWriter(properties.getIndent(), 0);
    program.line("import asyncio");
    if (!emission.runtimeCalls.isEmpty()) {
      program.blank();
      program.line(
          "from %s import %s"
              .formatted(properties.getRuntimeModule(), String.join(", ", emission.runtimeCalls)));
    }
    program.blank().blank();
    program.line("async def %s(%s: str):".formatted(properties.getEntryFunction(), BindingNames.ENTRY_VALUE));
    program.indent();
    List<String> bindings =
        graph.nodes().stream().map(node -> emission.names.binding(node.id())).sorted().toList();
    if (!bindings.isEmpty()) {
      String targets = bindings.size() == 1 ? bindings.get(0) + "," : String.join(", ", bindings);
      program.line("(%s) = (None,) * %d".formatted(targets, bindings.size()));
    }
    program.dedent();
    program.append(emission.body);
    program.blank().blank();
    program.line("if __name__ == \"__main__\":");
    program.indent();
    program.line(
        "print(asyncio.run(%s(%s)))"
            .formatted(properties.getEntryFunction(), PythonLiterals.string(properties.getSampleInput())));

    log.debug(
        "Emitted workflow program for {} node(s) using {}", graph.size(), emission.runtimeCalls);
    return new EmittedProgram(program.toString(), new ArrayList<>(emission.warnings));
  }

  /** State of one emission pass. */
  private final class Emission {

    private final WorkflowGraph graph;
    private final BindingNames names;
    private final PythonSourceWriter body;
    private final Set<CompileDiagnostic> warnings = new LinkedHashSet<>();
    private final Set<String> runtimeCalls = new TreeSet<>();
    private final Map<String, List<AncestorInfo>> ancestors = new HashMap<>();
    private final Set<String> started = new HashSet<>();
    private final Set<String> bound = new HashSet<>();
    private final Map<String, Set<String>> loopBodies = new HashMap<>();
    private final Deque<String> openLoops = new ArrayDeque<>();

    private Emission(WorkflowGraph graph) {
      this.graph = graph;
      this.names = BindingNames.of(graph);
      this.body = new PythonSourceWriter(properties.getIndent(), 1);
    }

    private void block(Block block) {
      if (block instanceof Block.Seq seq) {
        node(seq.nodeId());
        block(seq.next());
      } else if (block instanceof Block.Branch branch) {
        branch(branch);
      } else if (block instanceof Block.Fan fan) {
        fan(fan);
      } else if (block instanceof Block.Loop loop) {
        loop(loop);
      } else if (block instanceof Block.Steps steps) {
        steps.blocks().forEach(this::block);
      } else if (block instanceof Block.Ref ref) {
        reference(ref.nodeId());
      } else if (block instanceof Block.Exit) {
        body.line("break");
      } else if (block instanceof Block.Guarded guarded) {
        body.line("if %s:".formatted(guard(guarded)));
        arm(guarded.body(), null);
      }
    }

    /** True when the condition ran and took the arm the guarded block depends on. */
    private String guard(Block.Guarded guarded) {
      String binding = names.binding(guarded.conditionNodeId());
      return "%s is not None and %s%s[\"%s\"]"
          .formatted(binding, guarded.whenTrue() ? "" : "not ", binding, OUTPUT);
    }

    private void node(String nodeId) {
      if (!started.add(nodeId)) {
        reference(nodeId);
        return;
      }
      WorkflowNode node = graph.requireNode(nodeId);
      node.config().accept(new StatementWriter(node));
      bound.add(nodeId);
    }

    private void reference(String nodeId) {
      body.line("# '%s' already ran above (%s)".formatted(comment(nodeId), names.binding(nodeId)));
    }

    private void branch(Block.Branch branch) {
      String nodeId = branch.conditionNodeId();
      String binding = names.binding(nodeId);
      ConditionConfig config = (ConditionConfig) graph.requireNode(nodeId).config();
      started.add(nodeId);
      String expression = config.expression().isEmpty() ? "False" : expression(config.expression(), nodeId);
      body.line("# Condition: " + comment(config.expression().isEmpty() ? nodeId : config.expression()));
      body.line("%s = {\"%s\": bool(%s)}".formatted(binding, OUTPUT, expression));
      bound.add(nodeId);

      body.line("if %s[\"%s\"]:".formatted(binding, OUTPUT));
      arm(branch.onTrue(), config.trueLabel());
      if (!isEmpty(branch.onFalse())) {
        body.line("else:");
        arm(branch.onFalse(), config.falseLabel());
      }
      block(branch.next());
    }

    private void arm(Block arm, String label) {
      body.indent();
      if (label != null && !label.isBlank()) {
        body.line("# " + comment(label));
      }
      block(arm);
      if (!hasStatements(arm)) {
        body.line("pass");
      }
      body.dedent();
    }

    private void fan(Block.Fan fan) {
      String nodeId = fan.parallelNodeId();
      String suffix = names.suffix(nodeId);
      started.add(nodeId);
      body.line(
          "# Parallel: %d branches, merge %s"
              .formatted(fan.branches().size(), fan.mergeStrategy().jsonValue()));

      List<String> calls = new ArrayList<>();
      for (int index = 0; index < fan.branches().size(); index++) {
        Block branch = fan.branches().get(index);
        String function = "branch_%s_%d".formatted(suffix, index + 1);
        body.line("async def %s():".formatted(function));
        body.indent();
        List<String> owned =
            nodesIn(branch).stream().map(names::binding).sorted().distinct().toList();
        if (!owned.isEmpty()) {
          body.line("nonlocal " + String.join(", ", owned));
        }
        block(branch);
        String terminal = terminal(branch);
        body.line("return " + (terminal != null ? terminal : "None"));
        body.dedent();
        calls.add(function + "()");
      }

      String binding = names.binding(nodeId);
      if (fan.mergeStrategy() == MergeStrategy.FIRST) {
        String tasks = "tasks_" + suffix;
        String done = "done_" + suffix;
        String pending = "pending_" + suffix;
        String winner = "winner_" + suffix;
        List<String> futures = calls.stream().map(call -> "asyncio.ensure_future(" + call + ")").toList();
        body.line("%s = [%s]".formatted(tasks, String.join(", ", futures)));
        body.line(
            "%s, %s = await asyncio.wait(%s, return_when=asyncio.FIRST_COMPLETED)"
                .formatted(done, pending, tasks));
        body.line("for task in %s:".formatted(pending));
        body.indent().line("task.cancel()").dedent();
        body.line("%s = next(task for task in %s if task in %s)".formatted(winner, tasks, done));
        body.line("%s = {\"%s\": %s.result()}".formatted(binding, OUTPUT, winner));
      } else {
        String results = "results_" + suffix;
        body.line("%s = await asyncio.gather(%s)".formatted(results, String.join(", ", calls)));
        body.line("%s = {\"%s\": list(%s)}".formatted(binding, OUTPUT, results));
      }
      bound.add(nodeId);
      block(fan.next());
    }

    private void loop(Block.Loop loop) {
      String nodeId = loop.loopNodeId();
      String suffix = names.suffix(nodeId);
      String counter = "iterations_" + suffix;
      String iteration = "iteration_" + suffix;
      started.add(nodeId);
      loopBodies.put(nodeId, nodesIn(loop.body()));

      body.line("# Feedback loop: up to %d iteration(s)".formatted(loop.maxIterations()));
      if (!openLoops.isEmpty()) {
        // each pass of the enclosing loop starts this one afresh
        for (String source : feedbackSources(nodeId)) {
          body.line(names.binding(source) + " = None");
        }
      }
      body.line(counter + " = 0");
      body.line("for %s in range(%d):".formatted(iteration, loop.maxIterations()));
      body.indent();
      body.line("%s = %s + 1".formatted(counter, iteration));
      openLoops.push(nodeId);
      block(loop.body());
      openLoops.pop();
      if (!loop.stopCondition().isEmpty()) {
        body.line("if %s:".formatted(expression(loop.stopCondition(), nodeId)));
        body.indent().line("break").dedent();
      }
      body.dedent();

      body.line(
          "%s = {\"%s\": %s, \"iterations\": %s}"
              .formatted(names.binding(nodeId), OUTPUT, outputOf(terminal(loop.body())), counter));
      bound.add(nodeId);
      block(loop.next());
    }

    /** Expression for the value a block leaves behind, or {@code null} when it runs nothing. */
    private String terminal(Block block) {
      if (block instanceof Block.Seq seq) {
        String next = terminal(seq.next());
        return next != null ? next : names.binding(seq.nodeId());
      }
      if (block instanceof Block.Branch branch) {
        String next = terminal(branch.next());
        if (next != null) {
          return next;
        }
        String onTrue = terminal(branch.onTrue());
        String onFalse = terminal(branch.onFalse());
        String binding = names.binding(branch.conditionNodeId());
        if (onTrue == null && onFalse == null) {
          return binding;
        }
        return "(%s if %s[\"%s\"] else %s)"
            .formatted(
                onTrue != null ? onTrue : "None", binding, OUTPUT, onFalse != null ? onFalse : "None");
      }
      if (block instanceof Block.Fan fan) {
        String next = terminal(fan.next());
        return next != null ? next : names.binding(fan.parallelNodeId());
      }
      if (block instanceof Block.Loop loop) {
        String next = terminal(loop.next());
        return next != null ? next : names.binding(loop.loopNodeId());
      }
      if (block instanceof Block.Steps steps) {
        for (int index = steps.blocks().size() - 1; index >= 0; index--) {
          String candidate = terminal(steps.blocks().get(index));
          if (candidate != null) {
            return candidate;
          }
        }
        return null;
      }
      if (block instanceof Block.Ref ref) {
        return names.binding(ref.nodeId());
      }
      if (block instanceof Block.Guarded guarded) {
        String inner = terminal(guarded.body());
        return inner != null ? "(%s if %s else None)".formatted(inner, guard(guarded)) : null;
      }
      return null;
    }

    /** The {@code output} of a binding expression that may be {@code None}. */
    private String outputOf(String terminal) {
      if (terminal == null) {
        return "None";
      }
      String value = IDENTIFIER.matcher(terminal).matches() ? terminal : "(" + terminal + ")";
      return "(%s[\"%s\"] if %s is not None else None)".formatted(value, OUTPUT, value);
    }

    /** Ids of the nodes a block places, in plan order. */
    private Set<String> nodesIn(Block block) {
      Set<String> nodes = new LinkedHashSet<>();
      collectNodes(block, nodes);
      return nodes;
    }

    private void collectNodes(Block block, Set<String> nodes) {
      if (block instanceof Block.Seq seq) {
        nodes.add(seq.nodeId());
        collectNodes(seq.next(), nodes);
      } else if (block instanceof Block.Branch branch) {
        nodes.add(branch.conditionNodeId());
        collectNodes(branch.onTrue(), nodes);
        collectNodes(branch.onFalse(), nodes);
        collectNodes(branch.next(), nodes);
      } else if (block instanceof Block.Fan fan) {
        nodes.add(fan.parallelNodeId());
        fan.branches().forEach(branch -> collectNodes(branch, nodes));
        collectNodes(fan.next(), nodes);
      } else if (block instanceof Block.Loop loop) {
        nodes.add(loop.loopNodeId());
        collectNodes(loop.body(), nodes);
        collectNodes(loop.next(), nodes);
      } else if (block instanceof Block.Steps steps) {
        steps.blocks().forEach(child -> collectNodes(child, nodes));
      } else if (block instanceof Block.Guarded guarded) {
        collectNodes(guarded.body(), nodes);
      }
    }

    private boolean hasStatements(Block block) {
      if (block instanceof Block.Steps steps) {
        return steps.blocks().stream().anyMatch(this::hasStatements);
      }
      return !(block instanceof Block.End) && !(block instanceof Block.Ref);
    }

    private boolean isEmpty(Block block) {
      if (block instanceof Block.Steps steps) {
        return steps.blocks().stream().allMatch(this::isEmpty);
      }
      return block instanceof Block.End;
    }

    /** String-valued template rendered as a Python expression producing that string. */
    private String text(String value, String nodeId) {
      return PythonLiterals.template(resolve(value, nodeId));
    }

    /** Template used verbatim as Python code, with references replaced by accessors. */
    private String expression(String value, String nodeId) {
      return resolve(value, nodeId).expression().replace('\n', ' ').replace('\r', ' ').trim();
    }

    private ResolvedTemplate resolve(String value, String nodeId) {
      List<AncestorInfo> known =
          ancestors.computeIfAbsent(nodeId, id -> ancestorResolver.ancestorsOf(graph, id));
      ResolvedTemplate resolved = templateResolver.resolve(value, nodeId, known, names);
      warnings.addAll(resolved.warnings());
      return resolved;
    }

    private String input(String nodeId, String inputTemplate) {
      if (inputTemplate != null && !inputTemplate.isBlank()) {
        return text(inputTemplate, nodeId);
      }
      return defaultInput(nodeId, new HashSet<>());
    }

    /**
     * Input of a node without an explicit template: the output of the upstream blocks that have
     * already run. Control blocks pass their own input through while their construct is open. Below
     * an open feedback loop, the body blocks feeding the loop come first; they hold the previous
     * iteration's output and are {@code None} on the first one.
     */
    private String defaultInput(String nodeId, Set<String> seen) {
      if (!seen.add(nodeId)) {
        return BindingNames.ENTRY_VALUE;
      }
      Set<String> ownBody = loopBodies.getOrDefault(nodeId, Set.of());
      Set<String> feedback = new LinkedHashSet<>();
      Set<String> plain = new LinkedHashSet<>();
      String passThrough = null;
      for (WorkflowEdge edge : graph.sortedIncoming(nodeId)) {
        String source = edge.sourceNodeId();
        WorkflowNode upstream = graph.node(source).orElse(null);
        if (upstream == null || !started.contains(source) || ownBody.contains(source)) {
          continue;
        }
        NodeKind kind = upstream.kind();
        boolean open = !bound.contains(source);
        if (kind == NodeKind.FEEDBACK_LOOP && open) {
          feedback.addAll(feedbackSources(source));
        }
        if (kind == NodeKind.CONDITION
            || (kind == NodeKind.PARALLEL || kind == NodeKind.FEEDBACK_LOOP) && open) {
          if (passThrough == null) {
            passThrough = source;
          }
        } else {
          plain.add(source);
        }
      }
      if (feedback.isEmpty() && plain.size() == 1) {
        String source = plain.iterator().next();
        return graph.requireNode(source).kind() == NodeKind.TRIGGER
            ? BindingNames.ENTRY_VALUE
            : names.accessor(source, List.of(OUTPUT));
      }
      String fallback =
          passThrough != null ? defaultInput(passThrough, seen) : BindingNames.ENTRY_VALUE;
      Set<String> candidates = new LinkedHashSet<>(feedback);
      candidates.addAll(plain);
      if (candidates.isEmpty()) {
        return fallback;
      }
      List<String> bindings = candidates.stream().map(names::binding).toList();
      String tuple = bindings.size() == 1 ? bindings.get(0) + "," : String.join(", ", bindings);
      return "next((value[\"%s\"] for value in (%s) if value is not None), %s)"
          .formatted(OUTPUT, tuple, fallback);
    }

    /** Body blocks of an emitted loop that feed back into the loop node, in edge order. */
    private List<String> feedbackSources(String loopId) {
      Set<String> planned = loopBodies.getOrDefault(loopId, Set.of());
      return graph.sortedIncoming(loopId).stream()
          .map(WorkflowEdge::sourceNodeId)
          .filter(planned::contains)
          .distinct()
          .toList();
    }

    private void call(String nodeId, String function, List<String> arguments) {
      runtimeCalls.add(function);
      body.line("%s = await %s(".formatted(names.binding(nodeId), function));
      body.indent();
      for (String argument : arguments) {
        body.line(argument + ",");
      }
      body.dedent();
      body.line(")");
    }

    /** Per-kind statement for the nodes that are emitted as a single binding. */
    private final class StatementWriter implements NodeConfigVisitor<Void> {

      private final WorkflowNode node;

      private StatementWriter(WorkflowNode node) {
        this.node = node;
      }

      @Override
      public Void visitTrigger(TriggerConfig config) {
        String detail =
            switch (config.triggerType()) {
              case MANUAL -> "manual";
              case CRON -> "cron " + (config.cronExpression() != null ? config.cronExpression() : "");
              case WEBHOOK -> "webhook " + (config.webhookPath() != null ? config.webhookPath() : "");
            };
        body.line("# Trigger: " + comment(detail.trim()));
        body.line(
            "%s = {\"%s\": %s}".formatted(names.binding(node.id()), OUTPUT, BindingNames.ENTRY_VALUE));
        return null;
      }

      @Override
      public Void visitAgent(AgentConfig config) {
        body.line("# Agent: " + comment(node.label()));
        List<String> arguments = new ArrayList<>();
        arguments.add("name=" + PythonLiterals.string(node.label()));
        if (!config.role().isBlank()) {
          arguments.add("role=" + PythonLiterals.string(config.role()));
        }
        arguments.add("model=" + PythonLiterals.string(config.model()));
        arguments.add("temperature=" + PythonLiterals.number(config.temperature()));
        arguments.add("max_tokens=" + config.maxTokens());
        if (config.systemPrompt() != null && !config.systemPrompt().isBlank()) {
          arguments.add("system_prompt=" + text(config.systemPrompt(), node.id()));
        }
        if (!config.mcpTools().isEmpty()) {
          arguments.add("tools=" + PythonLiterals.stringList(config.mcpTools()));
        }
        addOutputFields(arguments, config.outputFields());
        arguments.add("input=" + input(node.id(), config.inputTemplate()));
        call(node.id(), RUN_AGENT, arguments);
        return null;
      }

      @Override
      public Void visitToolCall(ToolCallConfig config) {
        String server = config.serverName().isBlank() ? config.serverId() : config.serverName();
        body.line(
            "# Tool: %s%s".formatted(comment(config.toolName()), server.isBlank() ? "" : " (" + comment(server) + ")"));
        List<String> arguments = new ArrayList<>();
        arguments.add("server=" + PythonLiterals.string(config.serverId()));
        arguments.add("tool=" + PythonLiterals.string(config.toolName()));
        arguments.add(
            "arguments=" + PythonLiterals.json(config.parameters(), value -> text(value, node.id())));
        addOutputFields(arguments, config.outputFields());
        call(node.id(), RUN_TOOL, arguments);
        return null;
      }

      @Override
      public Void visitCondition(ConditionConfig config) {
        throw new IllegalStateException("Condition '" + node.id() + "' must be planned as a branch");
      }

      @Override
      public Void visitParallel(ParallelConfig config) {
        throw new IllegalStateException("Parallel block '" + node.id() + "' must be planned as a fan-out");
      }

      @Override
      public Void visitFeedbackLoop(FeedbackLoopConfig config) {
        throw new IllegalStateException("Feedback loop '" + node.id() + "' must be planned as a loop");
      }

      @Override
      public Void visitRetrieval(RetrievalConfig config) {
        body.line("# Retrieval: " + comment(node.label()));
        List<String> arguments = new ArrayList<>();
        arguments.add("name=" + PythonLiterals.string(node.label()));
        arguments.add("documents=" + PythonLiterals.stringList(config.documents()));
        arguments.add("search_limit=" + config.searchLimit());
        arguments.add("enable_bm25=" + PythonLiterals.bool(config.enableBm25()));
        arguments.add("chunk_size=" + config.chunkSize());
        arguments.add("chunk_overlap=" + config.chunkOverlap());
        arguments.add("model=" + PythonLiterals.string(config.model()));
        arguments.add("temperature=" + PythonLiterals.number(config.temperature()));
        arguments.add("max_tokens=" + config.maxTokens());
        if (config.systemPrompt() != null && !config.systemPrompt().isBlank()) {
          arguments.add("system_prompt=" + text(config.systemPrompt(), node.id()));
        }
        if (config.embeddingProvider() != null && !config.embeddingProvider().isBlank()) {
          arguments.add("embedding_provider=" + PythonLiterals.string(config.embeddingProvider()));
        }
        if (config.embeddingModel() != null && !config.embeddingModel().isBlank()) {
          arguments.add("embedding_model=" + PythonLiterals.string(config.embeddingModel()));
        }
        addOutputFields(arguments, config.outputFields());
        arguments.add("input=" + input(node.id(), config.inputTemplate()));
        call(node.id(), RUN_RETRIEVAL, arguments);
        return null;
      }

      @Override
      public Void visitMultiAgentTeam(MultiAgentTeamConfig config) {
        body.line(
            "# Multi-agent team: %s (%s)"
                .formatted(comment(node.label()), config.strategy().jsonValue()));
        List<String> arguments = new ArrayList<>();
        arguments.add("name=" + PythonLiterals.string(node.label()));
        arguments.add("strategy=" + PythonLiterals.string(config.strategy().jsonValue()));
        List<String> members = new ArrayList<>();
        for (TeamMember member : config.members()) {
          members.add(member(member));
        }
        arguments.add("members=[" + String.join(", ", members) + "]");
        arguments.add("max_rounds=" + config.maxRounds());
        if (config.costBudget() != null) {
          arguments.add("cost_budget=" + PythonLiterals.number(config.costBudget()));
        }
        if (config.coordinatorId() != null && !config.coordinatorId().isBlank()) {
          arguments.add("coordinator_id=" + PythonLiterals.string(config.coordinatorId()));
        }
        arguments.add("enable_consult=" + PythonLiterals.bool(config.enableConsult()));
        arguments.add("max_consult_depth=" + config.maxConsultDepth());
        arguments.add("input=" + input(node.id(), config.inputTemplate()));
        call(node.id(), RUN_TEAM, arguments);
        return null;
      }

      private String member(TeamMember member) {
        List<String> entries = new ArrayList<>();
        entries.add("\"id\": " + PythonLiterals.string(member.id()));
        entries.add("\"name\": " + PythonLiterals.string(member.name()));
        entries.add("\"role\": " + PythonLiterals.string(member.role()));
        entries.add("\"model\": " + PythonLiterals.string(member.model()));
        entries.add("\"temperature\": " + PythonLiterals.number(member.temperature()));
        if (!member.systemPrompt().isBlank()) {
          entries.add("\"system_prompt\": " + text(member.systemPrompt(), node.id()));
        }
        if (!member.capabilities().isEmpty()) {
          entries.add("\"capabilities\": " + PythonLiterals.stringList(member.capabilities()));
        }
        if (!member.mcpTools().isEmpty()) {
          entries.add("\"tools\": " + PythonLiterals.stringList(member.mcpTools()));
        }
        return "{" + String.join(", ", entries) + "}";
      }

      private void addOutputFields(List<String> arguments, List<OutputField> fields) {
        if (!fields.isEmpty()) {
          arguments.add(
              "output_fields=" + PythonLiterals.stringList(fields.stream().map(OutputField::name).toList()));
        }
      }
    }
  }

  private static String comment(String text) {
    return text.replace('\n', ' ').replace('\r', ' ');
  }
}
