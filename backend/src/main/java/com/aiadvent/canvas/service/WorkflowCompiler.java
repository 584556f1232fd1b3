package com.aiadvent.canvas.service;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.api.WorkflowCompileRequest;
import com.aiadvent.canvas.codegen.EmittedProgram;
import com.aiadvent.canvas.codegen.WorkflowCodeEmitter;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowGraphMapper;
import com.aiadvent.canvas.graph.WorkflowNode;
import com.aiadvent.canvas.plan.ControlFlowPlan;
import com.aiadvent.canvas.plan.ControlFlowPlanner;
import com.aiadvent.canvas.reference.AncestorInfo;
import com.aiadvent.canvas.reference.AncestorResolver;
import com.aiadvent.canvas.telemetry.CompilerTelemetryService;
import com.aiadvent.canvas.telemetry.CompilerTelemetryService.Outcome;
import com.aiadvent.canvas.validation.GraphValidationResult;
import com.aiadvent.canvas.validation.WorkflowGraphParsingException;
import com.aiadvent.canvas.validation.WorkflowGraphValidator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the canvas compiler: validate, plan, emit. Graphs that are well formed but break a
 * structural rule come back as error diagnostics with placeholder code; only malformed input
 * throws.
 */
@Service
public class WorkflowCompiler {

  private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

  public static final String EMPTY_CANVAS_CODE = "# Add blocks to the canvas to generate code.";
  public static final String INVALID_GRAPH_CODE =
      "# Workflow has structural errors; fix them to generate code.";

  private final WorkflowGraphMapper graphMapper;
  private final WorkflowGraphValidator validator;
  private final AncestorResolver ancestorResolver;
  private final ControlFlowPlanner planner;
  private final WorkflowCodeEmitter emitter;
  private final CompilerTelemetryService telemetry;

  public WorkflowCompiler(
      WorkflowGraphMapper graphMapper,
      WorkflowGraphValidator validator,
      AncestorResolver ancestorResolver,
      ControlFlowPlanner planner,
      WorkflowCodeEmitter emitter,
      CompilerTelemetryService telemetry) {
    this.graphMapper = graphMapper;
    this.validator = validator;
    this.ancestorResolver = ancestorResolver;
    this.planner = planner;
    this.emitter = emitter;
    this.telemetry = telemetry;
  }

  public CompileResult compile(WorkflowCompileRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Compile request must not be null");
    }
    return compile(toGraph(request));
  }

  public CompileResult compile(List<WorkflowNode> nodes, List<WorkflowEdge> edges) {
    WorkflowGraph graph;
    try {
      graph = new WorkflowGraph(nodes, edges);
    } catch (WorkflowGraphParsingException ex) {
      telemetry.compileRejected(ex.issues().size());
      throw ex;
    }
    return compile(graph);
  }

  public CompileResult compile(WorkflowGraph graph) {
    if (graph == null) {
      throw new IllegalArgumentException("Workflow graph must not be null");
    }
    long started = System.nanoTime();
    if (graph.isEmpty()) {
      finish(Outcome.EMPTY, graph, List.of(), started);
      return new CompileResult(EMPTY_CANVAS_CODE, List.of());
    }

    GraphValidationResult validation = validator.validate(graph);
    if (!validation.isValid()) {
      List<CompileDiagnostic> diagnostics = new ArrayList<>(validation.errors());
      diagnostics.addAll(validation.warnings());
      log.debug("Workflow {} failed validation: {}", graph, validation.errors());
      finish(Outcome.INVALID, graph, diagnostics, started);
      return new CompileResult(INVALID_GRAPH_CODE, diagnostics);
    }

    ControlFlowPlan plan = planner.plan(validation.validatedGraph());
    log.debug("Planned {} as {}", graph, plan.root());
    EmittedProgram program = emitter.emitProgram(plan.root(), graph);

    List<CompileDiagnostic> diagnostics = new ArrayList<>(validation.warnings());
    diagnostics.addAll(plan.diagnostics());
    diagnostics.addAll(program.warnings());
    finish(Outcome.COMPILED, graph, diagnostics, started);
    return new CompileResult(program.code(), diagnostics);
  }

  public List<AncestorInfo> ancestorsOf(WorkflowGraph graph, String nodeId) {
    return ancestorResolver.ancestorsOf(graph, nodeId);
  }

  public List<AncestorInfo> ancestorsOf(WorkflowCompileRequest request, String nodeId) {
    if (request == null) {
      throw new IllegalArgumentException("Request must not be null");
    }
    return ancestorsOf(toGraph(request), nodeId);
  }

  private WorkflowGraph toGraph(WorkflowCompileRequest request) {
    try {
      return graphMapper.toGraph(request.nodes(), request.edges());
    } catch (WorkflowGraphParsingException ex) {
      telemetry.compileRejected(ex.issues().size());
      throw ex;
    }
  }

  private void finish(
      Outcome outcome, WorkflowGraph graph, List<CompileDiagnostic> diagnostics, long startedNanos) {
    telemetry.compileFinished(
        outcome, graph.size(), diagnostics.size(), Duration.ofNanos(System.nanoTime() - startedNanos));
  }
}
