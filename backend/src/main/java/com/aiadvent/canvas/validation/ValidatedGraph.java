package com.aiadvent.canvas.validation;

import com.aiadvent.canvas.graph.WorkflowGraph;

/** A graph that passed every structural check, together with its single trigger. */
public record ValidatedGraph(WorkflowGraph graph, String triggerId) {

  public ValidatedGraph {
    if (graph == null) {
      throw new IllegalArgumentException("Validated graph must not be null");
    }
    if (triggerId == null || !graph.contains(triggerId)) {
      throw new IllegalArgumentException("Validated graph must name an existing trigger");
    }
  }
}
