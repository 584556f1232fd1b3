package com.aiadvent.canvas.validation;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

/**
 * Raised when the caller hands over a graph that is not even well formed (missing ids, unknown
 * block types, unreadable configuration). Structurally invalid but well formed graphs never
 * produce this exception; they come back as error diagnostics.
 */
public class WorkflowGraphParsingException extends IllegalArgumentException {

  private final List<CompileDiagnostic> issues;

  public WorkflowGraphParsingException(List<CompileDiagnostic> issues) {
    super(issues != null && !issues.isEmpty() ? issues.get(0).message() : "Workflow graph parsing failed");
    this.issues = issues != null ? List.copyOf(issues) : List.of();
  }

  public static WorkflowGraphParsingException single(CompileDiagnostic issue) {
    return new WorkflowGraphParsingException(List.of(issue));
  }

  public List<CompileDiagnostic> issues() {
    return issues;
  }
}
