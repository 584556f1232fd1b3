package com.aiadvent.canvas.plan;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

public record ControlFlowPlan(Block root, List<CompileDiagnostic> diagnostics) {

  public ControlFlowPlan {
    if (root == null) {
      throw new IllegalArgumentException("Plan root must not be null");
    }
    diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
  }
}
