package com.aiadvent.canvas.service;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

public record CompileResult(String code, List<CompileDiagnostic> diagnostics) {

  public CompileResult {
    code = code != null ? code : "";
    diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(CompileDiagnostic::isError);
  }
}
