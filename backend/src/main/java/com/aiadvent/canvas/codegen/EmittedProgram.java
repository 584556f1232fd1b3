package com.aiadvent.canvas.codegen;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

public record EmittedProgram(String code, List<CompileDiagnostic> warnings) {

  public EmittedProgram {
    code = code != null ? code : "";
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }
}
