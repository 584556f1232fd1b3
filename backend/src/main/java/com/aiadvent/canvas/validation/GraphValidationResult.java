package com.aiadvent.canvas.validation;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

public record GraphValidationResult(
    ValidatedGraph validatedGraph, List<CompileDiagnostic> errors, List<CompileDiagnostic> warnings) {

  public GraphValidationResult {
    errors = errors != null ? List.copyOf(errors) : List.of();
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
    if (errors.isEmpty() == (validatedGraph == null)) {
      throw new IllegalArgumentException("A result carries either a validated graph or errors");
    }
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
