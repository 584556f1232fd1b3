package com.aiadvent.canvas.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileDiagnostic(
    String code, Severity severity, String message, String nodeId, String edgeId) {

  public CompileDiagnostic {
    if (severity == null) {
      throw new IllegalArgumentException("Diagnostic severity must not be null");
    }
    message = message != null ? message : "";
  }

  public static CompileDiagnostic error(String code, String message, String nodeId, String edgeId) {
    return new CompileDiagnostic(code, Severity.ERROR, message, nodeId, edgeId);
  }

  public static CompileDiagnostic warning(String code, String message, String nodeId) {
    return new CompileDiagnostic(code, Severity.WARNING, message, nodeId, null);
  }

  public static CompileDiagnostic info(String code, String message, String nodeId) {
    return new CompileDiagnostic(code, Severity.INFO, message, nodeId, null);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String jsonValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
