package com.aiadvent.canvas.reference;

import com.aiadvent.canvas.api.CompileDiagnostic;
import java.util.List;

/**
 * Outcome of resolving one configuration string. {@code expression} is the text with every
 * resolvable placeholder replaced by its accessor; {@code parts} keeps the same content split
 * into pieces so it can be rendered as a string-building expression.
 */
public record ResolvedTemplate(
    String expression, List<TemplatePart> parts, List<CompileDiagnostic> warnings) {

  public ResolvedTemplate {
    expression = expression != null ? expression : "";
    parts = parts != null ? List.copyOf(parts) : List.of();
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }

  public boolean hasReferences() {
    return parts.stream().anyMatch(TemplatePart.Reference.class::isInstance);
  }
}
