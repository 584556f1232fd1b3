package com.aiadvent.canvas.reference;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.reference.TemplatePart.Literal;
import com.aiadvent.canvas.reference.TemplatePart.Reference;
import com.aiadvent.canvas.reference.TemplatePart.Unresolved;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Resolves {@code {{ref}}} placeholders against the ancestors of a node. A placeholder that cannot
 * be resolved stays in the text unchanged and yields a warning.
 */
@Component
public class TemplateResolver {

  private static final String OPEN = "{{";
  private static final String CLOSE = "}}";
  private static final Pattern REFERENCE = Pattern.compile("[\\w-]+(?:\\.[\\w-]+)*");

  private final AncestorResolver ancestorResolver;

  public TemplateResolver(AncestorResolver ancestorResolver) {
    this.ancestorResolver = ancestorResolver;
  }

  public ResolvedTemplate resolve(String text, String nodeId, WorkflowGraph graph) {
    return resolve(
        text, nodeId, ancestorResolver.ancestorsOf(graph, nodeId), BindingNames.of(graph));
  }

  /** Variant for callers that resolve many strings of the same node. */
  public ResolvedTemplate resolve(
      String text, String nodeId, List<AncestorInfo> ancestors, BindingNames names) {
    if (text == null || text.isEmpty()) {
      return new ResolvedTemplate("", List.of(), List.of());
    }
    List<TemplatePart> parts = new ArrayList<>();
    List<CompileDiagnostic> warnings = new ArrayList<>();
    StringBuilder expression = new StringBuilder();
    StringBuilder literal = new StringBuilder();

    int cursor = 0;
    while (cursor < text.length()) {
      int open = text.indexOf(OPEN, cursor);
      if (open < 0) {
        literal.append(text, cursor, text.length());
        break;
      }
      literal.append(text, cursor, open);
      int close = text.indexOf(CLOSE, open + OPEN.length());
      if (close < 0) {
        flush(literal, parts);
        String rest = text.substring(open);
        parts.add(new Unresolved(rest));
        warnings.add(
            warning(
                WorkflowIssueCodes.TEMPLATE_MALFORMED,
                "Unterminated placeholder '%s'".formatted(rest),
                nodeId));
        break;
      }
      String placeholder = text.substring(open, close + CLOSE.length());
      String body = text.substring(open + OPEN.length(), close).trim();
      flush(literal, parts);
      parts.add(resolvePlaceholder(placeholder, body, nodeId, ancestors, names, warnings));
      cursor = close + CLOSE.length();
    }
    flush(literal, parts);

    for (TemplatePart part : parts) {
      if (part instanceof Literal value) {
        expression.append(value.text());
      } else if (part instanceof Reference reference) {
        expression.append(reference.expression());
      } else if (part instanceof Unresolved unresolved) {
        expression.append(unresolved.placeholder());
      }
    }
    return new ResolvedTemplate(expression.toString(), parts, warnings);
  }

  private TemplatePart resolvePlaceholder(
      String placeholder,
      String body,
      String nodeId,
      List<AncestorInfo> ancestors,
      BindingNames names,
      List<CompileDiagnostic> warnings) {
    if (!REFERENCE.matcher(body).matches()) {
      warnings.add(
          warning(
              WorkflowIssueCodes.TEMPLATE_MALFORMED,
              "Placeholder '%s' is not a valid reference".formatted(placeholder),
              nodeId));
      return new Unresolved(placeholder);
    }
    List<String> path = Arrays.asList(body.split("\\."));
    if (path.size() == 1 && AncestorInfo.INPUT_ID.equals(path.get(0))) {
      return new Reference(placeholder, BindingNames.ENTRY_VALUE);
    }

    String targetId = path.get(0);
    AncestorInfo ancestor =
        ancestors.stream()
            .filter(candidate -> !isSynthetic(candidate))
            .filter(candidate -> candidate.nodeId().equals(targetId))
            .findFirst()
            .orElse(null);
    if (ancestor == null) {
      warnings.add(
          warning(
              WorkflowIssueCodes.TEMPLATE_UNKNOWN_NODE,
              "Placeholder '%s' refers to '%s', which is not upstream of this block"
                  .formatted(placeholder, targetId),
              nodeId));
      return new Unresolved(placeholder);
    }

    String field = path.size() > 1 ? path.get(1) : AncestorInfo.DEFAULT_FIELD;
    if (!ancestor.exposes(field)) {
      warnings.add(
          warning(
              WorkflowIssueCodes.TEMPLATE_UNKNOWN_FIELD,
              "Placeholder '%s' uses field '%s', but '%s' exposes %s"
                  .formatted(placeholder, field, targetId, ancestor.fields()),
              nodeId));
      return new Unresolved(placeholder);
    }

    List<String> accessPath = new ArrayList<>();
    accessPath.add(field);
    accessPath.addAll(path.subList(Math.min(2, path.size()), path.size()));
    return new Reference(placeholder, names.accessor(targetId, accessPath));
  }

  private static boolean isSynthetic(AncestorInfo ancestor) {
    return AncestorInfo.INPUT_ID.equals(ancestor.nodeId()) && ancestor.fields().isEmpty();
  }

  private static void flush(StringBuilder literal, List<TemplatePart> parts) {
    if (literal.length() > 0) {
      parts.add(new Literal(literal.toString()));
      literal.setLength(0);
    }
  }

  private static CompileDiagnostic warning(String code, String message, String nodeId) {
    return CompileDiagnostic.warning(code, message, nodeId);
  }
}
