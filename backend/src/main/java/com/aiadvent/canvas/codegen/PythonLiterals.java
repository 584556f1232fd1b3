package com.aiadvent.canvas.codegen;

import com.aiadvent.canvas.reference.ResolvedTemplate;
import com.aiadvent.canvas.reference.TemplatePart;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Renders Java values as Python source literals. */
final class PythonLiterals {

  private PythonLiterals() {
    throw new AssertionError("Utility class");
  }

  static String string(String value) {
    if (value == null) {
      return "None";
    }
    StringBuilder builder = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> builder.append("\\\\");
        case '"' -> builder.append("\\\"");
        case '\n' -> builder.append("\\n");
        case '\r' -> builder.append("\\r");
        case '\t' -> builder.append("\\t");
        default -> {
          if (c < 0x20 || c == 0x7f) {
            builder.append(String.format("\\x%02x", (int) c));
          } else {
            builder.append(c);
          }
        }
      }
    }
    return builder.append('"').toString();
  }

  static String bool(boolean value) {
    return value ? "True" : "False";
  }

  static String number(double value) {
    if (Double.isNaN(value)) {
      return "float(\"nan\")";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "float(\"inf\")" : "float(\"-inf\")";
    }
    return Double.toString(value);
  }

  static String stringList(List<String> values) {
    List<String> rendered = new ArrayList<>(values.size());
    for (String value : values) {
      rendered.add(string(value));
    }
    return "[" + String.join(", ", rendered) + "]";
  }

  /**
   * Expression producing the template's text at runtime. A template that is a single resolved
   * reference yields the accessor itself; mixed content becomes a concatenation with {@code str()}
   * around every reference.
   */
  static String template(ResolvedTemplate template) {
    List<TemplatePart> parts = template.parts();
    if (parts.isEmpty()) {
      return "\"\"";
    }
    if (parts.size() == 1 && parts.get(0) instanceof TemplatePart.Reference reference) {
      return reference.expression();
    }
    if (!template.hasReferences()) {
      return string(template.expression());
    }
    List<String> pieces = new ArrayList<>();
    StringBuilder pending = new StringBuilder();
    for (TemplatePart part : parts) {
      if (part instanceof TemplatePart.Reference reference) {
        if (pending.length() > 0) {
          pieces.add(string(pending.toString()));
          pending.setLength(0);
        }
        pieces.add("str(" + reference.expression() + ")");
      } else if (part instanceof TemplatePart.Literal literal) {
        pending.append(literal.text());
      } else if (part instanceof TemplatePart.Unresolved unresolved) {
        pending.append(unresolved.placeholder());
      }
    }
    if (pending.length() > 0) {
      pieces.add(string(pending.toString()));
    }
    return String.join(" + ", pieces);
  }

  /** JSON value as a Python literal; string leaves go through {@code strings}. */
  static String json(JsonNode node, Function<String, String> strings) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return "None";
    }
    if (node.isTextual()) {
      return strings.apply(node.asText());
    }
    if (node.isBoolean()) {
      return bool(node.asBoolean());
    }
    if (node.isNumber()) {
      return node.isIntegralNumber() ? node.asText() : number(node.asDouble());
    }
    if (node.isArray()) {
      List<String> items = new ArrayList<>();
      for (JsonNode item : node) {
        items.add(json(item, strings));
      }
      return "[" + String.join(", ", items) + "]";
    }
    List<String> entries = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      entries.add(string(field.getKey()) + ": " + json(field.getValue(), strings));
    }
    return "{" + String.join(", ", entries) + "}";
  }
}
