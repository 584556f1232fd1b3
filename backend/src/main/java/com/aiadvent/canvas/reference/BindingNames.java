package com.aiadvent.canvas.reference;

import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Python identifiers for every node of a graph. Names are derived from node ids only and
 * collisions are broken in id order, so the mapping does not depend on the order of the input.
 */
public final class BindingNames {

  public static final String ENTRY_VALUE = "input_text";

  private static final String BINDING_PREFIX = "out_";

  private final Map<String, String> suffixes;

  private BindingNames(Map<String, String> suffixes) {
    this.suffixes = Collections.unmodifiableMap(suffixes);
  }

  public static BindingNames of(WorkflowGraph graph) {
    List<String> ids = graph.nodes().stream().map(WorkflowNode::id).sorted().toList();
    Map<String, String> suffixes = new HashMap<>();
    Set<String> used = new HashSet<>();
    for (String id : ids) {
      String base = sanitize(id);
      String candidate = base;
      int counter = 2;
      while (!used.add(candidate)) {
        candidate = base + "_" + counter++;
      }
      suffixes.put(id, candidate);
    }
    return new BindingNames(suffixes);
  }

  /** Identifier-safe form of a node id: every character outside {@code [A-Za-z0-9_]} becomes {@code _}. */
  static String sanitize(String nodeId) {
    StringBuilder builder = new StringBuilder(nodeId.length());
    for (int i = 0; i < nodeId.length(); i++) {
      char c = nodeId.charAt(i);
      boolean safe = c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
      builder.append(safe ? c : '_');
    }
    return builder.toString();
  }

  /** Unique suffix used for every identifier derived from the node ({@code out_}, {@code branch_}, ...). */
  public String suffix(String nodeId) {
    String suffix = suffixes.get(nodeId);
    if (suffix == null) {
      throw new IllegalArgumentException("No binding for node: " + nodeId);
    }
    return suffix;
  }

  public String binding(String nodeId) {
    return BINDING_PREFIX + suffix(nodeId);
  }

  public String accessor(String nodeId, List<String> path) {
    StringBuilder builder = new StringBuilder(binding(nodeId));
    for (String segment : path) {
      builder.append("['").append(segment).append("']");
    }
    return builder.toString();
  }
}
