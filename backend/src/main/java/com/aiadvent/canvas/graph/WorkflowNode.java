package com.aiadvent.canvas.graph;

public record WorkflowNode(String id, NodeKind kind, NodeConfig config) {

  public WorkflowNode {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node id must not be blank");
    }
    if (config == null) {
      throw new IllegalArgumentException("Node '" + id + "' must define its configuration");
    }
    if (kind == null) {
      kind = config.kind();
    } else if (kind != config.kind()) {
      throw new IllegalArgumentException(
          "Node '%s' declares kind %s but carries %s configuration"
              .formatted(id, kind, config.kind()));
    }
  }

  public WorkflowNode(String id, NodeConfig config) {
    this(id, null, config);
  }

  public String label() {
    String name = config.displayName();
    return name != null && !name.isBlank() ? name : id;
  }
}
