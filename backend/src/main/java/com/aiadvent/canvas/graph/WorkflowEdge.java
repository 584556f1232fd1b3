package com.aiadvent.canvas.graph;

/**
 * Directed link between two blocks. {@code branchLabel} is only meaningful on edges leaving a
 * condition, {@code outputSlot} only on edges leaving a parallel block.
 */
public record WorkflowEdge(
    String id, String sourceNodeId, String targetNodeId, String branchLabel, String outputSlot) {

  public static final String TRUE_BRANCH = "true";
  public static final String FALSE_BRANCH = "false";

  public WorkflowEdge {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Edge id must not be blank");
    }
    if (sourceNodeId == null || sourceNodeId.isBlank()) {
      throw new IllegalArgumentException("Edge '" + id + "' must define sourceNodeId");
    }
    if (targetNodeId == null || targetNodeId.isBlank()) {
      throw new IllegalArgumentException("Edge '" + id + "' must define targetNodeId");
    }
    branchLabel = blankToNull(branchLabel);
    outputSlot = blankToNull(outputSlot);
  }

  public static WorkflowEdge of(String id, String sourceNodeId, String targetNodeId) {
    return new WorkflowEdge(id, sourceNodeId, targetNodeId, null, null);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
