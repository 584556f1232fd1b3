package com.aiadvent.canvas.reference;

import java.util.List;

/**
 * An upstream block a template may reference, with the fields it exposes. The synthetic
 * {@link #INPUT_ID} entry stands for the workflow's original input.
 */
public record AncestorInfo(String nodeId, String label, List<String> fields) {

  public static final String INPUT_ID = "input";
  public static final String INPUT_LABEL = "Workflow input";
  public static final String DEFAULT_FIELD = "output";

  public AncestorInfo {
    if (nodeId == null || nodeId.isBlank()) {
      throw new IllegalArgumentException("Ancestor nodeId must not be blank");
    }
    label = label != null && !label.isBlank() ? label : nodeId;
    fields = fields != null ? List.copyOf(fields) : List.of();
  }

  public static AncestorInfo workflowInput() {
    return new AncestorInfo(INPUT_ID, INPUT_LABEL, List.of());
  }

  public boolean exposes(String field) {
    return fields.contains(field);
  }
}
