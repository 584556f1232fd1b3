package com.aiadvent.canvas.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowEdgeDto(
    String id,
    String source,
    String target,
    String sourceNodeId,
    String targetNodeId,
    String sourceHandle,
    String branchLabel,
    String outputSlot,
    JsonNode data) {

  public String resolvedSource() {
    return sourceNodeId != null && !sourceNodeId.isBlank() ? sourceNodeId : source;
  }

  public String resolvedTarget() {
    return targetNodeId != null && !targetNodeId.isBlank() ? targetNodeId : target;
  }
}
