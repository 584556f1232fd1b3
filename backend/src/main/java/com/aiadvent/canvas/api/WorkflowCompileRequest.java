package com.aiadvent.canvas.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowCompileRequest(List<WorkflowNodeDto> nodes, List<WorkflowEdgeDto> edges) {

  public WorkflowCompileRequest {
    nodes = nodes != null ? nodes : List.of();
    edges = edges != null ? edges : List.of();
  }
}
