package com.aiadvent.canvas.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Canvas node as sent by the editor. {@code type} carries the block type ({@code agent},
 * {@code mcp_tool}, {@code rag}, ...); {@code kind} is accepted as an alias.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowNodeDto(String id, String type, String kind, JsonNode data) {

  public String resolvedType() {
    return type != null && !type.isBlank() ? type : kind;
  }
}
