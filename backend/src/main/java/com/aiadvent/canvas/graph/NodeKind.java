package com.aiadvent.canvas.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum NodeKind {
  TRIGGER("trigger"),
  AGENT("agent"),
  TOOL_CALL("mcp_tool"),
  CONDITION("condition"),
  PARALLEL("parallel"),
  FEEDBACK_LOOP("feedback_loop"),
  RETRIEVAL("rag"),
  MULTI_AGENT_TEAM("multi_agent");

  private final String blockType;

  NodeKind(String blockType) {
    this.blockType = blockType;
  }

  @JsonValue
  public String blockType() {
    return blockType;
  }

  /** Accepts the editor block type ({@code mcp_tool}) as well as the enum name ({@code TOOL_CALL}). */
  public static Optional<NodeKind> fromBlockType(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (NodeKind kind : values()) {
      if (kind.blockType.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
