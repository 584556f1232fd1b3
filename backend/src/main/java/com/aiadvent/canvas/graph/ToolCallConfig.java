package com.aiadvent.canvas.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;

/** MCP tool invocation. Every string leaf inside {@code parameters} is a template. */
public record ToolCallConfig(
    String serverId,
    String serverName,
    String toolName,
    String description,
    JsonNode parameters,
    List<OutputField> outputFields)
    implements NodeConfig {

  public ToolCallConfig {
    if (toolName == null || toolName.isBlank()) {
      throw new IllegalArgumentException("Tool call must define toolName");
    }
    serverId = serverId != null ? serverId : "";
    serverName = serverName != null ? serverName : "";
    description = description != null ? description : "";
    parameters =
        parameters != null && parameters.isObject()
            ? parameters.deepCopy()
            : JsonNodeFactory.instance.objectNode();
    outputFields = outputFields != null ? List.copyOf(outputFields) : List.of();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TOOL_CALL;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitToolCall(this);
  }

  @Override
  public String displayName() {
    return toolName;
  }
}
