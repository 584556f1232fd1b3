package com.aiadvent.canvas.graph;

import java.util.List;

public record AgentConfig(
    String name,
    String role,
    String model,
    double temperature,
    int maxTokens,
    String systemPrompt,
    List<String> mcpTools,
    List<OutputField> outputFields,
    String inputTemplate)
    implements NodeConfig {

  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final int DEFAULT_MAX_TOKENS = 4096;

  public AgentConfig {
    name = name != null ? name : "";
    role = role != null ? role : "";
    model = model != null ? model : "";
    mcpTools = mcpTools != null ? List.copyOf(mcpTools) : List.of();
    outputFields = outputFields != null ? List.copyOf(outputFields) : List.of();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.AGENT;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitAgent(this);
  }

  @Override
  public String displayName() {
    return name.isBlank() ? null : name;
  }
}
