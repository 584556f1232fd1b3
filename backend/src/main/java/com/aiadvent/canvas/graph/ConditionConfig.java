package com.aiadvent.canvas.graph;

public record ConditionConfig(String expression, String trueLabel, String falseLabel)
    implements NodeConfig {

  public ConditionConfig {
    expression = expression != null ? expression.trim() : "";
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CONDITION;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitCondition(this);
  }
}
