package com.aiadvent.canvas.graph;

public record TriggerConfig(TriggerType triggerType, String cronExpression, String webhookPath)
    implements NodeConfig {

  public TriggerConfig {
    triggerType = triggerType != null ? triggerType : TriggerType.MANUAL;
  }

  public static TriggerConfig manual() {
    return new TriggerConfig(TriggerType.MANUAL, null, null);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TRIGGER;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitTrigger(this);
  }

  public enum TriggerType {
    MANUAL,
    CRON,
    WEBHOOK
  }
}
