package com.aiadvent.canvas.graph;

/**
 * Bounded loop. {@code maxIterations} below one is kept as given so that validation can report it
 * instead of silently clamping.
 */
public record FeedbackLoopConfig(int maxIterations, String stopCondition) implements NodeConfig {

  public FeedbackLoopConfig {
    stopCondition = stopCondition != null ? stopCondition.trim() : "";
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FEEDBACK_LOOP;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitFeedbackLoop(this);
  }
}
