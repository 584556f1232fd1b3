package com.aiadvent.canvas.graph;

public record ParallelConfig(MergeStrategy mergeStrategy) implements NodeConfig {

  public ParallelConfig {
    mergeStrategy = mergeStrategy != null ? mergeStrategy : MergeStrategy.ALL;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PARALLEL;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitParallel(this);
  }
}
