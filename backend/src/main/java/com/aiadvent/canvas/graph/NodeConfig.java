package com.aiadvent.canvas.graph;

import java.util.List;

/**
 * Kind-specific configuration of a canvas block. The set of implementations is closed so that
 * every consumer dispatching through {@link NodeConfigVisitor} handles all kinds.
 */
public sealed interface NodeConfig
    permits TriggerConfig,
        AgentConfig,
        ToolCallConfig,
        ConditionConfig,
        ParallelConfig,
        FeedbackLoopConfig,
        RetrievalConfig,
        MultiAgentTeamConfig {

  NodeKind kind();

  <R> R accept(NodeConfigVisitor<R> visitor);

  /** Fields downstream blocks may reference; empty means only the generic {@code output}. */
  default List<OutputField> outputFields() {
    return List.of();
  }

  /** Human readable name shown next to the node id, or {@code null}. */
  default String displayName() {
    return null;
  }
}
