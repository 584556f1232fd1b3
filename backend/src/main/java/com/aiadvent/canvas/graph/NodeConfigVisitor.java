package com.aiadvent.canvas.graph;

public interface NodeConfigVisitor<R> {

  R visitTrigger(TriggerConfig config);

  R visitAgent(AgentConfig config);

  R visitToolCall(ToolCallConfig config);

  R visitCondition(ConditionConfig config);

  R visitParallel(ParallelConfig config);

  R visitFeedbackLoop(FeedbackLoopConfig config);

  R visitRetrieval(RetrievalConfig config);

  R visitMultiAgentTeam(MultiAgentTeamConfig config);
}
