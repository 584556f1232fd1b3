package com.aiadvent.canvas.plan;

import com.aiadvent.canvas.graph.MergeStrategy;
import java.util.List;

/** Structured control flow synthesized from the graph; each node id is owned by exactly one block. */
public sealed interface Block
    permits Block.Seq,
        Block.Branch,
        Block.Fan,
        Block.Loop,
        Block.Steps,
        Block.Ref,
        Block.Exit,
        Block.Guarded,
        Block.End {

  /** A single node followed by the rest of the run. */
  record Seq(String nodeId, Block next) implements Block {}

  record Branch(String conditionNodeId, Block onTrue, Block onFalse, Block next) implements Block {}

  /** Parallel fan-out; {@code branches} follow the order of the output slots. */
  record Fan(String parallelNodeId, List<Block> branches, MergeStrategy mergeStrategy, Block next)
      implements Block {

    public Fan {
      branches = List.copyOf(branches);
    }
  }

  record Loop(String loopNodeId, Block body, int maxIterations, String stopCondition, Block next)
      implements Block {}

  /** Blocks run one after another. */
  record Steps(List<Block> blocks) implements Block {

    public Steps {
      blocks = List.copyOf(blocks);
    }
  }

  /** A node already scheduled elsewhere in the plan. */
  record Ref(String nodeId) implements Block {}

  /** Leaves the enclosing feedback loop; a condition arm whose target lies outside the body. */
  record Exit(String loopNodeId) implements Block {}

  /**
   * Runs {@code body} only when the condition last took the given arm. Used after a loop for the
   * blocks a condition arm exited to.
   */
  record Guarded(String conditionNodeId, boolean whenTrue, Block body) implements Block {}

  record End() implements Block {

    public static final End INSTANCE = new End();
  }
}
