package com.aiadvent.canvas.reference;

import com.aiadvent.canvas.graph.NodeKind;
import com.aiadvent.canvas.graph.OutputField;
import com.aiadvent.canvas.graph.WorkflowEdge;
import com.aiadvent.canvas.graph.WorkflowGraph;
import com.aiadvent.canvas.graph.WorkflowNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Lists the blocks upstream of a node, nearest first. Works on any graph, validated or not, and
 * terminates on cycles: a node is marked visited when it is dequeued and is never queued again
 * once visited.
 */
@Component
public class AncestorResolver {

  public List<AncestorInfo> ancestorsOf(WorkflowGraph graph, String nodeId) {
    if (graph == null) {
      throw new IllegalArgumentException("Workflow graph must not be null");
    }
    List<AncestorInfo> ancestors = new ArrayList<>();
    if (nodeId != null && graph.contains(nodeId)) {
      Set<String> visited = new HashSet<>();
      Deque<String> queue = new ArrayDeque<>();
      queue.add(nodeId);
      while (!queue.isEmpty()) {
        String current = queue.poll();
        if (!visited.add(current)) {
          continue;
        }
        if (!current.equals(nodeId)) {
          ancestors.add(describe(graph.requireNode(current)));
        }
        for (WorkflowEdge edge : graph.incoming(current)) {
          String source = edge.sourceNodeId();
          if (graph.contains(source) && !visited.contains(source)) {
            queue.add(source);
          }
        }
      }
    }
    ancestors.add(AncestorInfo.workflowInput());
    return ancestors;
  }

  static List<String> fieldsOf(WorkflowNode node) {
    List<OutputField> declared = node.config().outputFields();
    if (!declared.isEmpty()) {
      return declared.stream().map(OutputField::name).distinct().toList();
    }
    if (node.kind() == NodeKind.FEEDBACK_LOOP) {
      return List.of(AncestorInfo.DEFAULT_FIELD, "iterations");
    }
    return List.of(AncestorInfo.DEFAULT_FIELD);
  }

  private static AncestorInfo describe(WorkflowNode node) {
    return new AncestorInfo(node.id(), node.label(), fieldsOf(node));
  }
}
