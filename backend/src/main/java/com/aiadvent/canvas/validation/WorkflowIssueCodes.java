package com.aiadvent.canvas.validation;

public final class WorkflowIssueCodes {

  public static final String GRAPH_MALFORMED = "GRAPH_MALFORMED";
  public static final String GRAPH_TOO_LARGE = "GRAPH_TOO_LARGE";
  public static final String NODE_NULL = "NODE_NULL";
  public static final String NODE_ID_MISSING = "NODE_ID_MISSING";
  public static final String NODE_DUPLICATE = "NODE_DUPLICATE";
  public static final String NODE_TYPE_UNSUPPORTED = "NODE_TYPE_UNSUPPORTED";
  public static final String NODE_CONFIG_INVALID = "NODE_CONFIG_INVALID";
  public static final String NODE_UNREACHABLE = "NODE_UNREACHABLE";
  public static final String EDGE_NULL = "EDGE_NULL";
  public static final String EDGE_ID_MISSING = "EDGE_ID_MISSING";
  public static final String EDGE_ENDPOINT_MISSING = "EDGE_ENDPOINT_MISSING";
  public static final String EDGE_DUPLICATE = "EDGE_DUPLICATE";
  public static final String EDGE_DANGLING = "EDGE_DANGLING";
  public static final String TRIGGER_MISSING = "TRIGGER_MISSING";
  public static final String TRIGGER_DUPLICATE = "TRIGGER_DUPLICATE";
  public static final String TRIGGER_HAS_INCOMING = "TRIGGER_HAS_INCOMING";
  public static final String CONDITION_EDGE_COUNT = "CONDITION_EDGE_COUNT";
  public static final String CONDITION_BRANCH_LABEL = "CONDITION_BRANCH_LABEL";
  public static final String CONDITION_EXPRESSION_EMPTY = "CONDITION_EXPRESSION_EMPTY";
  public static final String PARALLEL_EDGE_COUNT = "PARALLEL_EDGE_COUNT";
  public static final String PARALLEL_SLOT_MISSING = "PARALLEL_SLOT_MISSING";
  public static final String PARALLEL_SLOT_DUPLICATE = "PARALLEL_SLOT_DUPLICATE";
  public static final String LOOP_BOUND_INVALID = "LOOP_BOUND_INVALID";
  public static final String LOOP_WITHOUT_BODY = "LOOP_WITHOUT_BODY";
  public static final String LOOP_EXIT_DEFERRED = "LOOP_EXIT_DEFERRED";
  public static final String ACCIDENTAL_CYCLE = "ACCIDENTAL_CYCLE";
  public static final String BRANCH_JOIN = "BRANCH_JOIN";
  public static final String TEMPLATE_UNKNOWN_NODE = "TEMPLATE_UNKNOWN_NODE";
  public static final String TEMPLATE_UNKNOWN_FIELD = "TEMPLATE_UNKNOWN_FIELD";
  public static final String TEMPLATE_MALFORMED = "TEMPLATE_MALFORMED";

  private WorkflowIssueCodes() {
    throw new AssertionError("Utility class");
  }
}
