package com.aiadvent.canvas.graph;

import com.aiadvent.canvas.api.CompileDiagnostic;
import com.aiadvent.canvas.api.WorkflowEdgeDto;
import com.aiadvent.canvas.api.WorkflowNodeDto;
import com.aiadvent.canvas.graph.MultiAgentTeamConfig.TeamMember;
import com.aiadvent.canvas.graph.MultiAgentTeamConfig.TeamStrategy;
import com.aiadvent.canvas.graph.TriggerConfig.TriggerType;
import com.aiadvent.canvas.validation.WorkflowGraphParsingException;
import com.aiadvent.canvas.validation.WorkflowIssueCodes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts the editor payload into the typed {@link WorkflowGraph}. Every entry is checked; all
 * contract violations found are thrown together in one {@link WorkflowGraphParsingException}.
 */
@Component
public class WorkflowGraphMapper {

  private final ObjectMapper objectMapper;

  public WorkflowGraphMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public WorkflowGraph toGraph(List<WorkflowNodeDto> nodeDtos, List<WorkflowEdgeDto> edgeDtos) {
    List<WorkflowNodeDto> sourceNodes = nodeDtos != null ? nodeDtos : List.of();
    List<WorkflowEdgeDto> sourceEdges = edgeDtos != null ? edgeDtos : List.of();
    List<CompileDiagnostic> issues = new ArrayList<>();

    List<WorkflowNode> nodes = new ArrayList<>();
    Map<String, NodeKind> kindsById = new HashMap<>();
    for (int index = 0; index < sourceNodes.size(); index++) {
      WorkflowNode node = parseNode(sourceNodes.get(index), index, issues);
      if (node != null) {
        nodes.add(node);
        kindsById.putIfAbsent(node.id(), node.kind());
      }
    }

    List<WorkflowEdge> edges = new ArrayList<>();
    for (int index = 0; index < sourceEdges.size(); index++) {
      WorkflowEdge edge = parseEdge(sourceEdges.get(index), index, kindsById, issues);
      if (edge != null) {
        edges.add(edge);
      }
    }

    if (!issues.isEmpty()) {
      throw new WorkflowGraphParsingException(issues);
    }
    return new WorkflowGraph(nodes, edges);
  }

  private WorkflowNode parseNode(WorkflowNodeDto dto, int index, List<CompileDiagnostic> issues) {
    if (dto == null) {
      issues.add(issue(WorkflowIssueCodes.NODE_NULL, "nodes[%d] must not be null".formatted(index), null));
      return null;
    }
    String id = trimToNull(dto.id());
    if (id == null) {
      issues.add(issue(WorkflowIssueCodes.NODE_ID_MISSING, "nodes[%d].id must not be blank".formatted(index), null));
      return null;
    }
    String rawType = dto.resolvedType();
    NodeKind kind = NodeKind.fromBlockType(rawType).orElse(null);
    if (kind == null) {
      issues.add(
          issue(
              WorkflowIssueCodes.NODE_TYPE_UNSUPPORTED,
              rawType == null || rawType.isBlank()
                  ? "Node '%s' must define its type".formatted(id)
                  : "Node '%s' has unsupported type '%s'".formatted(id, rawType),
              id));
      return null;
    }
    JsonNode data = dto.data() != null ? dto.data() : MissingNode.getInstance();
    try {
      return new WorkflowNode(id, kind, parseConfig(kind, id, data));
    } catch (IllegalArgumentException ex) {
      issues.add(issue(WorkflowIssueCodes.NODE_CONFIG_INVALID, "Node '%s': %s".formatted(id, ex.getMessage()), id));
      return null;
    }
  }

  private NodeConfig parseConfig(NodeKind kind, String nodeId, JsonNode data) {
    return switch (kind) {
      case TRIGGER -> new TriggerConfig(
          parseTriggerType(text(data, "triggerType")),
          text(data, "cronExpression"),
          text(data, "webhookPath"));
      case AGENT -> new AgentConfig(
          text(data, "name"),
          text(data, "role"),
          text(data, "model"),
          decimal(data, "temperature", AgentConfig.DEFAULT_TEMPERATURE),
          integer(data, "maxTokens", AgentConfig.DEFAULT_MAX_TOKENS),
          text(data, "systemPrompt"),
          strings(data, "mcpTools"),
          outputFields(data),
          text(data, "inputTemplate"));
      case TOOL_CALL -> {
        if (trimToNull(text(data, "toolName")) == null) {
          throw new IllegalArgumentException("toolName is required");
        }
        yield new ToolCallConfig(
            text(data, "serverId"),
            text(data, "serverName"),
            text(data, "toolName"),
            text(data, "description"),
            data.path("parameters"),
            outputFields(data));
      }
      case CONDITION -> new ConditionConfig(
          firstNonNull(text(data, "expression"), text(data, "condition")),
          text(data, "trueLabel"),
          text(data, "falseLabel"));
      case PARALLEL -> {
        String raw = text(data, "mergeStrategy");
        yield new ParallelConfig(
            MergeStrategy.parse(raw)
                .orElseThrow(() -> new IllegalArgumentException("unsupported mergeStrategy '" + raw + "'")));
      }
      case FEEDBACK_LOOP -> {
        JsonNode max = data.path("maxIterations");
        if (max.isMissingNode() || max.isNull()) {
          throw new IllegalArgumentException("maxIterations is required");
        }
        yield new FeedbackLoopConfig(integer(data, "maxIterations", 0), text(data, "stopCondition"));
      }
      case RETRIEVAL -> new RetrievalConfig(
          text(data, "name"),
          strings(data, "documents"),
          integer(data, "searchLimit", RetrievalConfig.DEFAULT_SEARCH_LIMIT),
          bool(data, "enableBm25", true),
          integer(data, "chunkSize", RetrievalConfig.DEFAULT_CHUNK_SIZE),
          integer(data, "chunkOverlap", RetrievalConfig.DEFAULT_CHUNK_OVERLAP),
          text(data, "systemPrompt"),
          text(data, "model"),
          decimal(data, "temperature", AgentConfig.DEFAULT_TEMPERATURE),
          integer(data, "maxTokens", AgentConfig.DEFAULT_MAX_TOKENS),
          text(data, "embeddingProvider"),
          text(data, "embeddingModel"),
          outputFields(data),
          text(data, "inputTemplate"));
      case MULTI_AGENT_TEAM -> {
        String raw = text(data, "strategy");
        TeamStrategy strategy =
            TeamStrategy.parse(raw)
                .orElseThrow(() -> new IllegalArgumentException("unsupported strategy '" + raw + "'"));
        JsonNode budget = data.path("costBudget");
        yield new MultiAgentTeamConfig(
            text(data, "name"),
            strategy,
            members(data),
            integer(data, "maxRounds", MultiAgentTeamConfig.DEFAULT_MAX_ROUNDS),
            budget.isNumber() ? budget.asDouble() : null,
            text(data, "coordinatorId"),
            bool(data, "enableConsult", false),
            integer(data, "maxConsultDepth", 1),
            text(data, "inputTemplate"));
      }
    };
  }

  private WorkflowEdge parseEdge(
      WorkflowEdgeDto dto, int index, Map<String, NodeKind> kindsById, List<CompileDiagnostic> issues) {
    if (dto == null) {
      issues.add(issue(WorkflowIssueCodes.EDGE_NULL, "edges[%d] must not be null".formatted(index), null));
      return null;
    }
    String id = trimToNull(dto.id());
    if (id == null) {
      issues.add(issue(WorkflowIssueCodes.EDGE_ID_MISSING, "edges[%d].id must not be blank".formatted(index), null));
      return null;
    }
    String source = trimToNull(dto.resolvedSource());
    String target = trimToNull(dto.resolvedTarget());
    if (source == null || target == null) {
      issues.add(
          new CompileDiagnostic(
              WorkflowIssueCodes.EDGE_ENDPOINT_MISSING,
              CompileDiagnostic.Severity.ERROR,
              "Edge '%s' must define both source and target".formatted(id),
              null,
              id));
      return null;
    }

    NodeKind sourceKind = kindsById.get(source);
    JsonNode data = dto.data() != null ? dto.data() : MissingNode.getInstance();
    String branchLabel = trimToNull(dto.branchLabel());
    if (branchLabel == null) {
      branchLabel = trimToNull(text(data, "condition"));
    }
    if (branchLabel == null && sourceKind == NodeKind.CONDITION) {
      branchLabel = trimToNull(dto.sourceHandle());
    }
    String outputSlot = trimToNull(dto.outputSlot());
    if (outputSlot == null && sourceKind == NodeKind.PARALLEL) {
      outputSlot = trimToNull(dto.sourceHandle());
    }
    return new WorkflowEdge(
        id,
        source,
        target,
        branchLabel != null ? branchLabel.toLowerCase(Locale.ROOT) : null,
        outputSlot);
  }

  private List<OutputField> outputFields(JsonNode data) {
    JsonNode array = data.path("outputFields");
    if (!array.isArray()) {
      return List.of();
    }
    List<OutputField> fields = new ArrayList<>();
    for (JsonNode element : array) {
      String name = trimToNull(text(element, "name"));
      if (name == null) {
        throw new IllegalArgumentException("outputFields entries must define a name");
      }
      fields.add(new OutputField(name, parseFieldType(text(element, "type")), text(element, "description")));
    }
    return fields;
  }

  private List<TeamMember> members(JsonNode data) {
    JsonNode array = data.path("members");
    if (!array.isArray()) {
      return List.of();
    }
    List<TeamMember> members = new ArrayList<>();
    for (JsonNode element : array) {
      members.add(
          new TeamMember(
              text(element, "id"),
              text(element, "name"),
              text(element, "role"),
              text(element, "model"),
              text(element, "systemPrompt"),
              strings(element, "capabilities"),
              decimal(element, "temperature", AgentConfig.DEFAULT_TEMPERATURE),
              strings(element, "mcpTools")));
    }
    return members;
  }

  private List<String> strings(JsonNode data, String field) {
    JsonNode array = data.path(field);
    if (array.isMissingNode() || array.isNull()) {
      return List.of();
    }
    if (!array.isArray()) {
      throw new IllegalArgumentException(field + " must be an array of strings");
    }
    List<String> values =
        objectMapper.convertValue(
            array, objectMapper.getTypeFactory().constructCollectionType(List.class, String.class));
    return values != null ? values : List.of();
  }

  private static TriggerType parseTriggerType(String raw) {
    if (raw == null || raw.isBlank()) {
      return TriggerType.MANUAL;
    }
    try {
      return TriggerType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unsupported triggerType '" + raw + "'");
    }
  }

  private static OutputField.Type parseFieldType(String raw) {
    if (raw == null || raw.isBlank()) {
      return OutputField.Type.TEXT;
    }
    try {
      return OutputField.Type.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unsupported output field type '" + raw + "'");
    }
  }

  private static String text(JsonNode data, String field) {
    JsonNode value = data.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }

  private static int integer(JsonNode data, String field, int defaultValue) {
    JsonNode value = data.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return defaultValue;
    }
    if (value.isTextual()) {
      return parseInt(value.asText(), field);
    }
    if (!value.canConvertToInt()) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
    return value.asInt();
  }

  private static double decimal(JsonNode data, String field, double defaultValue) {
    JsonNode value = data.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return defaultValue;
    }
    if (!value.isNumber()) {
      throw new IllegalArgumentException(field + " must be a number");
    }
    return value.asDouble();
  }

  private static boolean bool(JsonNode data, String field, boolean defaultValue) {
    JsonNode value = data.path(field);
    return value.isBoolean() ? value.asBoolean() : defaultValue;
  }

  private static int parseInt(String raw, String field) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
  }

  private static String firstNonNull(String first, String second) {
    return first != null ? first : second;
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static CompileDiagnostic issue(String code, String message, String nodeId) {
    return CompileDiagnostic.error(code, message, nodeId, null);
  }
}
