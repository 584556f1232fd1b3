package com.aiadvent.canvas.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A team of agents orchestrated by the runtime. The compiler treats the team as one opaque step;
 * members are passed through as a roster and never scheduled individually.
 */
public record MultiAgentTeamConfig(
    String name,
    TeamStrategy strategy,
    List<TeamMember> members,
    int maxRounds,
    Double costBudget,
    String coordinatorId,
    boolean enableConsult,
    int maxConsultDepth,
    String inputTemplate)
    implements NodeConfig {

  public static final int DEFAULT_MAX_ROUNDS = 10;

  public MultiAgentTeamConfig {
    name = name != null ? name : "";
    strategy = strategy != null ? strategy : TeamStrategy.COORDINATOR;
    members = members != null ? List.copyOf(members) : List.of();
    maxRounds = maxRounds > 0 ? maxRounds : DEFAULT_MAX_ROUNDS;
    maxConsultDepth = maxConsultDepth > 0 ? maxConsultDepth : 1;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.MULTI_AGENT_TEAM;
  }

  @Override
  public <R> R accept(NodeConfigVisitor<R> visitor) {
    return visitor.visitMultiAgentTeam(this);
  }

  @Override
  public String displayName() {
    return name.isBlank() ? null : name;
  }

  public record TeamMember(
      String id,
      String name,
      String role,
      String model,
      String systemPrompt,
      List<String> capabilities,
      double temperature,
      List<String> mcpTools) {

    public TeamMember {
      id = id != null ? id : "";
      name = name != null ? name : "";
      role = role != null ? role : "worker";
      model = model != null ? model : "";
      systemPrompt = systemPrompt != null ? systemPrompt : "";
      capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
      mcpTools = mcpTools != null ? List.copyOf(mcpTools) : List.of();
    }
  }

  public enum TeamStrategy {
    COORDINATOR,
    ROUND_ROBIN,
    DEBATE,
    MAP_REDUCE;

    @JsonValue
    public String jsonValue() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TeamStrategy> parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return Optional.of(COORDINATOR);
      }
      String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      for (TeamStrategy strategy : values()) {
        if (strategy.name().equals(normalized)) {
          return Optional.of(strategy);
        }
      }
      return Optional.empty();
    }
  }
}
