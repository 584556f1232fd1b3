package com.aiadvent.canvas.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * How a parallel fan-out combines its branches. {@code ALL} awaits every branch and keeps their
 * results in slot order; {@code FIRST} is a race won by whichever branch completes first.
 */
public enum MergeStrategy {
  ALL,
  FIRST;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<MergeStrategy> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(ALL);
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "all", "concat" -> Optional.of(ALL);
      case "first" -> Optional.of(FIRST);
      default -> Optional.empty();
    };
  }
}
