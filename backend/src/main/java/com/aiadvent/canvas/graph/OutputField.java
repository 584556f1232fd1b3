package com.aiadvent.canvas.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record OutputField(String name, Type type, String description) {

  public OutputField {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Output field name must not be blank");
    }
    name = name.trim();
    type = type != null ? type : Type.TEXT;
  }

  public enum Type {
    TEXT,
    NUMBER,
    BOOLEAN,
    LIST;

    @JsonValue
    public String jsonValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
