package com.aiadvent.canvas.codegen;

/** Line-oriented builder for Python source with a fixed indentation unit. */
final class PythonSourceWriter {

  private final StringBuilder out = new StringBuilder();
  private final String unit;
  private int level;

  PythonSourceWriter(int indentWidth, int initialLevel) {
    if (indentWidth < 1) {
      throw new IllegalArgumentException("Indent width must be positive");
    }
    this.unit = " ".repeat(indentWidth);
    this.level = initialLevel;
  }

  PythonSourceWriter line(String text) {
    out.append(unit.repeat(level)).append(text).append('\n');
    return this;
  }

  PythonSourceWriter blank() {
    out.append('\n');
    return this;
  }

  PythonSourceWriter indent() {
    level++;
    return this;
  }

  PythonSourceWriter dedent() {
    if (level == 0) {
      throw new IllegalStateException("Cannot dedent below column zero");
    }
    level--;
    return this;
  }

  /** Appends source produced by another writer verbatim. */
  PythonSourceWriter append(PythonSourceWriter other) {
    out.append(other.out);
    return this;
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
