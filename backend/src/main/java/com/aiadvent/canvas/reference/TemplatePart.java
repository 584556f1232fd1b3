package com.aiadvent.canvas.reference;

/** One piece of a tokenized template string. */
public sealed interface TemplatePart
    permits TemplatePart.Literal, TemplatePart.Reference, TemplatePart.Unresolved {

  /** Plain text between placeholders. */
  record Literal(String text) implements TemplatePart {}

  /** A placeholder that resolved to a Python expression. */
  record Reference(String placeholder, String expression) implements TemplatePart {}

  /** A placeholder kept verbatim because it could not be resolved. */
  record Unresolved(String placeholder) implements TemplatePart {}
}
