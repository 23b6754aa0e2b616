package com.gentoro.autoreport.parser;

/** Value of a placeholder parameter. */
public sealed interface ParameterValue {

  /** Markup form of the value, as it would appear after {@code KEY=}. */
  String markup();

  /** Plain text value. */
  record Text(String value) implements ParameterValue {
    @Override
    public String markup() {
      return value;
    }
  }

  /** Value given by another placeholder; owned exclusively by the enclosing spec. */
  record Nested(PlaceholderSpec spec) implements ParameterValue {
    @Override
    public String markup() {
      return PlaceholderSerializer.toMarkup(spec);
    }
  }

  /**
   * Boolean condition over named variables. {@code expression} is null when the source text failed
   * to parse; the failure is reported as a {@link ParseError} on the owning spec.
   */
  record Condition(String source, ConditionExpression expression) implements ParameterValue {
    @Override
    public String markup() {
      return source;
    }

    public boolean isValid() {
      return expression != null;
    }
  }
}
