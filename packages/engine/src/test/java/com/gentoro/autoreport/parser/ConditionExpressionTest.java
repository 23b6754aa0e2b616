package com.gentoro.autoreport.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConditionExpressionTest {

  @Test
  @DisplayName("numeric comparisons accept numbers and numeric strings")
  void numericComparison() {
    ConditionExpression e = ConditionExpression.parse("销售额 > 1000");
    assertTrue(e.evaluate(Map.of("销售额", 1500)));
    assertTrue(e.evaluate(Map.of("销售额", "2000.5")));
    assertFalse(e.evaluate(Map.of("销售额", 1000)));
  }

  @Test
  @DisplayName("AND binds tighter than OR")
  void precedence() {
    ConditionExpression e = ConditionExpression.parse("a == 1 || b == 1 && c == 1");
    assertTrue(e.evaluate(Map.of("a", 1, "b", 0, "c", 0)));
    assertFalse(e.evaluate(Map.of("a", 0, "b", 1, "c", 0)));
  }

  @Test
  @DisplayName("parentheses group sub-expressions")
  void grouping() {
    ConditionExpression e = ConditionExpression.parse("(level == 'A' || level == 'B') && active");
    assertTrue(e.evaluate(Map.of("level", "B", "active", true)));
    assertFalse(e.evaluate(Map.of("level", "B", "active", false)));
    assertFalse(e.evaluate(Map.of("level", "C", "active", true)));
  }

  @Test
  @DisplayName("missing variables are null and falsy")
  void missingVariable() {
    assertFalse(ConditionExpression.parse("enabled").evaluate(Map.of()));
    assertFalse(ConditionExpression.parse("x > 3").evaluate(Map.of()));
    assertTrue(ConditionExpression.parse("x == null").evaluate(Map.of()));
  }

  @Test
  @DisplayName("string equality with Chinese literals")
  void chineseStrings() {
    ConditionExpression e = ConditionExpression.parse("region == \"华东\"");
    assertTrue(e.evaluate(Map.of("region", "华东")));
    assertFalse(e.evaluate(Map.of("region", "华南")));
  }

  @Test
  @DisplayName("invalid syntax is rejected at parse time")
  void invalidSyntax() {
    assertThrows(IllegalArgumentException.class, () -> ConditionExpression.parse("a >"));
    assertThrows(IllegalArgumentException.class, () -> ConditionExpression.parse("(a == 1"));
    assertThrows(IllegalArgumentException.class, () -> ConditionExpression.parse("a; drop"));
  }
}
