package com.gentoro.autoreport.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SyntaxValidatorTest {

  private final PlaceholderParser parser = new PlaceholderParser();

  private static boolean hasKind(PlaceholderSpec spec, ParseErrorKind kind) {
    return spec.errors().stream().anyMatch(e -> e.kind() == kind);
  }

  @Test
  @DisplayName("repeated parameter key is reported once")
  void duplicateKey() {
    PlaceholderSpec spec = parser.parseOne("{{统计：销售额|地区=华东|地区=华南|地区=华北}}");
    assertTrue(spec.hasError());
    assertEquals(
        1,
        spec.errors().stream()
            .filter(e -> e.kind() == ParseErrorKind.DUPLICATE_PARAMETER)
            .count());
  }

  @Test
  @DisplayName("empty key and empty value are both errors")
  void emptyParameters() {
    assertTrue(hasKind(parser.parseOne("{{统计：销售额|=2024}}"), ParseErrorKind.EMPTY_PARAMETER));
    assertTrue(hasKind(parser.parseOne("{{统计：销售额|地区=}}"), ParseErrorKind.EMPTY_PARAMETER));
  }

  @Test
  @DisplayName("segment without '=' is a malformed parameter")
  void malformedParameter() {
    assertTrue(
        hasKind(parser.parseOne("{{统计：销售额|华东}}"), ParseErrorKind.MALFORMED_PARAMETER));
  }

  @Test
  @DisplayName("condition that cannot be parsed or names no variable is invalid")
  void invalidConditions() {
    assertTrue(
        hasKind(parser.parseOne("{{统计：销售额|条件=a >}}"), ParseErrorKind.INVALID_CONDITION));
    assertTrue(
        hasKind(parser.parseOne("{{统计：销售额|条件=1 < 2}}"), ParseErrorKind.INVALID_CONDITION));
  }

  @Test
  @DisplayName("broken nested spec marks its parent")
  void nestedError() {
    PlaceholderSpec spec = parser.parseOne("{{统计：销售额|时间范围={{魔法：x}}}}");
    assertTrue(hasKind(spec, ParseErrorKind.NESTED_ERROR));
    assertTrue(spec.children().get(0).hasError());
  }

  @Test
  @DisplayName("valid spec passes through unchanged")
  void validSpec() {
    PlaceholderSpec spec = parser.parseOne("{{列表：客户|数量=10|排序=desc}}");
    assertFalse(spec.hasError());
    assertEquals(spec, new SyntaxValidator().validate(spec));
  }
}
