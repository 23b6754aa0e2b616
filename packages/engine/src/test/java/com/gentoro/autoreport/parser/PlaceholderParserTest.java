package com.gentoro.autoreport.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlaceholderParserTest {

  private final PlaceholderParser parser = new PlaceholderParser();

  @Test
  @DisplayName("basic placeholder yields type and name")
  void basic() {
    PlaceholderSpec spec = parser.parseOne("{{统计：销售额}}");
    assertFalse(spec.hasError());
    assertEquals(PlaceholderType.STATISTIC, spec.type());
    assertEquals("销售额", spec.name());
    assertEquals(SyntaxKind.BASIC, spec.kind());
    assertEquals(1, spec.depth());
    assertNotNull(spec.contentHash());
  }

  @Test
  @DisplayName("parameters are kept in source order")
  void parameterized() {
    PlaceholderSpec spec = parser.parseOne("{{趋势：订单数|时间范围=2024|粒度=月}}");
    assertEquals(SyntaxKind.PARAMETERIZED, spec.kind());
    assertEquals(
        List.of("时间范围", "粒度"), spec.parameters().stream().map(Parameter::key).toList());
    assertEquals("2024", spec.textParameter("时间范围").orElseThrow());
  }

  @Test
  @DisplayName("English aliases and ASCII colon are accepted")
  void aliases() {
    PlaceholderSpec spec = parser.parseOne("{{Trend:revenue}}");
    assertFalse(spec.hasError(), () -> spec.errors().toString());
    assertEquals(PlaceholderType.TREND, spec.type());
    assertEquals("revenue", spec.name());
  }

  @Test
  @DisplayName("composite placeholder nests the inner spec one level deeper")
  void composite() {
    PlaceholderSpec spec = parser.parseOne("{{统计：{{区域：华东}}|时间范围=2024-01}}");
    assertFalse(spec.hasError(), () -> spec.errors().toString());
    assertEquals(SyntaxKind.COMPOSITE, spec.kind());
    assertNotNull(spec.nested());
    assertEquals(PlaceholderType.REGION, spec.nested().type());
    assertEquals(2, spec.nested().depth());
    assertEquals("华东", spec.displayName());
    assertEquals(1, spec.children().size());
  }

  @Test
  @DisplayName("nested placeholder in a parameter value becomes a child")
  void nestedParameter() {
    PlaceholderSpec spec = parser.parseOne("{{统计：销售额|时间范围={{周期：上月}}}}");
    assertFalse(spec.hasError(), () -> spec.errors().toString());
    assertEquals(SyntaxKind.COMPOSITE, spec.kind());
    assertInstanceOf(ParameterValue.Nested.class, spec.parameters().get(0).value());
    assertEquals(PlaceholderType.PERIOD, spec.children().get(0).type());
  }

  @Test
  @DisplayName("condition parameter is parsed into an expression")
  void conditional() {
    PlaceholderSpec spec = parser.parseOne("{{统计：利润|条件=region == \"华东\" && month >= 6}}");
    assertFalse(spec.hasError(), () -> spec.errors().toString());
    assertEquals(SyntaxKind.CONDITIONAL, spec.kind());
    ParameterValue.Condition condition = spec.condition().orElseThrow();
    assertTrue(condition.isValid());
    assertEquals(Set.of("region", "month"), condition.expression().variables());
  }

  @Test
  @DisplayName("'||' and quoted pipes stay inside the condition value")
  void conditionWithOr() {
    PlaceholderSpec spec =
        parser.parseOne("{{统计：利润|条件=month >= 6 || region == \"华东\"|时间范围=2024}}");
    assertFalse(spec.hasError(), () -> spec.errors().toString());
    assertEquals(SyntaxKind.CONDITIONAL, spec.kind());
    assertEquals(2, spec.parameters().size());
    ConditionExpression expression = spec.condition().orElseThrow().expression();
    assertTrue(expression.evaluate(Map.of("month", 3, "region", "华东")));
    assertTrue(expression.evaluate(Map.of("month", 7, "region", "华南")));
    assertFalse(expression.evaluate(Map.of("month", 3, "region", "华南")));

    PlaceholderSpec quoted = parser.parseOne("{{统计：利润|条件=region == \"a|b\"}}");
    assertFalse(quoted.hasError(), () -> quoted.errors().toString());
    assertTrue(quoted.condition().orElseThrow().expression().evaluate(Map.of("region", "a|b")));

    PlaceholderSpec again = parser.parseOne(PlaceholderSerializer.toMarkup(spec));
    assertEquals(spec.contentHash(), again.contentHash());
  }

  @Test
  @DisplayName("unknown type produces a typed error on a stub")
  void unknownType() {
    PlaceholderSpec spec = parser.parseOne("{{魔法：销售额}}");
    assertTrue(spec.hasError());
    assertEquals(ParseErrorKind.UNKNOWN_TYPE, spec.errors().get(0).kind());
    assertNull(spec.type());
  }

  @Test
  @DisplayName("empty name is reported without aborting the document")
  void emptyNameDoesNotBlockOthers() {
    List<PlaceholderSpec> specs = parser.parse("A {{统计：}} B {{统计：销售额}}");
    assertEquals(2, specs.size());
    assertTrue(specs.get(0).hasError());
    assertEquals(ParseErrorKind.EMPTY_NAME, specs.get(0).errors().get(0).kind());
    assertFalse(specs.get(1).hasError());
    assertEquals(12, specs.get(1).offset());
  }

  @Test
  @DisplayName("unterminated token is a stub and later tokens are still found")
  void unterminated() {
    List<PlaceholderSpec> specs = parser.parse("{{统计：销售额 and then {{统计：利润}}");
    assertTrue(specs.size() >= 2);
    assertEquals(ParseErrorKind.UNTERMINATED_NESTING, specs.get(0).errors().get(0).kind());
    PlaceholderSpec last = specs.get(specs.size() - 1);
    assertFalse(last.hasError());
    assertEquals("利润", last.name());
  }

  @Test
  @DisplayName("missing separator is a malformed delimiter")
  void missingSeparator() {
    PlaceholderSpec spec = parser.parseOne("{{统计销售额}}");
    assertEquals(ParseErrorKind.MALFORMED_DELIMITER, spec.errors().get(0).kind());
  }

  @Test
  @DisplayName("nesting beyond the configured depth is rejected")
  void maxDepth() {
    PlaceholderParser shallow = new PlaceholderParser(2);
    PlaceholderSpec spec = shallow.parseOne("{{统计：{{区域：{{区域：华东}}}}}}");
    assertTrue(spec.hasError());
    assertEquals(ParseErrorKind.MAX_DEPTH_EXCEEDED, spec.errors().get(0).kind());

    PlaceholderSpec ok = new PlaceholderParser().parseOne("{{统计：{{区域：{{区域：华东}}}}}}");
    assertFalse(ok.hasError(), () -> ok.errors().toString());
  }

  @Test
  @DisplayName("equivalent markup shares one content hash")
  void contentHashIsNormalized() {
    PlaceholderSpec a = parser.parseOne("{{统计：销售额|时间范围=2024-01}}");
    PlaceholderSpec b = parser.parseOne("{{ statistic : 销售额 | 时间范围 = 2024-01 }}");
    assertFalse(b.hasError(), () -> b.errors().toString());
    assertEquals(a.contentHash(), b.contentHash());
    assertEquals("{{统计：销售额|时间范围=2024-01}}", PlaceholderSerializer.toMarkup(b));
  }

  @Test
  @DisplayName("text without placeholders parses to nothing")
  void noPlaceholders() {
    assertTrue(parser.parse("plain text").isEmpty());
    assertTrue(parser.parse(null).isEmpty());
  }
}
