package com.gentoro.autoreport.semantic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, rule-based entity recognition for time expressions, locations and metric names.
 * Overlapping matches are resolved in favour of the earliest, then longest, match.
 */
public class EntityRecognizer {

  private record Rule(EntityType type, Pattern pattern) {}

  private static final List<Rule> RULES =
      List.of(
          new Rule(EntityType.TIME, Pattern.compile("\\d{4}-\\d{1,2}(?:-\\d{1,2})?")),
          new Rule(EntityType.TIME, Pattern.compile("\\d{4}年(?:\\d{1,2}月)?(?:\\d{1,2}日)?")),
          new Rule(EntityType.TIME, Pattern.compile("\\d{4}\\s*[Qq][1-4]|[Qq][1-4]")),
          new Rule(EntityType.TIME, Pattern.compile("第[一二三四1-4]季度")),
          new Rule(
              EntityType.TIME,
              Pattern.compile("本月|上月|本季度|上季度|今年|去年|本周|上周|上半年|下半年|近\\d+(?:天|周|个月|月|年)")),
          new Rule(
              EntityType.TIME,
              Pattern.compile(
                  "\\b(?:this|last) (?:month|quarter|year|week)\\b", Pattern.CASE_INSENSITIVE)),
          new Rule(EntityType.LOCATION, Pattern.compile("(?:华东|华南|华北|华中|西南|西北|东北)(?:地区|区)?")),
          new Rule(EntityType.LOCATION, Pattern.compile("[\\p{IsHan}]{2,4}?(?:省|市|自治区)")),
          new Rule(
              EntityType.METRIC,
              Pattern.compile(
                  "销售额|销售量|营业收入|营收|收入|利润|毛利|成本|订单量|订单数|订单金额|客户数|用户数|单价|金额|增长率|数量")),
          new Rule(
              EntityType.METRIC,
              Pattern.compile(
                  "\\b(?:sales|revenue|amount|profit|cost|orders?|quantity|price|count)\\b",
                  Pattern.CASE_INSENSITIVE)));

  /** Recognize entities in the placeholder name. */
  public List<RecognizedEntity> recognizeName(String name) {
    return recognize(name, true);
  }

  /** Recognize entities in the text surrounding the placeholder. */
  public List<RecognizedEntity> recognizeNeighborhood(String text) {
    return recognize(text, false);
  }

  List<RecognizedEntity> recognize(String text, boolean fromName) {
    List<RecognizedEntity> found = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return found;
    }
    for (Rule rule : RULES) {
      Matcher m = rule.pattern().matcher(text);
      while (m.find()) {
        if (m.end() > m.start()) {
          found.add(new RecognizedEntity(m.group(), rule.type(), m.start(), m.end(), fromName));
        }
      }
    }
    found.sort(
        Comparator.comparingInt(RecognizedEntity::start)
            .thenComparing(
                Comparator.comparingInt((RecognizedEntity e) -> e.end() - e.start())
                    .reversed()));

    List<RecognizedEntity> result = new ArrayList<>();
    int coveredUntil = -1;
    for (RecognizedEntity e : found) {
      if (e.start() >= coveredUntil) {
        result.add(e);
        coveredUntil = e.end();
      }
    }
    return result;
  }
}
