package com.gentoro.autoreport.semantic;

import com.gentoro.autoreport.context.BusinessContext;
import com.gentoro.autoreport.context.DocumentContext;
import com.gentoro.autoreport.parser.Parameter;
import com.gentoro.autoreport.parser.ParameterValue;
import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fills parameters missing from the markup. Explicit parameters always win; inferred ones come
 * from, in order: entities in the name, keyword rules over the name, the nearest section heading,
 * the business context and finally per-intent defaults.
 */
public class ImplicitParameterInferencer {

  private record KeywordRule(String keyword, String key, String value) {}

  private static final List<KeywordRule> KEYWORD_RULES =
      List.of(
          new KeywordRule("同比", ParameterKeys.COMPARE_PERIOD, "same_period_last_year"),
          new KeywordRule("环比", ParameterKeys.COMPARE_PERIOD, "last_period"),
          new KeywordRule("最高", ParameterKeys.EXTREMUM, "max"),
          new KeywordRule("最大", ParameterKeys.EXTREMUM, "max"),
          new KeywordRule("最多", ParameterKeys.EXTREMUM, "max"),
          new KeywordRule("最低", ParameterKeys.EXTREMUM, "min"),
          new KeywordRule("最小", ParameterKeys.EXTREMUM, "min"),
          new KeywordRule("最少", ParameterKeys.EXTREMUM, "min"),
          new KeywordRule("前十", ParameterKeys.LIMIT, "10"),
          new KeywordRule("前五", ParameterKeys.LIMIT, "5"),
          new KeywordRule("前三", ParameterKeys.LIMIT, "3"),
          new KeywordRule("平均", ParameterKeys.AGGREGATION, "avg"),
          new KeywordRule("均值", ParameterKeys.AGGREGATION, "avg"),
          new KeywordRule("总", ParameterKeys.AGGREGATION, "sum"),
          new KeywordRule("合计", ParameterKeys.AGGREGATION, "sum"),
          new KeywordRule("数量", ParameterKeys.AGGREGATION, "count"),
          new KeywordRule("个数", ParameterKeys.AGGREGATION, "count"),
          new KeywordRule("柱状图", ParameterKeys.CHART_TYPE, "bar"),
          new KeywordRule("折线图", ParameterKeys.CHART_TYPE, "line"),
          new KeywordRule("饼图", ParameterKeys.CHART_TYPE, "pie"),
          new KeywordRule("按日", ParameterKeys.GRANULARITY, "daily"),
          new KeywordRule("按周", ParameterKeys.GRANULARITY, "weekly"),
          new KeywordRule("按月", ParameterKeys.GRANULARITY, "monthly"),
          new KeywordRule("按季度", ParameterKeys.GRANULARITY, "quarterly"),
          new KeywordRule("按年", ParameterKeys.GRANULARITY, "yearly"));

  private final EntityRecognizer recognizer;

  public ImplicitParameterInferencer(EntityRecognizer recognizer) {
    this.recognizer = recognizer;
  }

  public List<InferredParameter> infer(
      PlaceholderSpec spec,
      Intent intent,
      List<RecognizedEntity> nameEntities,
      DocumentContext document,
      BusinessContext business) {
    Map<String, InferredParameter> out = new LinkedHashMap<>();

    for (Parameter p : spec.parameters()) {
      if (p.value() instanceof ParameterValue.Text t) {
        String key = ParameterKeys.canonical(p.key());
        String value = t.value().trim();
        if (ParameterKeys.TIME_RANGE.equals(key)) {
          value = TimeExpressions.normalize(value, document.effectiveDate()).orElse(value);
        }
        out.putIfAbsent(key, InferredParameter.explicit(key, value));
      }
    }

    if (!out.containsKey(ParameterKeys.TIME_RANGE)) {
      timeFrom(nameEntities, document)
          .or(() -> headingTime(spec, document))
          .ifPresent(p -> out.put(ParameterKeys.TIME_RANGE, p));
    }

    String name = spec.displayName();
    for (KeywordRule rule : KEYWORD_RULES) {
      if (name.contains(rule.keyword()) && !out.containsKey(rule.key())) {
        out.put(
            rule.key(),
            InferredParameter.inferred(rule.key(), rule.value(), "keyword:" + rule.keyword()));
      }
    }

    if (!out.containsKey(ParameterKeys.REGION)) {
      nameEntities.stream()
          .filter(e -> e.type() == EntityType.LOCATION)
          .findFirst()
          .ifPresent(
              e ->
                  out.put(
                      ParameterKeys.REGION,
                      InferredParameter.inferred(
                          ParameterKeys.REGION, e.text(), "entity:location")));
    }

    if (!out.containsKey(ParameterKeys.DOMAIN)) {
      String domain = firstNonBlank(business.primaryDomain(), document.domain());
      if (domain != null) {
        out.put(
            ParameterKeys.DOMAIN,
            InferredParameter.inferred(ParameterKeys.DOMAIN, domain, "context:domain"));
      }
    }

    for (InferredParameter d : defaults(intent)) {
      out.putIfAbsent(d.key(), d);
    }
    return new ArrayList<>(out.values());
  }

  private Optional<InferredParameter> timeFrom(
      List<RecognizedEntity> entities, DocumentContext document) {
    for (RecognizedEntity e : entities) {
      if (e.type() == EntityType.TIME) {
        Optional<String> normalized = TimeExpressions.normalize(e.text(), document.effectiveDate());
        if (normalized.isPresent()) {
          return Optional.of(
              InferredParameter.inferred(
                  ParameterKeys.TIME_RANGE, normalized.get(), "entity:time"));
        }
      }
    }
    return Optional.empty();
  }

  private Optional<InferredParameter> headingTime(PlaceholderSpec spec, DocumentContext document) {
    Optional<String> heading = document.nearestHeading(spec);
    if (heading.isEmpty()) {
      return Optional.empty();
    }
    for (RecognizedEntity e : recognizer.recognizeNeighborhood(heading.get())) {
      if (e.type() == EntityType.TIME) {
        Optional<String> normalized = TimeExpressions.normalize(e.text(), document.effectiveDate());
        if (normalized.isPresent()) {
          return Optional.of(
              InferredParameter.inferred(
                  ParameterKeys.TIME_RANGE, normalized.get(), "heading:time"));
        }
      }
    }
    return Optional.empty();
  }

  static List<InferredParameter> defaults(Intent intent) {
    return switch (intent) {
      case STATISTIC -> List.of(def(ParameterKeys.AGGREGATION, "sum"));
      case TREND -> List.of(def(ParameterKeys.GRANULARITY, "monthly"));
      case LISTING -> List.of(def(ParameterKeys.LIMIT, "10"), def(ParameterKeys.ORDER, "desc"));
      case EXTREMUM -> List.of(def(ParameterKeys.EXTREMUM, "max"));
      case CHART -> List.of(def(ParameterKeys.CHART_TYPE, "bar"));
      case FORECAST -> List.of(def(ParameterKeys.HORIZON, "3_months"));
      case COMPARISON -> List.of(def(ParameterKeys.COMPARE_PERIOD, "last_period"));
      default -> List.of();
    };
  }

  private static InferredParameter def(String key, String value) {
    return InferredParameter.inferred(key, value, "default");
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) {
      return a;
    }
    return b == null || b.isBlank() ? null : b;
  }
}
