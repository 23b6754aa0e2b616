package com.gentoro.autoreport.query;

import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.semantic.Intent;
import com.gentoro.autoreport.semantic.ParameterKeys;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Deterministic SQL synthesis from intent, parameters and the catalog.
 *
 * <p>Tables and columns are chosen only from the catalog, scored by how well their names match
 * the metric, the placeholder name and the business domain. Identifiers in the feedback's rejected
 * set are never chosen. Each redraft after a syntax error or shape mismatch drops one optional
 * clause (first the time filter, then the region filter), so consecutive drafts differ.
 */
public class TemplateQueryDraftGenerator implements QueryDraftGenerator {
  private static final Logger log = LoggingService.getLogger(TemplateQueryDraftGenerator.class);

  /** Metric words mapped to column-name fragments commonly used for them. */
  private static final Map<String, List<String>> METRIC_SYNONYMS =
      Map.ofEntries(
          Map.entry("销售额", List.of("amount", "sales", "revenue", "total")),
          Map.entry("销售量", List.of("quantity", "qty", "volume")),
          Map.entry("营收", List.of("revenue", "income", "amount")),
          Map.entry("营业收入", List.of("revenue", "income", "amount")),
          Map.entry("收入", List.of("revenue", "income", "amount")),
          Map.entry("金额", List.of("amount", "total", "price")),
          Map.entry("利润", List.of("profit", "margin")),
          Map.entry("毛利", List.of("gross", "profit", "margin")),
          Map.entry("成本", List.of("cost", "expense")),
          Map.entry("订单量", List.of("order", "orders")),
          Map.entry("订单数", List.of("order", "orders")),
          Map.entry("订单金额", List.of("amount", "order_amount", "total")),
          Map.entry("客户数", List.of("customer", "customers")),
          Map.entry("用户数", List.of("user", "users")),
          Map.entry("单价", List.of("price", "unit_price")),
          Map.entry("数量", List.of("quantity", "qty", "count")),
          Map.entry("sales", List.of("sales", "amount", "revenue")),
          Map.entry("revenue", List.of("revenue", "amount", "income")));

  private static final List<String> TIME_HINTS =
      List.of("date", "time", "day", "month", "created", "period", "日期", "时间");
  private static final List<String> REGION_HINTS =
      List.of("region", "area", "province", "city", "country", "地区", "区域", "城市");

  @Override
  public String draft(QueryRequest request, SchemaCatalog catalog, DraftFeedback feedback) {
    DraftFeedback fb = feedback == null ? DraftFeedback.none() : feedback;
    Set<String> rejected = lower(fb.rejectedIdentifiers());

    TableSchema table =
        pickTable(request, catalog, rejected)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "catalog " + catalog.dataSourceId() + " has no usable table"));
    Optional<ColumnSchema> value = pickValueColumn(request, table, rejected);
    Optional<ColumnSchema> time = pickByHints(table, TIME_HINTS, rejected, true);
    Optional<ColumnSchema> dimension = pickDimension(table, time, rejected);

    int simplification = fb.redrafts();
    List<String> filters = new ArrayList<>();
    Optional<TimeWindow> window =
        Optional.ofNullable(request.parameter(ParameterKeys.TIME_RANGE)).flatMap(TimeWindow::parse);
    if (simplification < 1 && window.isPresent() && time.isPresent()) {
      filters.add(window.get().predicate(time.get().name()));
    }
    String region = request.parameter(ParameterKeys.REGION);
    Optional<ColumnSchema> regionColumn = pickByHints(table, REGION_HINTS, rejected, false);
    if (simplification < 2 && region != null && regionColumn.isPresent()) {
      filters.add(regionColumn.get().name() + " = '" + region.replace("'", "''") + "'");
    }

    String sql = build(request, table, value, time, dimension, filters, window, simplification);
    log.debug("Draft for '{}' (redraft {}): {}", request.placeholderName(), simplification, sql);
    return sql;
  }

  private String build(
      QueryRequest request,
      TableSchema table,
      Optional<ColumnSchema> value,
      Optional<ColumnSchema> time,
      Optional<ColumnSchema> dimension,
      List<String> filters,
      Optional<TimeWindow> window,
      int simplification) {
    String from = " FROM " + table.name();
    String where = filters.isEmpty() ? "" : " WHERE " + String.join(" AND ", filters);
    String aggregation =
        aggregate(request.parameter(ParameterKeys.AGGREGATION), value.map(ColumnSchema::name));
    String extremum =
        "min".equalsIgnoreCase(request.parameter(ParameterKeys.EXTREMUM)) ? "MIN" : "MAX";
    int limit = parseLimit(request.parameter(ParameterKeys.LIMIT));
    String order =
        "asc".equalsIgnoreCase(request.parameter(ParameterKeys.ORDER)) ? "ASC" : "DESC";
    String key = time.or(() -> dimension).map(ColumnSchema::name).orElse(null);

    Intent intent = request.intent();
    switch (intent) {
      case EXTREMUM:
        return "SELECT " + extremum + "(" + value.map(ColumnSchema::name).orElse("*") + ") AS value"
            + from + where;
      case PERIOD:
        if (time.isPresent()) {
          return "SELECT " + extremum + "(" + time.get().name() + ") AS value" + from + where;
        }
        return "SELECT " + aggregation + " AS value" + from + where;
      case REGION:
        if (dimension.isPresent()) {
          String d = dimension.get().name();
          String dir = "MIN".equals(extremum) ? "ASC" : "DESC";
          return "SELECT " + d + " AS value" + from + where + " GROUP BY " + d
              + " ORDER BY " + aggregation + " " + dir + " LIMIT 1";
        }
        return "SELECT " + aggregation + " AS value" + from + where;
      case TREND:
      case CHART:
      case FORECAST:
        if (key != null) {
          return "SELECT " + key + " AS period, " + aggregation + " AS value" + from + where
              + " GROUP BY " + key + " ORDER BY " + key;
        }
        return "SELECT " + aggregation + " AS value" + from + where;
      case LISTING:
        if (dimension.isPresent()) {
          String d = dimension.get().name();
          return "SELECT " + d + ", " + aggregation + " AS value" + from + where
              + " GROUP BY " + d + " ORDER BY value " + order + " LIMIT " + limit;
        }
        return "SELECT *" + from + where + " LIMIT " + limit;
      case COMPARISON:
        if (simplification < 1 && window.isPresent() && time.isPresent() && value.isPresent()) {
          TimeWindow previous =
              "same_period_last_year".equals(request.parameter(ParameterKeys.COMPARE_PERIOD))
                  ? window.get().sameWindowLastYear()
                  : window.get().previous();
          String v = value.get().name();
          String t = time.get().name();
          return "SELECT SUM(CASE WHEN " + window.get().predicate(t) + " THEN " + v
              + " END) AS current_value, SUM(CASE WHEN " + previous.predicate(t) + " THEN " + v
              + " END) AS previous_value" + from;
        }
        return "SELECT " + aggregation + " AS value" + from + where;
      default:
        return "SELECT " + aggregation + " AS value" + from + where;
    }
  }

  private static String aggregate(String aggregation, Optional<String> column) {
    String agg = aggregation == null ? "sum" : aggregation.toLowerCase(Locale.ROOT);
    if ("count".equals(agg) || column.isEmpty()) {
      return "COUNT(*)";
    }
    String fn =
        switch (agg) {
          case "avg", "average", "mean", "平均" -> "AVG";
          case "max" -> "MAX";
          case "min" -> "MIN";
          default -> "SUM";
        };
    return fn + "(" + column.get() + ")";
  }

  private Optional<TableSchema> pickTable(
      QueryRequest request, SchemaCatalog catalog, Set<String> rejected) {
    List<String> hints = new ArrayList<>(metricHints(request.metric()));
    hints.addAll(words(request.parameter(ParameterKeys.DOMAIN)));
    hints.addAll(words(request.placeholderName()));
    return catalog.tables().stream()
        .filter(t -> !rejected.contains(t.name().toLowerCase(Locale.ROOT)))
        .max(
            Comparator.comparingInt((TableSchema t) -> tableScore(t, hints))
                .thenComparingInt(t -> -catalog.tables().indexOf(t)));
  }

  private static int tableScore(TableSchema table, List<String> hints) {
    String name = table.name().toLowerCase(Locale.ROOT);
    int score = 0;
    for (String hint : hints) {
      if (name.contains(hint)) {
        score += 3;
      }
      for (ColumnSchema c : table.columns()) {
        if (c.name().toLowerCase(Locale.ROOT).contains(hint)) {
          score += 1;
        }
      }
    }
    return score;
  }

  private Optional<ColumnSchema> pickValueColumn(
      QueryRequest request, TableSchema table, Set<String> rejected) {
    List<String> hints = metricHints(request.metric());
    for (String hint : hints) {
      for (ColumnSchema c : table.columns()) {
        String name = c.name().toLowerCase(Locale.ROOT);
        if (!rejected.contains(name) && name.contains(hint)) {
          return Optional.of(c);
        }
      }
    }
    return table.columns().stream()
        .filter(c -> c.isNumeric() && !rejected.contains(c.name().toLowerCase(Locale.ROOT)))
        .filter(c -> !c.name().toLowerCase(Locale.ROOT).endsWith("id"))
        .findFirst();
  }

  private static Optional<ColumnSchema> pickByHints(
      TableSchema table, List<String> hints, Set<String> rejected, boolean allowTemporalType) {
    for (ColumnSchema c : table.columns()) {
      String name = c.name().toLowerCase(Locale.ROOT);
      if (rejected.contains(name)) {
        continue;
      }
      if (allowTemporalType && c.isTemporal()) {
        return Optional.of(c);
      }
      if (hints.stream().anyMatch(name::contains)) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  private static Optional<ColumnSchema> pickDimension(
      TableSchema table, Optional<ColumnSchema> time, Set<String> rejected) {
    Optional<ColumnSchema> region = pickByHints(table, REGION_HINTS, rejected, false);
    if (region.isPresent()) {
      return region;
    }
    return table.columns().stream()
        .filter(c -> !c.isNumeric() && !c.isTemporal())
        .filter(c -> time.isEmpty() || !c.equals(time.get()))
        .filter(c -> !rejected.contains(c.name().toLowerCase(Locale.ROOT)))
        .filter(c -> !c.name().toLowerCase(Locale.ROOT).endsWith("id"))
        .findFirst();
  }

  static List<String> metricHints(String metric) {
    List<String> hints = new ArrayList<>();
    if (metric == null || metric.isBlank()) {
      return hints;
    }
    String m = metric.toLowerCase(Locale.ROOT).trim();
    METRIC_SYNONYMS.entrySet().stream()
        .filter(e -> m.contains(e.getKey()))
        .sorted(
            Comparator.comparingInt((Map.Entry<String, List<String>> e) -> e.getKey().length())
                .reversed())
        .forEach(e -> e.getValue().stream().filter(h -> !hints.contains(h)).forEach(hints::add));
    for (String w : words(m)) {
      if (!hints.contains(w)) {
        hints.add(w);
      }
    }
    return hints;
  }

  private static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    if (text == null) {
      return out;
    }
    for (String w : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
      if (w.length() >= 3) {
        out.add(w);
      }
    }
    return out;
  }

  private static int parseLimit(String limit) {
    if (limit == null) {
      return 10;
    }
    try {
      return Math.max(1, Integer.parseInt(limit.trim()));
    } catch (NumberFormatException e) {
      return 10;
    }
  }

  private static Set<String> lower(Set<String> identifiers) {
    Set<String> out = new HashSet<>();
    for (String id : identifiers) {
      out.add(SchemaCatalog.unqualified(id).toLowerCase(Locale.ROOT));
    }
    return out;
  }
}
