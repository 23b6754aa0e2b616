package com.gentoro.autoreport.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autoreport.semantic.Intent;
import com.gentoro.autoreport.semantic.ParameterKeys;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TemplateQueryDraftGeneratorTest {

  private static final SchemaCatalog SHOP =
      new SchemaCatalog(
          "shop",
          List.of(
              new TableSchema(
                  "customers",
                  List.of(
                      new ColumnSchema("customer_id", "INTEGER"),
                      new ColumnSchema("name", "VARCHAR"))),
              new TableSchema(
                  "sales",
                  List.of(
                      new ColumnSchema("order_date", "DATE"),
                      new ColumnSchema("region", "VARCHAR"),
                      new ColumnSchema("amount", "DECIMAL(12,2)"),
                      new ColumnSchema("customer_id", "INTEGER")))));

  private final TemplateQueryDraftGenerator generator = new TemplateQueryDraftGenerator();

  private static QueryRequest request(Intent intent, Map<String, String> parameters) {
    return new QueryRequest("销售额", intent, "销售额", parameters);
  }

  private static DraftFeedback afterSyntaxErrors(int count) {
    List<QueryAttempt> history =
        IntStream.rangeClosed(1, count)
            .mapToObj(
                i ->
                    new QueryAttempt(
                        i,
                        "SELECT " + i,
                        new QueryOutcome.ExecutionError(ExecutionErrorKind.SYNTAX, "syntax"),
                        null,
                        null,
                        null,
                        1))
            .toList();
    return new DraftFeedback(history, Set.of(), "SYNTAX: syntax");
  }

  @Test
  void statisticWithTimeRange() {
    String sql =
        generator.draft(
            request(Intent.STATISTIC, Map.of(ParameterKeys.TIME_RANGE, "2024-01")),
            SHOP,
            DraftFeedback.none());
    assertEquals(
        "SELECT SUM(amount) AS value FROM sales"
            + " WHERE order_date >= '2024-01-01' AND order_date < '2024-02-01'",
        sql);
  }

  @Test
  void redraftsSimplifyFilters() {
    QueryRequest request =
        request(
            Intent.STATISTIC,
            Map.of(ParameterKeys.TIME_RANGE, "2024-Q2", ParameterKeys.REGION, "华东"));

    String first = generator.draft(request, SHOP, DraftFeedback.none());
    String second = generator.draft(request, SHOP, afterSyntaxErrors(1));
    String third = generator.draft(request, SHOP, afterSyntaxErrors(2));

    assertEquals(
        "SELECT SUM(amount) AS value FROM sales WHERE order_date >= '2024-04-01'"
            + " AND order_date < '2024-07-01' AND region = '华东'",
        first);
    assertEquals("SELECT SUM(amount) AS value FROM sales WHERE region = '华东'", second);
    assertEquals("SELECT SUM(amount) AS value FROM sales", third);
  }

  @Test
  void rejectedTableIsAvoided() {
    DraftFeedback feedback = new DraftFeedback(List.of(), Set.of("sales"), null);
    String sql = generator.draft(request(Intent.STATISTIC, Map.of()), SHOP, feedback);
    assertEquals("SELECT COUNT(*) AS value FROM customers", sql);
  }

  @Test
  void averageAggregation() {
    String sql =
        generator.draft(
            request(Intent.STATISTIC, Map.of(ParameterKeys.AGGREGATION, "avg")),
            SHOP,
            DraftFeedback.none());
    assertEquals("SELECT AVG(amount) AS value FROM sales", sql);
  }

  @Test
  void trendGroupsByTime() {
    String sql = generator.draft(request(Intent.TREND, Map.of()), SHOP, DraftFeedback.none());
    assertEquals(
        "SELECT order_date AS period, SUM(amount) AS value FROM sales"
            + " GROUP BY order_date ORDER BY order_date",
        sql);
  }

  @Test
  void listingRanksDimension() {
    String sql =
        generator.draft(
            request(Intent.LISTING, Map.of(ParameterKeys.LIMIT, "5", ParameterKeys.ORDER, "asc")),
            SHOP,
            DraftFeedback.none());
    assertEquals(
        "SELECT region, SUM(amount) AS value FROM sales GROUP BY region"
            + " ORDER BY value ASC LIMIT 5",
        sql);
  }

  @Test
  void extremumUsesRequestedDirection() {
    String sql =
        generator.draft(
            request(Intent.EXTREMUM, Map.of(ParameterKeys.EXTREMUM, "min")),
            SHOP,
            DraftFeedback.none());
    assertEquals("SELECT MIN(amount) AS value FROM sales", sql);
  }

  @Test
  void comparisonAgainstPreviousWindow() {
    String sql =
        generator.draft(
            request(Intent.COMPARISON, Map.of(ParameterKeys.TIME_RANGE, "2024-03")),
            SHOP,
            DraftFeedback.none());
    assertEquals(
        "SELECT SUM(CASE WHEN order_date >= '2024-03-01' AND order_date < '2024-04-01'"
            + " THEN amount END) AS current_value,"
            + " SUM(CASE WHEN order_date >= '2024-02-01' AND order_date < '2024-03-01'"
            + " THEN amount END) AS previous_value FROM sales",
        sql);
  }

  @Test
  void regionQuotesAreEscaped() {
    String sql =
        generator.draft(
            request(Intent.STATISTIC, Map.of(ParameterKeys.REGION, "O'Hare")),
            SHOP,
            DraftFeedback.none());
    assertTrue(sql.endsWith("WHERE region = 'O''Hare'"));
  }

  @Test
  void metricHintsPreferLongestSynonym() {
    List<String> hints = TemplateQueryDraftGenerator.metricHints("订单金额");
    assertEquals("amount", hints.get(0));
    assertTrue(hints.contains("order_amount"));
    assertTrue(TemplateQueryDraftGenerator.metricHints(null).isEmpty());
  }
}
