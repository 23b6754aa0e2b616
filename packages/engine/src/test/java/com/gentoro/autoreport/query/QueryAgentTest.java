package com.gentoro.autoreport.query;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.autoreport.semantic.Intent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryAgentTest {

  static final SchemaCatalog RETAIL =
      new SchemaCatalog(
          "retail",
          List.of(
              new TableSchema(
                  "online_retail",
                  List.of(
                      new ColumnSchema("invoice_date", "DATE"),
                      new ColumnSchema("region", "VARCHAR"),
                      new ColumnSchema("amount", "DECIMAL"),
                      new ColumnSchema("customer_id", "INTEGER"))),
              new TableSchema(
                  "customers",
                  List.of(
                      new ColumnSchema("customer_id", "INTEGER"),
                      new ColumnSchema("name", "VARCHAR")))));

  static final DataSourceDescriptor DS = DataSourceDescriptor.of("retail");

  private static QueryRequest statistic() {
    return new QueryRequest("销售额", Intent.STATISTIC, "销售额", Map.of());
  }

  /** Records every query it receives and answers through {@code responder}. */
  private static final class RecordingExecutor implements QueryExecutor {
    final List<String> executed = new ArrayList<>();
    final QueryExecutor responder;

    RecordingExecutor(QueryExecutor responder) {
      this.responder = responder;
    }

    @Override
    public QueryOutcome execute(String query, DataSourceDescriptor dataSource) {
      executed.add(query);
      return responder.execute(query, dataSource);
    }
  }

  private static QueryOutcome unknownTransactions(String query) {
    if (query.contains("transactions")) {
      return new QueryOutcome.SchemaError(
          "transactions", IdentifierKind.TABLE, "no such table: transactions");
    }
    return new QueryOutcome.Success(ResultTable.scalar("value", 1234.5));
  }

  @Test
  @DisplayName("unknown table is corrected from the catalog and succeeds on the second attempt")
  void correctsUnknownTable() {
    RecordingExecutor executor = new RecordingExecutor((q, ds) -> unknownTransactions(q));
    QueryAgent agent =
        new QueryAgent((r, c, f) -> "SELECT SUM(amount) AS value FROM transactions", executor, 3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertEquals(1234.5, resolution.value());
    assertEquals(2, resolution.attempts().size());
    QueryAttempt first = resolution.attempts().get(0);
    assertInstanceOf(QueryOutcome.SchemaError.class, first.outcome());
    assertEquals("transactions", first.offendingIdentifier());
    assertEquals("online_retail", first.correctedIdentifier());
    assertEquals(
        "SELECT SUM(amount) AS value FROM online_retail", resolution.attempts().get(1).query());
    assertEquals(0.85, resolution.confidence(), 1e-9);
  }

  @Test
  @DisplayName("rejected identifiers are never sent again even when the generator repeats them")
  void neverResendsRejectedIdentifier() {
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) -> {
              if (q.startsWith("SELECT SUM") && q.contains("online_retail")) {
                return new QueryOutcome.ExecutionError(ExecutionErrorKind.SYNTAX, "bad token");
              }
              return unknownTransactions(q);
            });
    QueryDraftGenerator stubborn =
        (r, c, f) ->
            f.problem() == null
                ? "SELECT SUM(amount) AS value FROM transactions"
                : "SELECT AVG(amount) AS value FROM transactions";
    QueryAgent agent = new QueryAgent(stubborn, executor, 5);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertEquals(1, executor.executed.stream().filter(q -> q.contains("transactions")).count());
    assertEquals(
        "SELECT AVG(amount) AS value FROM online_retail",
        executor.executed.get(executor.executed.size() - 1));
  }

  @Test
  @DisplayName("unnamed schema errors locate the unknown column in the query")
  void correctsUnnamedColumn() {
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) ->
                q.contains("amout")
                    ? new QueryOutcome.SchemaError(null, IdentifierKind.UNKNOWN, "bad column")
                    : new QueryOutcome.Success(ResultTable.scalar("value", 10)));
    QueryAgent agent =
        new QueryAgent((r, c, f) -> "SELECT SUM(amout) AS value FROM online_retail", executor, 3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertEquals(
        List.of(
            "SELECT SUM(amout) AS value FROM online_retail",
            "SELECT SUM(amount) AS value FROM online_retail"),
        executor.executed);
  }

  @Test
  @DisplayName("an identical redraft fails instead of running the same query again")
  void identicalRedraftFails() {
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) -> new QueryOutcome.ExecutionError(ExecutionErrorKind.SYNTAX, "near FORM"));
    QueryAgent agent = new QueryAgent((r, c, f) -> "SELECT SUM(amount) FORM x", executor, 5);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertFalse(resolution.succeeded());
    assertEquals(1, executor.executed.size());
    assertTrue(resolution.failureReason().contains("identical"));
  }

  @Test
  @DisplayName("the retry budget bounds the number of executions")
  void retryBudget() {
    AtomicInteger drafts = new AtomicInteger();
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) -> new QueryOutcome.ExecutionError(ExecutionErrorKind.SYNTAX, "still wrong"));
    QueryAgent agent =
        new QueryAgent(
            (r, c, f) -> "SELECT " + drafts.incrementAndGet() + " FROM online_retail",
            executor,
            3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertEquals(AgentState.FAILED, resolution.state());
    assertEquals(3, resolution.attempts().size());
    assertEquals(3, executor.executed.size());
    assertTrue(resolution.failureReason().contains("retry budget"));
    assertEquals(0.0, resolution.confidence());
  }

  @Test
  @DisplayName("permission errors fail at once")
  void permissionIsTerminal() {
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) ->
                new QueryOutcome.ExecutionError(ExecutionErrorKind.PERMISSION, "access denied"));
    QueryAgent agent =
        new QueryAgent((r, c, f) -> "SELECT SUM(amount) FROM online_retail", executor, 3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertFalse(resolution.succeeded());
    assertEquals(1, resolution.attempts().size());
    assertTrue(resolution.failureReason().startsWith("PERMISSION"));
  }

  @Test
  @DisplayName("timeouts re-run the same query")
  void timeoutRetriesSameQuery() {
    AtomicInteger calls = new AtomicInteger();
    RecordingExecutor executor =
        new RecordingExecutor(
            (q, ds) ->
                calls.incrementAndGet() == 1
                    ? new QueryOutcome.ExecutionError(ExecutionErrorKind.TIMEOUT, "timed out")
                    : new QueryOutcome.Success(ResultTable.scalar("value", 7L)));
    QueryAgent agent =
        new QueryAgent((r, c, f) -> "SELECT SUM(amount) FROM online_retail", executor, 3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertEquals(7L, resolution.value());
    assertEquals(2, executor.executed.size());
    assertEquals(executor.executed.get(0), executor.executed.get(1));
  }

  @Test
  @DisplayName("a result of the wrong shape triggers a redraft")
  void shapeMismatchRedrafts() {
    QueryDraftGenerator generator =
        (r, c, f) ->
            f.problem() == null
                ? "SELECT SUM(amount) AS value FROM online_retail"
                : "SELECT invoice_date AS period, SUM(amount) AS value FROM online_retail"
                    + " GROUP BY invoice_date";
    QueryExecutor executor =
        (q, ds) ->
            q.contains("GROUP BY")
                ? new QueryOutcome.Success(
                    new ResultTable(
                        List.of("period", "value"),
                        List.of(
                            List.<Object>of("2024-01-01", 10),
                            List.<Object>of("2024-01-02", 12))))
                : new QueryOutcome.Success(ResultTable.scalar("value", 22));
    QueryAgent agent = new QueryAgent(generator, executor, 3);

    QueryResolution resolution =
        agent.resolve(new QueryRequest("销售趋势", Intent.TREND, "销售额", Map.of()), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertNotNull(resolution.attempts().get(0).shapeMismatch());
    assertEquals(
        List.of(
            Map.of("period", "2024-01-01", "value", 10),
            Map.of("period", "2024-01-02", "value", 12)),
        resolution.value());
  }

  @Test
  @DisplayName("an empty result resolves to no value with reduced confidence")
  void emptyResult() {
    QueryAgent agent =
        new QueryAgent(
            (r, c, f) -> "SELECT SUM(amount) FROM online_retail",
            (q, ds) -> new QueryOutcome.DataError("query returned no rows"),
            3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertTrue(resolution.succeeded());
    assertNull(resolution.value());
    assertEquals(0.5, resolution.confidence(), 1e-9);
  }

  @Test
  @DisplayName("an empty catalog fails without drafting")
  void emptyCatalog() {
    QueryDraftGenerator generator = mock(QueryDraftGenerator.class);
    QueryExecutor executor = mock(QueryExecutor.class);
    QueryAgent agent = new QueryAgent(generator, executor, 3);

    QueryResolution resolution =
        agent.resolve(statistic(), new SchemaCatalog("retail", List.of()), DS);

    assertFalse(resolution.succeeded());
    assertTrue(resolution.attempts().isEmpty());
    verifyNoInteractions(generator, executor);
  }

  @Test
  @DisplayName("cancellation stops the session before anything runs")
  void cancelled() {
    QueryExecutor executor = mock(QueryExecutor.class);
    QueryAgent agent =
        new QueryAgent((r, c, f) -> "SELECT SUM(amount) FROM online_retail", executor, 3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS, () -> true);

    assertEquals("cancelled", resolution.failureReason());
    assertTrue(resolution.cancelled());
    verifyNoInteractions(executor);
  }

  @Test
  @DisplayName("generator failures end the session")
  void generatorFailure() {
    QueryAgent agent =
        new QueryAgent(
            (r, c, f) -> {
              throw new IllegalStateException("model unavailable");
            },
            mock(QueryExecutor.class),
            3);

    QueryResolution resolution = agent.resolve(statistic(), RETAIL, DS);

    assertFalse(resolution.succeeded());
    assertTrue(resolution.failureReason().startsWith("draft generation failed"));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new QueryAgent(mock(QueryDraftGenerator.class), mock(QueryExecutor.class), 0));
  }
}
