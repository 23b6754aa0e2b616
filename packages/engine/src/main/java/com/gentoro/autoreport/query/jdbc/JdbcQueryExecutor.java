package com.gentoro.autoreport.query.jdbc;

import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.query.DataSourceDescriptor;
import com.gentoro.autoreport.query.ExecutionErrorKind;
import com.gentoro.autoreport.query.IdentifierKind;
import com.gentoro.autoreport.query.QueryExecutor;
import com.gentoro.autoreport.query.QueryOutcome;
import com.gentoro.autoreport.query.ResultTable;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Runs queries over JDBC and classifies failures.
 *
 * <p>SQLState classes used for classification: {@code 42S02}/{@code 42P01} unknown table, {@code
 * 42S22}/{@code 42703} unknown column, other {@code 42xxx} syntax, {@code 28xxx} and {@code
 * 42501} permission, {@code 08xxx} connection. Drivers that leave SQLState empty (SQLite, some
 * MySQL errors) are classified by message.
 */
public class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggingService.getLogger(JdbcQueryExecutor.class);

  static final int DEFAULT_MAX_ROWS = 1000;

  private static final Pattern QUOTED_NAME =
      Pattern.compile(
          "(?i)(?:table|relation|column)\\s*:?\\s*[\"'`]?([\\p{L}\\p{N}_.]+)[\"'`]?");
  private static final Pattern UNKNOWN_COLUMN =
      Pattern.compile("(?i)unknown column\\s+[\"'`]?([\\p{L}\\p{N}_.]+)");
  private static final Pattern NO_SUCH =
      Pattern.compile("(?i)no such (table|column):\\s*([\\p{L}\\p{N}_.]+)");

  private final ConnectionFactory connections;
  private final Duration queryTimeout;
  private final int maxRows;

  public JdbcQueryExecutor(ConnectionFactory connections, Duration queryTimeout) {
    this(connections, queryTimeout, DEFAULT_MAX_ROWS);
  }

  public JdbcQueryExecutor(ConnectionFactory connections, Duration queryTimeout, int maxRows) {
    this.connections = connections;
    this.queryTimeout = queryTimeout;
    this.maxRows = maxRows;
  }

  @Override
  public QueryOutcome execute(String query, DataSourceDescriptor dataSource) {
    try (Connection connection = connections.open(dataSource);
        Statement statement = connection.createStatement()) {
      if (queryTimeout != null) {
        statement.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
      }
      statement.setMaxRows(maxRows);
      try (ResultSet rs = statement.executeQuery(query)) {
        ResultTable table = read(rs);
        log.debug("Query returned {} row(s) from {}", table.rowCount(), dataSource.id());
        if (table.isEmpty()) {
          return new QueryOutcome.DataError("query returned no rows");
        }
        return new QueryOutcome.Success(table);
      }
    } catch (SQLTimeoutException e) {
      return new QueryOutcome.ExecutionError(ExecutionErrorKind.TIMEOUT, e.getMessage());
    } catch (SQLException e) {
      QueryOutcome outcome = classify(e);
      log.debug("Query failed with SQLState {}: {}", e.getSQLState(), outcome);
      return outcome;
    }
  }

  private static ResultTable read(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int count = meta.getColumnCount();
    List<String> columns = new ArrayList<>(count);
    for (int i = 1; i <= count; i++) {
      String label = meta.getColumnLabel(i);
      columns.add(label == null || label.isBlank() ? meta.getColumnName(i) : label);
    }
    List<List<Object>> rows = new ArrayList<>();
    while (rs.next()) {
      List<Object> row = new ArrayList<>(count);
      for (int i = 1; i <= count; i++) {
        row.add(rs.getObject(i));
      }
      rows.add(row);
    }
    return new ResultTable(columns, rows);
  }

  static QueryOutcome classify(SQLException e) {
    String state = e.getSQLState() == null ? "" : e.getSQLState().toUpperCase(Locale.ROOT);
    String message = e.getMessage() == null ? "" : e.getMessage();
    String lower = message.toLowerCase(Locale.ROOT);

    if ("42S02".equals(state) || "42P01".equals(state)) {
      return new QueryOutcome.SchemaError(identifier(message), IdentifierKind.TABLE, message);
    }
    if ("42S22".equals(state) || "42703".equals(state) || isMissingColumnMessage(lower)) {
      return new QueryOutcome.SchemaError(identifier(message), IdentifierKind.COLUMN, message);
    }
    if (isMissingTableMessage(lower)) {
      return new QueryOutcome.SchemaError(identifier(message), IdentifierKind.TABLE, message);
    }
    if (state.startsWith("28")
        || "42501".equals(state)
        || lower.contains("permission denied")
        || lower.contains("access denied")) {
      return new QueryOutcome.ExecutionError(ExecutionErrorKind.PERMISSION, message);
    }
    if (state.startsWith("08")) {
      return new QueryOutcome.ExecutionError(ExecutionErrorKind.CONNECTION, message);
    }
    if ("HYT00".equals(state) || "57014".equals(state) || lower.contains("timeout")) {
      return new QueryOutcome.ExecutionError(ExecutionErrorKind.TIMEOUT, message);
    }
    if (state.startsWith("42") || lower.contains("syntax error")) {
      return new QueryOutcome.ExecutionError(ExecutionErrorKind.SYNTAX, message);
    }
    return new QueryOutcome.ExecutionError(ExecutionErrorKind.UNKNOWN, message);
  }

  private static boolean isMissingTableMessage(String lower) {
    return lower.contains("no such table")
        || (lower.contains("table")
            && (lower.contains("not found") || lower.contains("doesn't exist")))
        || (lower.contains("relation") && lower.contains("does not exist"));
  }

  private static boolean isMissingColumnMessage(String lower) {
    return lower.contains("no such column")
        || lower.contains("unknown column")
        || (lower.contains("column")
            && (lower.contains("not found") || lower.contains("does not exist")));
  }

  /** Best-effort extraction of the rejected name from a driver message; null when absent. */
  static String identifier(String message) {
    Matcher m = NO_SUCH.matcher(message);
    if (m.find()) {
      return m.group(2);
    }
    m = UNKNOWN_COLUMN.matcher(message);
    if (m.find()) {
      return m.group(1);
    }
    m = QUOTED_NAME.matcher(message);
    if (m.find()) {
      String name = m.group(1);
      int dot = name.lastIndexOf('.');
      return dot >= 0 ? name.substring(dot + 1) : name;
    }
    return null;
  }
}
