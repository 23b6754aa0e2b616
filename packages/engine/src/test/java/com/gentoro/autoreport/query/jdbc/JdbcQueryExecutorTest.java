package com.gentoro.autoreport.query.jdbc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.gentoro.autoreport.query.DataSourceDescriptor;
import com.gentoro.autoreport.query.ExecutionErrorKind;
import com.gentoro.autoreport.query.IdentifierKind;
import com.gentoro.autoreport.query.QueryOutcome;
import com.gentoro.autoreport.query.ResultTable;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class JdbcQueryExecutorTest {

  private static final DataSourceDescriptor DS = DataSourceDescriptor.of("retail");

  @Mock private Connection connection;
  @Mock private Statement statement;
  @Mock private ResultSet resultSet;
  @Mock private ResultSetMetaData metaData;

  private JdbcQueryExecutor executor;

  @BeforeEach
  void setUp() throws SQLException {
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery(anyString())).thenReturn(resultSet);
    when(resultSet.getMetaData()).thenReturn(metaData);
    executor = new JdbcQueryExecutor(ds -> connection, Duration.ofSeconds(5));
  }

  @Test
  void readsRowsAndReleasesResources() throws SQLException {
    when(metaData.getColumnCount()).thenReturn(2);
    when(metaData.getColumnLabel(1)).thenReturn("region");
    when(metaData.getColumnLabel(2)).thenReturn("");
    when(metaData.getColumnName(2)).thenReturn("total");
    when(resultSet.next()).thenReturn(true, true, false);
    when(resultSet.getObject(1)).thenReturn("north", "south");
    when(resultSet.getObject(2)).thenReturn(10, 20);

    QueryOutcome outcome = executor.execute("SELECT region, SUM(amount) FROM sales", DS);

    ResultTable table = assertInstanceOf(QueryOutcome.Success.class, outcome).table();
    assertEquals(List.of("region", "total"), table.columns());
    assertEquals(List.of(List.of("north", 10), List.of("south", 20)), table.rows());
    verify(statement).setQueryTimeout(5);
    verify(statement).setMaxRows(JdbcQueryExecutor.DEFAULT_MAX_ROWS);
    verify(resultSet).close();
    verify(statement).close();
    verify(connection).close();
  }

  @Test
  void emptyResultIsDataError() throws SQLException {
    when(metaData.getColumnCount()).thenReturn(1);
    when(metaData.getColumnLabel(1)).thenReturn("value");
    when(resultSet.next()).thenReturn(false);

    assertInstanceOf(
        QueryOutcome.DataError.class, executor.execute("SELECT SUM(amount) FROM sales", DS));
  }

  @Test
  void missingTableIsSchemaError() throws SQLException {
    when(statement.executeQuery(anyString()))
        .thenThrow(new SQLException("Table 'shop.transactions' doesn't exist", "42S02"));

    QueryOutcome outcome = executor.execute("SELECT * FROM transactions", DS);

    QueryOutcome.SchemaError error = assertInstanceOf(QueryOutcome.SchemaError.class, outcome);
    assertEquals("transactions", error.identifier());
    assertEquals(IdentifierKind.TABLE, error.kind());
    verify(connection).close();
  }

  @Test
  void driverTimeoutIsTimeout() throws SQLException {
    when(statement.executeQuery(anyString())).thenThrow(new SQLTimeoutException("cancelled"));

    QueryOutcome.ExecutionError error =
        assertInstanceOf(
            QueryOutcome.ExecutionError.class, executor.execute("SELECT 1 FROM sales", DS));
    assertEquals(ExecutionErrorKind.TIMEOUT, error.kind());
  }

  @Test
  void connectionFailureIsClassified() {
    JdbcQueryExecutor offline =
        new JdbcQueryExecutor(
            ds -> {
              throw new SQLException("Connection refused", "08001");
            },
            Duration.ofSeconds(1));

    QueryOutcome.ExecutionError error =
        assertInstanceOf(
            QueryOutcome.ExecutionError.class, offline.execute("SELECT 1 FROM sales", DS));
    assertEquals(ExecutionErrorKind.CONNECTION, error.kind());
  }

  @Test
  void classifiesBySqlState() {
    QueryOutcome.SchemaError column =
        assertInstanceOf(
            QueryOutcome.SchemaError.class,
            JdbcQueryExecutor.classify(
                new SQLException("ERROR: column \"amout\" does not exist", "42703")));
    assertEquals("amout", column.identifier());
    assertEquals(IdentifierKind.COLUMN, column.kind());

    assertEquals(
        ExecutionErrorKind.PERMISSION,
        kind(new SQLException("permission denied for table sales", "42501")));
    assertEquals(
        ExecutionErrorKind.PERMISSION, kind(new SQLException("Access denied for user", "28000")));
    assertEquals(
        ExecutionErrorKind.SYNTAX, kind(new SQLException("syntax error at or near FORM", "42601")));
    assertEquals(
        ExecutionErrorKind.TIMEOUT, kind(new SQLException("canceling statement", "57014")));
    assertEquals(ExecutionErrorKind.UNKNOWN, kind(new SQLException("disk full", "53100")));
  }

  @Test
  void classifiesByMessageWithoutSqlState() {
    QueryOutcome.SchemaError table =
        assertInstanceOf(
            QueryOutcome.SchemaError.class,
            JdbcQueryExecutor.classify(new SQLException("no such table: transactions")));
    assertEquals("transactions", table.identifier());
    assertEquals(IdentifierKind.TABLE, table.kind());

    QueryOutcome.SchemaError column =
        assertInstanceOf(
            QueryOutcome.SchemaError.class,
            JdbcQueryExecutor.classify(
                new SQLException("Unknown column 'amout' in 'field list'")));
    assertEquals("amout", column.identifier());
    assertEquals(IdentifierKind.COLUMN, column.kind());
  }

  private static ExecutionErrorKind kind(SQLException e) {
    return assertInstanceOf(QueryOutcome.ExecutionError.class, JdbcQueryExecutor.classify(e))
        .kind();
  }
}
