package com.gentoro.autoreport.query.jdbc;

import com.gentoro.autoreport.exception.AutoReportErrorCode;
import com.gentoro.autoreport.exception.AutoReportException;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.query.ColumnSchema;
import com.gentoro.autoreport.query.DataSourceDescriptor;
import com.gentoro.autoreport.query.SchemaCatalog;
import com.gentoro.autoreport.query.SchemaProvider;
import com.gentoro.autoreport.query.TableSchema;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/** Builds a {@link SchemaCatalog} from {@link DatabaseMetaData}. */
public class JdbcSchemaProvider implements SchemaProvider {
  private static final Logger log = LoggingService.getLogger(JdbcSchemaProvider.class);

  private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

  private final ConnectionFactory connections;
  private final String schemaPattern;

  public JdbcSchemaProvider(ConnectionFactory connections) {
    this(connections, null);
  }

  /** @param schemaPattern restricts the lookup to matching schemas; null reads all of them */
  public JdbcSchemaProvider(ConnectionFactory connections, String schemaPattern) {
    this.connections = connections;
    this.schemaPattern = schemaPattern;
  }

  @Override
  public SchemaCatalog catalog(DataSourceDescriptor dataSource) {
    try (Connection connection = connections.open(dataSource)) {
      DatabaseMetaData meta = connection.getMetaData();
      List<TableSchema> tables = new ArrayList<>();
      String catalog = connection.getCatalog();
      try (ResultSet rs = meta.getTables(catalog, schemaPattern, "%", TABLE_TYPES)) {
        while (rs.next()) {
          String table = rs.getString("TABLE_NAME");
          tables.add(new TableSchema(table, columns(meta, catalog, table)));
        }
      }
      log.info("Read {} table(s) from data source {}", tables.size(), dataSource.id());
      return new SchemaCatalog(dataSource.id(), tables);
    } catch (SQLException e) {
      throw new AutoReportException(
              AutoReportErrorCode.SCHEMA_LOOKUP_ERROR,
              "Failed to read schema of data source " + dataSource.id(),
              e)
          .withContext("sqlState", e.getSQLState());
    }
  }

  private List<ColumnSchema> columns(DatabaseMetaData meta, String catalog, String table)
      throws SQLException {
    List<ColumnSchema> out = new ArrayList<>();
    try (ResultSet rs = meta.getColumns(catalog, schemaPattern, table, "%")) {
      while (rs.next()) {
        out.add(new ColumnSchema(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME")));
      }
    }
    return out;
  }
}
