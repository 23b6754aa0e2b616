package com.gentoro.autoreport.query;

import com.gentoro.autoreport.exception.AutoReportErrorCode;
import com.gentoro.autoreport.exception.AutoReportException;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Reads catalogs from {@code <directory>/<dataSourceId>.json}. Files are parsed once and kept.
 *
 * <pre>{@code
 * {"dataSourceId": "retail",
 *  "tables": [{"name": "sales", "columns": [{"name": "amount", "type": "DECIMAL"}]}]}
 * }</pre>
 */
public class JsonSchemaProvider implements SchemaProvider {
  private static final Logger log = LoggingService.getLogger(JsonSchemaProvider.class);

  private final Path directory;
  private final Map<String, SchemaCatalog> loaded = new ConcurrentHashMap<>();

  public JsonSchemaProvider(Path directory) {
    this.directory = directory;
  }

  @Override
  public SchemaCatalog catalog(DataSourceDescriptor dataSource) {
    return loaded.computeIfAbsent(dataSource.id(), this::load);
  }

  public static SchemaCatalog parse(String json) {
    try {
      return JacksonUtility.getJsonMapper().readValue(json, SchemaCatalog.class);
    } catch (IOException e) {
      throw new AutoReportException(
          AutoReportErrorCode.SCHEMA_LOOKUP_ERROR, "Invalid schema catalog JSON", e);
    }
  }

  private SchemaCatalog load(String id) {
    Path file = directory.resolve(id + ".json");
    if (!Files.isRegularFile(file)) {
      throw new AutoReportException(
              AutoReportErrorCode.SCHEMA_LOOKUP_ERROR, "No schema catalog for data source " + id)
          .withContext("path", file.toString());
    }
    try {
      SchemaCatalog catalog =
          JacksonUtility.getJsonMapper().readValue(file.toFile(), SchemaCatalog.class);
      log.debug("Loaded schema catalog {} with {} tables", id, catalog.tables().size());
      return catalog.dataSourceId() == null ? new SchemaCatalog(id, catalog.tables()) : catalog;
    } catch (IOException e) {
      throw new AutoReportException(
              AutoReportErrorCode.SCHEMA_LOOKUP_ERROR, "Failed to read schema catalog " + file, e)
          .withContext("path", file.toString());
    }
  }
}
