package com.gentoro.autoreport.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.autoreport.exception.AutoReportErrorCode;
import com.gentoro.autoreport.exception.AutoReportException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonSchemaProviderTest {

  @TempDir Path dir;

  @Test
  void loadsCatalogByDataSourceId() throws Exception {
    Files.writeString(
        dir.resolve("retail.json"),
        "{\"tables\": [{\"name\": \"sales\", \"columns\": ["
            + "{\"name\": \"amount\", \"type\": \"DECIMAL\"},"
            + "{\"name\": \"order_date\", \"type\": \"DATE\"}]}]}",
        StandardCharsets.UTF_8);
    JsonSchemaProvider provider = new JsonSchemaProvider(dir);

    SchemaCatalog catalog = provider.catalog(DataSourceDescriptor.of("retail"));

    assertEquals("retail", catalog.dataSourceId());
    assertTrue(catalog.hasTable("SALES"));
    assertTrue(catalog.table("sales").orElseThrow().column("amount").orElseThrow().isNumeric());
    assertTrue(catalog.hasColumn("order_date"));
    assertSame(catalog, provider.catalog(DataSourceDescriptor.of("retail")));
  }

  @Test
  void missingCatalogIsSchemaLookupError() {
    JsonSchemaProvider provider = new JsonSchemaProvider(dir);
    AutoReportException e =
        assertThrows(
            AutoReportException.class, () -> provider.catalog(DataSourceDescriptor.of("nope")));
    assertEquals(AutoReportErrorCode.SCHEMA_LOOKUP_ERROR, e.getCode());
  }

  @Test
  void invalidJsonIsSchemaLookupError() {
    AutoReportException e =
        assertThrows(AutoReportException.class, () -> JsonSchemaProvider.parse("{tables: ["));
    assertEquals(AutoReportErrorCode.SCHEMA_LOOKUP_ERROR, e.getCode());
  }
}
