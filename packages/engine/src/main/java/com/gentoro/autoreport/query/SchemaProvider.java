package com.gentoro.autoreport.query;

/** Collaborator returning the valid tables and columns of a data source. */
@FunctionalInterface
public interface SchemaProvider {

  /**
   * @throws com.gentoro.autoreport.exception.AutoReportException with code {@code
   *     SCHEMA_LOOKUP_ERROR} when the catalog cannot be read
   */
  SchemaCatalog catalog(DataSourceDescriptor dataSource);
}
