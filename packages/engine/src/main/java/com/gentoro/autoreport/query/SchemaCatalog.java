package com.gentoro.autoreport.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative table and column names for one data source. Identifier comparisons are
 * case-insensitive. The query agent only ever substitutes identifiers drawn from here.
 */
public record SchemaCatalog(String dataSourceId, List<TableSchema> tables) {

  public SchemaCatalog {
    tables = tables == null ? List.of() : List.copyOf(tables);
  }

  public Optional<TableSchema> table(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String bare = unqualified(name);
    return tables.stream().filter(t -> t.name().equalsIgnoreCase(bare)).findFirst();
  }

  public boolean hasTable(String name) {
    return table(name).isPresent();
  }

  public boolean hasColumn(String name) {
    return tables.stream().anyMatch(t -> t.hasColumn(unqualified(name)));
  }

  @JsonIgnore
  public boolean isEmpty() {
    return tables.isEmpty();
  }

  /** Strip a schema or table qualifier, e.g. {@code db.sales} becomes {@code sales}. */
  static String unqualified(String identifier) {
    if (identifier == null) {
      return null;
    }
    int dot = identifier.lastIndexOf('.');
    return dot >= 0 ? identifier.substring(dot + 1) : identifier;
  }
}
