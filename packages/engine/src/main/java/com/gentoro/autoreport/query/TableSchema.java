package com.gentoro.autoreport.query;

import java.util.List;
import java.util.Optional;

public record TableSchema(String name, List<ColumnSchema> columns) {

  public TableSchema {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }

  public Optional<ColumnSchema> column(String columnName) {
    if (columnName == null) {
      return Optional.empty();
    }
    return columns.stream().filter(c -> c.name().equalsIgnoreCase(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return column(columnName).isPresent();
  }
}
