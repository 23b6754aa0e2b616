package com.gentoro.autoreport.query;

import java.util.Locale;

/**
 * A column of a catalog table.
 *
 * @param type SQL type name as reported by the data source, e.g. {@code DECIMAL} or {@code DATE}
 */
public record ColumnSchema(String name, String type) {

  public ColumnSchema {
    type = type == null ? "" : type;
  }

  public boolean isNumeric() {
    String t = type.toUpperCase(Locale.ROOT);
    return t.contains("INT")
        || t.contains("DEC")
        || t.contains("NUM")
        || t.contains("DOUBLE")
        || t.contains("FLOAT")
        || t.contains("REAL")
        || t.contains("MONEY");
  }

  public boolean isTemporal() {
    String t = type.toUpperCase(Locale.ROOT);
    return t.contains("DATE") || t.contains("TIME");
  }
}
