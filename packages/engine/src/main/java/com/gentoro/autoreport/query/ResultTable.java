package com.gentoro.autoreport.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tabular query result. Rows hold values in column order; values may be null. */
public record ResultTable(List<String> columns, List<List<Object>> rows) {

  public ResultTable {
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<Object>> copy = new ArrayList<>();
    if (rows != null) {
      for (List<Object> row : rows) {
        copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static ResultTable scalar(String column, Object value) {
    List<Object> row = new ArrayList<>();
    row.add(value);
    return new ResultTable(List.of(column), List.of(row));
  }

  @JsonIgnore
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }

  /** Rows as column-name keyed maps. */
  public List<Map<String, Object>> asMaps() {
    List<Map<String, Object>> out = new ArrayList<>();
    for (List<Object> row : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (int i = 0; i < columns.size() && i < row.size(); i++) {
        m.put(columns.get(i), row.get(i));
      }
      out.add(m);
    }
    return out;
  }
}
