package com.gentoro.autoreport.query;

import java.util.Optional;

/** Checks a non-empty result against the shape its intent expects. */
public class ResultShapeValidator {

  /** @return a description of the mismatch, or empty when the shape fits */
  public Optional<String> validate(ResultTable table, ResultShape expected) {
    return switch (expected) {
      case SCALAR ->
          table.rowCount() == 1 && table.columnCount() == 1
              ? Optional.empty()
              : Optional.of(
                  String.format(
                      "expected a single scalar but got %d row(s) x %d column(s)",
                      table.rowCount(), table.columnCount()));
      case SINGLE_ROW ->
          table.rowCount() == 1
              ? Optional.empty()
              : Optional.of("expected a single row but got " + table.rowCount());
      case SERIES ->
          table.columnCount() >= 2
              ? Optional.empty()
              : Optional.of(
                  "expected a series with key and value columns but got "
                      + table.columnCount()
                      + " column(s)");
      case ROW_SET ->
          table.columnCount() >= 1 ? Optional.empty() : Optional.of("result has no columns");
    };
  }

  /** Extract the placeholder value from a result already known to fit {@code shape}. */
  public Object extractValue(ResultTable table, ResultShape shape) {
    return switch (shape) {
      case SCALAR -> table.rows().get(0).get(0);
      case SINGLE_ROW -> table.asMaps().get(0);
      case SERIES, ROW_SET -> table.asMaps();
    };
  }
}
