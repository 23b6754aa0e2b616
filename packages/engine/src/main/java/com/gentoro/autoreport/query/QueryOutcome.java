package com.gentoro.autoreport.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Structured result of executing one query. The variant decides the agent's next state: schema
 * errors lead to correction, execution errors to a retry or failure, and an empty result is a
 * data error.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
@JsonSubTypes({
  @JsonSubTypes.Type(value = QueryOutcome.Success.class, name = "success"),
  @JsonSubTypes.Type(value = QueryOutcome.SchemaError.class, name = "schema_error"),
  @JsonSubTypes.Type(value = QueryOutcome.ExecutionError.class, name = "execution_error"),
  @JsonSubTypes.Type(value = QueryOutcome.DataError.class, name = "data_error")
})
public sealed interface QueryOutcome {

  String message();

  record Success(ResultTable table) implements QueryOutcome {
    @Override
    public String message() {
      return table.rowCount() + " row(s)";
    }
  }

  /** The data source rejected an identifier; {@code identifier} is null when it was not named. */
  record SchemaError(String identifier, IdentifierKind kind, String message)
      implements QueryOutcome {}

  record ExecutionError(ExecutionErrorKind kind, String message) implements QueryOutcome {}

  /** The query ran but produced no rows. */
  record DataError(String message) implements QueryOutcome {}

  static QueryOutcome success(ResultTable table) {
    return table.isEmpty() ? new DataError("query returned no rows") : new Success(table);
  }
}
