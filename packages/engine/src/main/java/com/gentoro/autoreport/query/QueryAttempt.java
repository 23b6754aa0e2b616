package com.gentoro.autoreport.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One execution of a query within a placeholder's session.
 *
 * @param ordinal 1-based attempt number
 * @param offendingIdentifier identifier rejected by the data source, for schema errors
 * @param correctedIdentifier catalog identifier substituted for the offending one, if any
 * @param shapeMismatch set when the query ran but its result did not fit the intent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryAttempt(
    int ordinal,
    String query,
    QueryOutcome outcome,
    String offendingIdentifier,
    String correctedIdentifier,
    String shapeMismatch,
    long durationMillis) {

  QueryAttempt withCorrection(String offending, String corrected) {
    return new QueryAttempt(
        ordinal, query, outcome, offending, corrected, shapeMismatch, durationMillis);
  }

  QueryAttempt withShapeMismatch(String mismatch) {
    return new QueryAttempt(
        ordinal,
        query,
        outcome,
        offendingIdentifier,
        correctedIdentifier,
        mismatch,
        durationMillis);
  }
}
