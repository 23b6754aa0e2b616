package com.gentoro.autoreport.query;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Terminal result of a query agent session.
 *
 * @param state {@link AgentState#SUCCEEDED} or {@link AgentState#FAILED}
 * @param value extracted value: a scalar, a row map or a list of row maps; null when the query
 *     returned no rows or the session failed
 * @param confidence 1.0 for a clean first-attempt success, lower with every retry, 0 on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResolution(
    AgentState state,
    Object value,
    List<QueryAttempt> attempts,
    String failureReason,
    double confidence) {

  static final String CANCELLED = "cancelled";

  public QueryResolution {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  public boolean succeeded() {
    return state == AgentState.SUCCEEDED;
  }

  /** Session stopped because its caller gave up, not because of the data source. */
  @JsonIgnore
  public boolean cancelled() {
    return state == AgentState.FAILED && CANCELLED.equals(failureReason);
  }

  public static QueryResolution failed(String reason, List<QueryAttempt> attempts) {
    return new QueryResolution(AgentState.FAILED, null, attempts, reason, 0.0);
  }
}
