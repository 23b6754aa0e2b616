package com.gentoro.autoreport.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.autoreport.exception.ErrorDetails;
import com.gentoro.autoreport.parser.ParseError;
import com.gentoro.autoreport.query.QueryAttempt;
import com.gentoro.autoreport.semantic.SemanticAnalysis;
import com.gentoro.autoreport.weight.WeightBreakdown;
import java.util.List;

/**
 * Outcome for one placeholder occurrence.
 *
 * @param index position of the placeholder in document order
 * @param confidence resolution confidence in [0,1]; 0 unless succeeded
 * @param children results of nested placeholders, resolved before this one
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ResolvedPlaceholder(
    int index,
    String rawText,
    int offset,
    String name,
    ResolutionStatus status,
    Object value,
    double weight,
    double confidence,
    SemanticAnalysis semantic,
    WeightBreakdown weightBreakdown,
    List<QueryAttempt> attempts,
    List<ResolvedPlaceholder> children,
    List<ParseError> parseErrors,
    ErrorDetails error) {

  public ResolvedPlaceholder {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
    children = children == null ? List.of() : List.copyOf(children);
    parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
  }

  public boolean succeeded() {
    return status == ResolutionStatus.SUCCEEDED;
  }

  /** Failed or unparseable. */
  public boolean failed() {
    return status == ResolutionStatus.FAILED || status == ResolutionStatus.PARSE_ERROR;
  }
}
