package com.gentoro.autoreport.query;

import java.util.List;
import java.util.Set;

/**
 * What went wrong with earlier attempts, handed to the generator on a redraft.
 *
 * @param problem latest non-schema problem (syntax error or shape mismatch), null on first draft
 * @param rejectedIdentifiers identifiers the data source already refused in this session
 */
public record DraftFeedback(
    List<QueryAttempt> history, Set<String> rejectedIdentifiers, String problem) {

  public DraftFeedback {
    history = history == null ? List.of() : List.copyOf(history);
    rejectedIdentifiers = rejectedIdentifiers == null ? Set.of() : Set.copyOf(rejectedIdentifiers);
  }

  public static DraftFeedback none() {
    return new DraftFeedback(List.of(), Set.of(), null);
  }

  /** Number of redrafts caused by syntax errors or shape mismatches so far. */
  public int redrafts() {
    return (int)
        history.stream()
            .filter(
                a ->
                    a.outcome() instanceof QueryOutcome.ExecutionError e
                            && e.kind() == ExecutionErrorKind.SYNTAX
                        || a.shapeMismatch() != null)
            .count();
  }
}
