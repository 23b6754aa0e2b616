package com.gentoro.autoreport.query;

import com.gentoro.autoreport.exception.ExceptionUtil;
import com.gentoro.autoreport.logging.LoggingService;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;

/**
 * Drives one placeholder from a drafted query to a validated value.
 *
 * <pre>
 *   DRAFT -> EXECUTING -> VALIDATING -> SUCCEEDED
 *              |  ^           |
 *              v  |           v
 *           CORRECTING      DRAFT (shape mismatch, syntax error)
 * </pre>
 *
 * <p>The loop is sequential and bounded: at most {@code maxAttempts} executions per session.
 * Identifiers rejected by the data source are remembered for the session; a query that still
 * references one is corrected before it can run, and a query identical to one that just failed
 * with a schema error is never executed.
 */
public class QueryAgent {
  private static final Logger log = LoggingService.getLogger(QueryAgent.class);

  private final QueryDraftGenerator generator;
  private final QueryExecutor executor;
  private final IdentifierCorrector corrector;
  private final ResultShapeValidator validator;
  private final int maxAttempts;

  public QueryAgent(QueryDraftGenerator generator, QueryExecutor executor, int maxAttempts) {
    this(generator, executor, new IdentifierCorrector(), new ResultShapeValidator(), maxAttempts);
  }

  public QueryAgent(
      QueryDraftGenerator generator,
      QueryExecutor executor,
      IdentifierCorrector corrector,
      ResultShapeValidator validator,
      int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.generator = generator;
    this.executor = executor;
    this.corrector = corrector;
    this.validator = validator;
    this.maxAttempts = maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public QueryResolution resolve(
      QueryRequest request, SchemaCatalog catalog, DataSourceDescriptor dataSource) {
    return resolve(request, catalog, dataSource, () -> false);
  }

  /**
   * Run a session to a terminal state.
   *
   * @param cancelled polled between states; when it returns true the session fails
   */
  public QueryResolution resolve(
      QueryRequest request,
      SchemaCatalog catalog,
      DataSourceDescriptor dataSource,
      BooleanSupplier cancelled) {
    if (catalog == null || catalog.isEmpty()) {
      return QueryResolution.failed(
          "schema catalog is empty; refusing to guess identifiers", List.of());
    }
    Session session = new Session(request, catalog, dataSource);
    while (!session.state.isTerminal()) {
      if (cancelled.getAsBoolean()) {
        session.fail(QueryResolution.CANCELLED);
        break;
      }
      AgentState before = session.state;
      switch (session.state) {
        case DRAFT -> session.draft();
        case EXECUTING -> session.execute();
        case VALIDATING -> session.validate();
        case CORRECTING -> session.correct();
        default -> throw new IllegalStateException("Unexpected state " + session.state);
      }
      log.debug("'{}': {} -> {}", request.placeholderName(), before, session.state);
    }
    QueryResolution resolution = session.result();
    if (resolution.succeeded()) {
      log.info(
          "Resolved '{}' after {} attempt(s)",
          request.placeholderName(),
          resolution.attempts().size());
    } else {
      log.warn(
          "Failed to resolve '{}' after {} attempt(s): {}",
          request.placeholderName(),
          resolution.attempts().size(),
          resolution.failureReason());
    }
    return resolution;
  }

  /** Mutable state of one session; confined to the calling thread. */
  private final class Session {
    private final QueryRequest request;
    private final SchemaCatalog catalog;
    private final DataSourceDescriptor dataSource;
    private final List<QueryAttempt> attempts = new ArrayList<>();
    private final Set<String> rejected = new LinkedHashSet<>();

    private AgentState state = AgentState.DRAFT;
    private String query;
    private String problem;
    private String pendingOffender;
    private Object value;
    private double confidence;
    private String failureReason;

    Session(QueryRequest request, SchemaCatalog catalog, DataSourceDescriptor dataSource) {
      this.request = request;
      this.catalog = catalog;
      this.dataSource = dataSource;
    }

    void draft() {
      String drafted;
      try {
        drafted =
            generator.draft(request, catalog, new DraftFeedback(attempts, rejected, problem));
      } catch (RuntimeException e) {
        fail("draft generation failed: " + ExceptionUtil.extractErrorMessage(e));
        return;
      }
      if (drafted == null || drafted.isBlank()) {
        fail("draft generator produced no query");
        return;
      }
      QueryAttempt last = lastAttempt();
      if (last != null && drafted.trim().equals(last.query().trim())) {
        fail("redraft is identical to attempt " + last.ordinal());
        return;
      }
      query = drafted.trim();
      state = AgentState.EXECUTING;
    }

    void execute() {
      Optional<String> stale =
          rejected.stream().filter(id -> IdentifierCorrector.references(query, id)).findFirst();
      if (stale.isPresent()) {
        pendingOffender = stale.get();
        state = AgentState.CORRECTING;
        return;
      }
      QueryAttempt last = lastAttempt();
      if (last != null
          && last.outcome() instanceof QueryOutcome.SchemaError
          && query.equals(last.query())) {
        fail("refusing to resubmit the query rejected in attempt " + last.ordinal());
        return;
      }
      if (attempts.size() >= maxAttempts) {
        fail("retry budget exhausted after " + attempts.size() + " attempt(s)");
        return;
      }

      long started = System.nanoTime();
      QueryOutcome outcome;
      try {
        outcome = executor.execute(query, dataSource);
      } catch (RuntimeException e) {
        outcome =
            new QueryOutcome.ExecutionError(
                ExecutionErrorKind.UNKNOWN, ExceptionUtil.extractErrorMessage(e));
      }
      if (outcome == null) {
        outcome =
            new QueryOutcome.ExecutionError(
                ExecutionErrorKind.UNKNOWN, "executor returned no outcome");
      }
      long elapsed = (System.nanoTime() - started) / 1_000_000;
      attempts.add(
          new QueryAttempt(attempts.size() + 1, query, outcome, null, null, null, elapsed));

      if (outcome instanceof QueryOutcome.Success) {
        state = AgentState.VALIDATING;
      } else if (outcome instanceof QueryOutcome.SchemaError schemaError) {
        log.warn(
            "Schema mismatch for '{}' on attempt {}: {}",
            request.placeholderName(),
            attempts.size(),
            schemaError.message());
        pendingOffender = schemaError.identifier();
        state = AgentState.CORRECTING;
      } else if (outcome instanceof QueryOutcome.DataError) {
        // ran fine but matched nothing: a resolved, empty value
        value = null;
        confidence = 0.5 * attemptFactor();
        state = AgentState.SUCCEEDED;
      } else if (outcome instanceof QueryOutcome.ExecutionError error) {
        onExecutionError(error);
      }
    }

    private void onExecutionError(QueryOutcome.ExecutionError error) {
      switch (error.kind()) {
        case TIMEOUT -> {
          log.warn("Query for '{}' timed out, retrying", request.placeholderName());
          state = AgentState.EXECUTING;
        }
        case SYNTAX, UNKNOWN -> {
          problem = error.kind() + ": " + error.message();
          state = AgentState.DRAFT;
        }
        case PERMISSION, CONNECTION -> fail(error.kind() + ": " + error.message());
      }
    }

    void validate() {
      QueryOutcome.Success success = (QueryOutcome.Success) lastAttempt().outcome();
      ResultShape expected = request.expectedShape();
      Optional<String> mismatch = validator.validate(success.table(), expected);
      if (mismatch.isPresent()) {
        log.warn("Result shape mismatch for '{}': {}", request.placeholderName(), mismatch.get());
        replaceLast(lastAttempt().withShapeMismatch(mismatch.get()));
        problem = "shape mismatch: " + mismatch.get();
        state = AgentState.DRAFT;
        return;
      }
      value = validator.extractValue(success.table(), expected);
      confidence = attemptFactor();
      state = AgentState.SUCCEEDED;
    }

    void correct() {
      String offending = pendingOffender;
      IdentifierKind kind;
      if (offending == null || offending.isBlank()) {
        Optional<IdentifierCorrector.QueryIdentifier> unknown =
            corrector.findUnknown(query, catalog);
        if (unknown.isEmpty()) {
          fail("schema error without an identifiable offending identifier");
          return;
        }
        offending = unknown.get().name();
        kind = unknown.get().kind();
      } else {
        QueryAttempt last = lastAttempt();
        kind = corrector.classify(offending, query);
        if (last != null
            && last.outcome() instanceof QueryOutcome.SchemaError se
            && se.kind() != IdentifierKind.UNKNOWN
            && offending.equals(se.identifier())) {
          kind = se.kind();
        }
      }
      pendingOffender = null;
      rejected.add(offending);

      Optional<String> replacement =
          corrector.replacementFor(offending, kind, query, catalog, rejected, request);
      if (replacement.isEmpty()) {
        String what = kind.name().toLowerCase(Locale.ROOT);
        fail("no catalog " + what + " can replace '" + offending + "'");
        return;
      }
      String corrected = IdentifierCorrector.substitute(query, offending, replacement.get());
      if (corrected.equals(query)) {
        fail("correction of '" + offending + "' did not change the query");
        return;
      }
      QueryAttempt last = lastAttempt();
      if (last != null && last.query().equals(query) && last.offendingIdentifier() == null) {
        replaceLast(last.withCorrection(offending, replacement.get()));
      }
      log.info(
          "Correcting '{}': {} '{}' -> '{}'",
          request.placeholderName(),
          kind.name().toLowerCase(Locale.ROOT),
          offending,
          replacement.get());
      query = corrected;
      state = AgentState.EXECUTING;
    }

    void fail(String reason) {
      failureReason = reason;
      state = AgentState.FAILED;
    }

    QueryResolution result() {
      if (state == AgentState.SUCCEEDED) {
        return new QueryResolution(AgentState.SUCCEEDED, value, attempts, null, confidence);
      }
      return QueryResolution.failed(failureReason, attempts);
    }

    private double attemptFactor() {
      return Math.max(0.4, 1.0 - 0.15 * (attempts.size() - 1));
    }

    private QueryAttempt lastAttempt() {
      return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    }

    private void replaceLast(QueryAttempt attempt) {
      attempts.set(attempts.size() - 1, attempt);
    }
  }
}
