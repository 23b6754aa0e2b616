package com.gentoro.autoreport.orchestrator;

import com.gentoro.autoreport.cache.CacheKey;
import com.gentoro.autoreport.cache.CacheStatistics;
import com.gentoro.autoreport.cache.ResolutionCache;
import com.gentoro.autoreport.config.EngineSettings;
import com.gentoro.autoreport.context.BusinessContext;
import com.gentoro.autoreport.context.ContextAnalysisEngine;
import com.gentoro.autoreport.context.ContextAnalysisResult;
import com.gentoro.autoreport.context.DocumentContext;
import com.gentoro.autoreport.exception.AutoReportErrorCode;
import com.gentoro.autoreport.exception.AutoReportException;
import com.gentoro.autoreport.exception.ErrorDetails;
import com.gentoro.autoreport.exception.ExceptionUtil;
import com.gentoro.autoreport.exception.OrchestrationTimeoutException;
import com.gentoro.autoreport.exception.QueryExecutionException;
import com.gentoro.autoreport.exception.SchemaMismatchException;
import com.gentoro.autoreport.exception.StateException;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.parser.Parameter;
import com.gentoro.autoreport.parser.ParameterValue;
import com.gentoro.autoreport.parser.PlaceholderParser;
import com.gentoro.autoreport.parser.PlaceholderSpec;
import com.gentoro.autoreport.query.DataSourceDescriptor;
import com.gentoro.autoreport.query.QueryAgent;
import com.gentoro.autoreport.query.QueryAttempt;
import com.gentoro.autoreport.query.QueryDraftGenerator;
import com.gentoro.autoreport.query.QueryExecutor;
import com.gentoro.autoreport.query.QueryOutcome;
import com.gentoro.autoreport.query.QueryRequest;
import com.gentoro.autoreport.query.QueryResolution;
import com.gentoro.autoreport.query.SchemaCatalog;
import com.gentoro.autoreport.query.SchemaProvider;
import com.gentoro.autoreport.query.TemplateQueryDraftGenerator;
import com.gentoro.autoreport.semantic.Intent;
import com.gentoro.autoreport.semantic.ParameterKeys;
import com.gentoro.autoreport.semantic.SemanticAnalysis;
import com.gentoro.autoreport.semantic.SemanticAnalyzer;
import com.gentoro.autoreport.weight.LearningKey;
import com.gentoro.autoreport.weight.WeightBreakdown;
import com.gentoro.autoreport.weight.WeightCalculator;
import com.gentoro.autoreport.weight.WeightLearningStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Resolves every placeholder of a document into a {@link ProcessingResult}.
 *
 * <p>Placeholders run on a bounded worker pool ({@code max_workers}, or a single worker when
 * parallel processing is off). Within one placeholder, semantic and context analysis run as two
 * tasks on a separate analysis pool; the weight is computed once both are done, while the query
 * agent starts as soon as the semantic analysis is available. Nested placeholders are resolved
 * before their parent, on the parent's worker.
 *
 * <p>Each placeholder gets its own deadline, counted from the moment a worker picks it up. The
 * document deadline bounds the whole call; placeholders still running when it passes are reported
 * as failed and the result is marked partial.
 */
public class PlaceholderOrchestrator implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(PlaceholderOrchestrator.class);

  private final EngineSettings settings;
  private final PlaceholderParser parser;
  private final SemanticAnalyzer semanticAnalyzer;
  private final ContextAnalysisEngine contextEngine;
  private final WeightCalculator weightCalculator;
  private final WeightLearningStore learningStore;
  private final QueryAgent agent;
  private final SchemaProvider schemaProvider;
  private final DataSourceDescriptor dataSource;
  private final ResolutionCache<QueryResolution> cache;

  private final ExecutorService workers;
  private final ExecutorService analysisPool;
  private final ScheduledExecutorService timer;

  private volatile PerformanceReport lastReport;

  private PlaceholderOrchestrator(Builder b) {
    this.settings = b.settings;
    this.parser = new PlaceholderParser(settings.maxNestingDepth());
    this.semanticAnalyzer = new SemanticAnalyzer(settings.minIntentConfidence());
    this.contextEngine = b.contextEngine != null ? b.contextEngine : new ContextAnalysisEngine();
    this.learningStore =
        b.learningStore != null
            ? b.learningStore
            : new WeightLearningStore(settings.learningRate());
    this.weightCalculator =
        new WeightCalculator(settings.weights(), learningStore, settings.enableDynamicWeights());
    this.agent =
        new QueryAgent(
            b.draftGenerator != null ? b.draftGenerator : new TemplateQueryDraftGenerator(),
            Objects.requireNonNull(b.queryExecutor, "queryExecutor"),
            settings.maxRetryAttempts());
    this.schemaProvider = Objects.requireNonNull(b.schemaProvider, "schemaProvider");
    this.dataSource = Objects.requireNonNull(b.dataSource, "dataSource");
    this.cache =
        b.cache != null
            ? b.cache
            : new ResolutionCache<>(QueryResolution::succeeded, r -> !r.cancelled());

    int workerCount = settings.parallelProcessing() ? settings.maxWorkers() : 1;
    this.workers = Executors.newFixedThreadPool(workerCount, named("autoreport-worker"));
    this.analysisPool =
        Executors.newFixedThreadPool(Math.max(2, workerCount * 2), named("autoreport-analysis"));
    this.timer = Executors.newSingleThreadScheduledExecutor(named("autoreport-deadline"));
  }

  public static Builder builder(EngineSettings settings) {
    return new Builder(settings);
  }

  public EngineSettings settings() {
    return settings;
  }

  public WeightLearningStore learningStore() {
    return learningStore;
  }

  public CacheStatistics cacheStatistics() {
    return cache.statistics();
  }

  /** Report of the most recently completed document, if any. */
  public Optional<PerformanceReport> lastPerformanceReport() {
    return Optional.ofNullable(lastReport);
  }

  /**
   * Process a document. Never throws for placeholder-level problems; parse errors, failed queries
   * and timeouts are reported per placeholder.
   *
   * @throws StateException when called after {@link #close()}
   */
  public ProcessingResult processDocument(
      String text, DocumentContext document, BusinessContext business) {
    long started = System.nanoTime();
    DocumentRun run =
        new DocumentRun(
            document == null ? DocumentContext.empty() : document,
            business == null ? BusinessContext.empty() : business,
            new StageTimer());
    CacheStatistics cacheBefore = cache.statistics();

    List<PlaceholderSpec> specs = run.timer.time(ProcessingStage.PARSE, () -> parser.parse(text));
    log.info("Processing document with {} placeholder(s)", specs.size());
    if (specs.stream().anyMatch(s -> !s.hasError())) {
      loadCatalog(run);
    }

    List<PlaceholderTask> tasks = new ArrayList<>(specs.size());
    for (int i = 0; i < specs.size(); i++) {
      tasks.add(submit(i, specs.get(i), run));
    }

    boolean partial = awaitAll(tasks, started);
    List<ResolvedPlaceholder> results = new ArrayList<>(specs.size());
    for (int i = 0; i < specs.size(); i++) {
      PlaceholderTask task = tasks.get(i);
      if (!task.result.isDone()) {
        OrchestrationTimeoutException timeout =
            new OrchestrationTimeoutException(
                "document deadline exceeded", settings.documentTimeout());
        // late completions are ignored from here on
        task.abort(failure(i, specs.get(i), ExceptionUtil.toErrorDetails(timeout)));
      }
      results.add(task.result.join());
    }

    double quality = ProcessingResult.qualityScore(results);
    PerformanceReport report = report(results, run, cacheBefore, started, partial);
    lastReport = report;
    log.info(
        "Document processed in {} ms: {} succeeded, {} failed, quality {}{}",
        report.totalMillis(),
        report.succeeded(),
        report.failed(),
        quality,
        partial ? " (partial)" : "");
    return new ProcessingResult(results, quality, partial, report);
  }

  private void loadCatalog(DocumentRun run) {
    try {
      run.catalog =
          run.timer.time(ProcessingStage.SCHEMA, () -> schemaProvider.catalog(dataSource));
    } catch (RuntimeException e) {
      run.catalogFailure = ExceptionUtil.extractErrorMessage(e);
      log.warn("Schema lookup for {} failed: {}", dataSource.id(), run.catalogFailure);
    }
  }

  private PlaceholderTask submit(int index, PlaceholderSpec spec, DocumentRun run) {
    PlaceholderTask task = new PlaceholderTask();
    Duration limit = settings.placeholderTimeout();
    Future<?> worker;
    try {
      worker =
          workers.submit(
              () -> {
                if (task.cancel.get() || task.result.isDone()) {
                  return;
                }
                ScheduledFuture<?> deadline =
                    timer.schedule(
                        () -> {
                          OrchestrationTimeoutException timeout =
                              new OrchestrationTimeoutException(
                                  "placeholder timed out after " + limit.toMillis() + " ms",
                                  limit);
                          if (task.abort(
                              failure(index, spec, ExceptionUtil.toErrorDetails(timeout)))) {
                            log.warn("Placeholder '{}' timed out", spec.rawText());
                          }
                        },
                        limit.toMillis(),
                        TimeUnit.MILLISECONDS);
                try {
                  task.result.complete(resolve(index, spec, run, task.cancel));
                } catch (RuntimeException e) {
                  if (task.cancel.get()) {
                    log.debug("'{}' stopped after cancellation: {}", spec.rawText(), e.toString());
                  } else {
                    log.error("Unexpected failure resolving '{}'", spec.rawText(), e);
                  }
                  task.result.complete(failure(index, spec, ExceptionUtil.toErrorDetails(e)));
                } finally {
                  deadline.cancel(false);
                }
              });
    } catch (RejectedExecutionException e) {
      throw new StateException("Orchestrator has been closed");
    }
    task.attach(worker);
    return task;
  }

  private boolean awaitAll(List<PlaceholderTask> tasks, long started) {
    long remaining = settings.documentTimeout().toNanos() - (System.nanoTime() - started);
    try {
      CompletableFuture.allOf(tasks.stream().map(t -> t.result).toArray(CompletableFuture[]::new))
          .get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
      return false;
    } catch (TimeoutException e) {
      log.warn(
          "Document deadline of {} exceeded, returning partial result",
          settings.documentTimeout());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for placeholders, returning partial result");
      return true;
    } catch (ExecutionException e) {
      // placeholder futures are always completed normally
      throw new IllegalStateException(e.getCause());
    }
  }

  /** Full pipeline for one spec, nested specs first. Runs on a worker thread. */
  private ResolvedPlaceholder resolve(
      int index, PlaceholderSpec spec, DocumentRun run, AtomicBoolean cancel) {
    if (spec.hasError()) {
      return new ResolvedPlaceholder(
          index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.PARSE_ERROR,
          null, 0.0, 0.0, null, null, List.of(), List.of(), spec.errors(), null);
    }

    Optional<ParameterValue.Condition> condition = spec.condition();
    if (condition.isPresent() && !conditionHolds(condition.get(), run.document)) {
      log.debug("Skipping '{}': condition '{}' is false", spec.rawText(), condition.get().source());
      return new ResolvedPlaceholder(
          index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.SKIPPED,
          null, 0.0, 0.0, null, null, List.of(), List.of(), List.of(), null);
    }

    List<ResolvedPlaceholder> children = new ArrayList<>();
    for (PlaceholderSpec child : spec.children()) {
      ResolvedPlaceholder resolved = resolve(index, child, run, cancel);
      children.add(resolved);
      if (resolved.failed()) {
        QueryExecutionException e =
            new QueryExecutionException("nested placeholder failed: " + child.rawText());
        return new ResolvedPlaceholder(
            index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.FAILED,
            null, 0.0, 0.0, null, null, List.of(), children, List.of(),
            ExceptionUtil.toErrorDetails(e));
      }
    }

    LearningKey key = new LearningKey(run.document.documentType(), spec.type());
    CompletableFuture<SemanticAnalysis> semanticF =
        CompletableFuture.supplyAsync(
            () -> run.timer.time(ProcessingStage.SEMANTIC, () -> semantic(spec, run)),
            analysisPool);
    CompletableFuture<ContextAnalysisResult> contextF =
        CompletableFuture.supplyAsync(
            () -> run.timer.time(ProcessingStage.CONTEXT, () -> context(spec, run)), analysisPool);
    CompletableFuture<WeightBreakdown> weightF =
        semanticF.thenCombine(
            contextF,
            (sem, ctx) ->
                run.timer.time(
                    ProcessingStage.WEIGHT, () -> weightCalculator.calculate(sem, ctx, key)));

    SemanticAnalysis semantic = semanticF.join();
    QueryResolution resolution =
        run.timer.time(
            ProcessingStage.QUERY,
            () -> query(spec, semantic, spec.children(), children, run, cancel));
    WeightBreakdown breakdown = weightF.join();

    if (settings.enableLearning() && !cancel.get()) {
      learningStore.recordFeedback(key, breakdown, resolution.succeeded());
    }

    if (resolution.succeeded()) {
      return new ResolvedPlaceholder(
          index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.SUCCEEDED,
          resolution.value(), breakdown.finalWeight(), resolution.confidence(), semantic,
          breakdown, resolution.attempts(), children, List.of(), null);
    }
    AutoReportException e = failureOf(resolution);
    return new ResolvedPlaceholder(
        index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.FAILED, null,
        breakdown.finalWeight(), 0.0, semantic, breakdown, resolution.attempts(), children,
        List.of(), ExceptionUtil.toErrorDetails(e));
  }

  private static AutoReportException failureOf(QueryResolution resolution) {
    List<QueryAttempt> attempts = resolution.attempts();
    QueryOutcome last = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).outcome();
    AutoReportException e =
        last instanceof QueryOutcome.SchemaError schemaError
            ? new SchemaMismatchException(schemaError.identifier(), resolution.failureReason())
            : new QueryExecutionException(resolution.failureReason());
    return e.withContext("attempts", attempts.size());
  }

  private SemanticAnalysis semantic(PlaceholderSpec spec, DocumentRun run) {
    if (!settings.enableSemanticAnalysis()) {
      return semanticAnalyzer.declaredOnly(spec, run.document);
    }
    return semanticAnalyzer.analyze(spec, run.document, run.business);
  }

  private ContextAnalysisResult context(PlaceholderSpec spec, DocumentRun run) {
    if (!settings.enableContextAnalysis()) {
      return ContextAnalysisResult.neutral("context analysis disabled");
    }
    return contextEngine.analyze(spec, run.document, run.business);
  }

  private QueryResolution query(
      PlaceholderSpec spec,
      SemanticAnalysis semantic,
      List<PlaceholderSpec> childSpecs,
      List<ResolvedPlaceholder> children,
      DocumentRun run,
      AtomicBoolean cancel) {
    if (run.catalog == null) {
      return QueryResolution.failed("schema lookup failed: " + run.catalogFailure, List.of());
    }
    Map<String, String> parameters = new LinkedHashMap<>(semantic.parameterValues());
    parameters.putAll(nestedParameters(spec, childSpecs, children));
    QueryRequest request =
        new QueryRequest(spec.displayName(), semantic.intent(), semantic.metric(), parameters);
    SchemaCatalog catalog = run.catalog;
    if (!settings.cacheEnabled()) {
      return agent.resolve(request, catalog, dataSource, cancel::get);
    }
    CacheKey key = CacheKey.of(spec.contentHash(), dataSource.id(), parameters);
    return cache.getOrCompute(key, () -> agent.resolve(request, catalog, dataSource, cancel::get));
  }

  /**
   * Values of resolved nested specs, as parameters of the parent. A nested spec in a parameter
   * position supplies that parameter; one in the name position supplies the region or time range
   * when its intent is a region or a period.
   */
  private static Map<String, String> nestedParameters(
      PlaceholderSpec spec, List<PlaceholderSpec> childSpecs, List<ResolvedPlaceholder> children) {
    Map<String, String> out = new LinkedHashMap<>();
    for (int i = 0; i < childSpecs.size() && i < children.size(); i++) {
      PlaceholderSpec childSpec = childSpecs.get(i);
      ResolvedPlaceholder child = children.get(i);
      if (!child.succeeded() || child.value() == null) {
        continue;
      }
      String value = String.valueOf(child.value());
      if (childSpec == spec.nested()) {
        Intent intent = child.semantic() == null ? Intent.UNKNOWN : child.semantic().intent();
        if (intent == Intent.REGION) {
          out.put(ParameterKeys.REGION, value);
        } else if (intent == Intent.PERIOD) {
          out.put(ParameterKeys.TIME_RANGE, value);
        }
        continue;
      }
      for (Parameter p : spec.parameters()) {
        if (p.value() instanceof ParameterValue.Nested n && n.spec() == childSpec) {
          out.put(ParameterKeys.canonical(p.key()), value);
        }
      }
    }
    return out;
  }

  private static boolean conditionHolds(ParameterValue.Condition condition, DocumentContext doc) {
    try {
      return condition.expression().evaluate(doc.variables());
    } catch (RuntimeException e) {
      log.warn("Condition '{}' could not be evaluated: {}", condition.source(), e.getMessage());
      return false;
    }
  }

  private static ResolvedPlaceholder failure(int index, PlaceholderSpec spec, ErrorDetails error) {
    return new ResolvedPlaceholder(
        index, spec.rawText(), spec.offset(), spec.displayName(), ResolutionStatus.FAILED, null,
        0.0, 0.0, null, null, List.of(), List.of(), List.of(), error);
  }

  private PerformanceReport report(
      List<ResolvedPlaceholder> results,
      DocumentRun run,
      CacheStatistics before,
      long started,
      boolean partial) {
    CacheStatistics after = cache.statistics();
    long hits = after.hits() - before.hits();
    long misses = after.misses() - before.misses();
    long coalesced = after.coalesced() - before.coalesced();
    long lookups = hits + misses + coalesced;
    int timedOut =
        (int)
            results.stream()
                .filter(
                    r ->
                        r.error() != null
                            && r.error().code() == AutoReportErrorCode.ORCHESTRATION_TIMEOUT)
                .count();
    return new PerformanceReport(
        (System.nanoTime() - started) / 1_000_000,
        run.timer.millis(),
        results.size(),
        count(results, ResolutionStatus.SUCCEEDED),
        count(results, ResolutionStatus.FAILED),
        count(results, ResolutionStatus.SKIPPED),
        count(results, ResolutionStatus.PARSE_ERROR),
        timedOut,
        hits,
        misses,
        coalesced,
        lookups == 0 ? 0.0 : (double) (hits + coalesced) / lookups,
        partial);
  }

  private static int count(List<ResolvedPlaceholder> results, ResolutionStatus status) {
    return (int) results.stream().filter(r -> r.status() == status).count();
  }

  @Override
  public void close() {
    workers.shutdownNow();
    analysisPool.shutdownNow();
    timer.shutdownNow();
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** One submitted placeholder: its outcome, its cancellation flag and the worker running it. */
  private static final class PlaceholderTask {
    final CompletableFuture<ResolvedPlaceholder> result = new CompletableFuture<>();
    final AtomicBoolean cancel = new AtomicBoolean();
    private volatile Future<?> worker;

    void attach(Future<?> worker) {
      this.worker = worker;
      // aborted before the handle was attached
      if (cancel.get()) {
        worker.cancel(true);
      }
    }

    /**
     * Complete with {@code outcome} and stop the worker, interrupting a blocked query. Returns
     * false when the placeholder had already completed.
     */
    boolean abort(ResolvedPlaceholder outcome) {
      if (!result.complete(outcome)) {
        return false;
      }
      cancel.set(true);
      Future<?> running = worker;
      if (running != null) {
        running.cancel(true);
      }
      return true;
    }
  }

  /** Per-call state shared by the placeholder pipelines of one document. */
  private static final class DocumentRun {
    final DocumentContext document;
    final BusinessContext business;
    final StageTimer timer;
    volatile SchemaCatalog catalog;
    volatile String catalogFailure;

    DocumentRun(DocumentContext document, BusinessContext business, StageTimer timer) {
      this.document = document;
      this.business = business;
      this.timer = timer;
    }
  }

  public static final class Builder {
    private final EngineSettings settings;
    private SchemaProvider schemaProvider;
    private QueryExecutor queryExecutor;
    private DataSourceDescriptor dataSource;
    private QueryDraftGenerator draftGenerator;
    private WeightLearningStore learningStore;
    private ResolutionCache<QueryResolution> cache;
    private ContextAnalysisEngine contextEngine;

    private Builder(EngineSettings settings) {
      this.settings = settings == null ? EngineSettings.defaults() : settings;
    }

    public Builder schemaProvider(SchemaProvider v) {
      this.schemaProvider = v;
      return this;
    }

    public Builder queryExecutor(QueryExecutor v) {
      this.queryExecutor = v;
      return this;
    }

    public Builder dataSource(DataSourceDescriptor v) {
      this.dataSource = v;
      return this;
    }

    public Builder draftGenerator(QueryDraftGenerator v) {
      this.draftGenerator = v;
      return this;
    }

    /** Share learned weights with other orchestrators. */
    public Builder learningStore(WeightLearningStore v) {
      this.learningStore = v;
      return this;
    }

    /** Share resolved values with other orchestrators. */
    public Builder cache(ResolutionCache<QueryResolution> v) {
      this.cache = v;
      return this;
    }

    public Builder contextEngine(ContextAnalysisEngine v) {
      this.contextEngine = v;
      return this;
    }

    public PlaceholderOrchestrator build() {
      return new PlaceholderOrchestrator(this);
    }
  }
}
