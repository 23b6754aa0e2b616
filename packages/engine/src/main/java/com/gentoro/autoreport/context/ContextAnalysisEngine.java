package com.gentoro.autoreport.context;

import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;

/**
 * Runs the four scope analyzers for a placeholder. With an executor the analyzers run
 * concurrently; without one they run on the calling thread.
 */
public class ContextAnalysisEngine {
  private static final Logger log = LoggingService.getLogger(ContextAnalysisEngine.class);

  private final List<ScopeAnalyzer> analyzers;

  public ContextAnalysisEngine() {
    this(
        List.of(
            new ParagraphScopeAnalyzer(),
            new SectionScopeAnalyzer(),
            new DocumentScopeAnalyzer(),
            new BusinessRuleScopeAnalyzer()));
  }

  public ContextAnalysisEngine(List<ScopeAnalyzer> analyzers) {
    this.analyzers = List.copyOf(analyzers);
  }

  public ContextAnalysisResult analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    DocumentContext doc = document == null ? DocumentContext.empty() : document;
    BusinessContext biz = business == null ? BusinessContext.empty() : business;
    Map<ContextScope, ScopeScore> scores = new EnumMap<>(ContextScope.class);
    for (ScopeAnalyzer analyzer : analyzers) {
      scores.put(analyzer.scope(), safely(analyzer, spec, doc, biz));
    }
    return assemble(scores);
  }

  public CompletableFuture<ContextAnalysisResult> analyzeAsync(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business, Executor executor) {
    DocumentContext doc = document == null ? DocumentContext.empty() : document;
    BusinessContext biz = business == null ? BusinessContext.empty() : business;
    List<CompletableFuture<ScopeScore>> futures =
        analyzers.stream()
            .map(a -> CompletableFuture.supplyAsync(() -> safely(a, spec, doc, biz), executor))
            .toList();
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .thenApply(
            ignored -> {
              Map<ContextScope, ScopeScore> scores = new EnumMap<>(ContextScope.class);
              futures.forEach(f -> scores.put(f.join().scope(), f.join()));
              return assemble(scores);
            });
  }

  private ScopeScore safely(
      ScopeAnalyzer analyzer, PlaceholderSpec spec, DocumentContext doc, BusinessContext biz) {
    try {
      ScopeScore score = analyzer.analyze(spec, doc, biz);
      if (!score.available()) {
        log.debug(
            "{} scope unavailable for '{}': {}",
            analyzer.scope(),
            spec.displayName(),
            score.rationale());
      }
      return score;
    } catch (RuntimeException e) {
      log.warn(
          "{} analyzer failed for '{}', using neutral score",
          analyzer.scope(),
          spec.displayName(),
          e);
      return ScopeScore.neutral(analyzer.scope(), "analyzer failed: " + e.getMessage());
    }
  }

  private static ContextAnalysisResult assemble(Map<ContextScope, ScopeScore> scores) {
    return new ContextAnalysisResult(
        get(scores, ContextScope.PARAGRAPH),
        get(scores, ContextScope.SECTION),
        get(scores, ContextScope.DOCUMENT),
        get(scores, ContextScope.BUSINESS_RULE));
  }

  private static ScopeScore get(Map<ContextScope, ScopeScore> scores, ContextScope scope) {
    ScopeScore s = scores.get(scope);
    return s != null ? s : ScopeScore.neutral(scope, "no analyzer registered");
  }
}
