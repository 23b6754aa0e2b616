package com.gentoro.autoreport.context;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.autoreport.parser.PlaceholderParser;
import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextAnalysisEngineTest {

  private static final String TOKEN = "{{统计：销售额}}";

  private final PlaceholderSpec spec = new PlaceholderParser().parseOne(TOKEN);

  private static DocumentContext salesReport() {
    return new DocumentContext(
        "monthly_report",
        "销售",
        "zh",
        "2024年3月销售报告",
        List.of(
            Section.of("概述", 1, List.of("本报告汇总公司经营情况。")),
            Section.of(
                "销售额分析", 2, List.of("本月销售额同比增长，销售收入为" + TOKEN + "元。"))),
        Map.of(),
        null);
  }

  private static BusinessContext salesRules() {
    return new BusinessContext(
        "retail", "销售", List.of("销售额按含税口径统计"), List.of("销售额"), Map.of());
  }

  @Test
  @DisplayName("missing scopes all fall back to the neutral score")
  void emptyContextIsNeutral() {
    ContextAnalysisResult r =
        new ContextAnalysisEngine().analyze(spec, DocumentContext.empty(), null);
    for (ContextScope scope : ContextScope.values()) {
      ScopeScore s = r.score(scope);
      assertEquals(ScopeScore.NEUTRAL, s.score(), scope::name);
      assertFalse(s.available(), scope::name);
      assertFalse(s.rationale().isBlank());
    }
  }

  @Test
  @DisplayName("relevant paragraph, section, document and rules score above neutral")
  void relevantContext() {
    ContextAnalysisResult r =
        new ContextAnalysisEngine().analyze(spec, salesReport(), salesRules());
    assertEquals(1.0, r.paragraph().score(), 1e-9);
    assertTrue(r.section().score() > ScopeScore.NEUTRAL, r.section()::rationale);
    assertTrue(r.document().score() > ScopeScore.NEUTRAL, r.document()::rationale);
    assertTrue(r.businessRule().score() > 0.8, r.businessRule()::rationale);
    for (ContextScope scope : ContextScope.values()) {
      assertTrue(r.score(scope).available());
    }
  }

  @Test
  @DisplayName("unrelated business rules score lower than matching ones")
  void unrelatedRules() {
    BusinessContext other =
        new BusinessContext("hr", "人事", List.of("员工人数按月末统计"), List.of("员工人数"), Map.of());
    ContextAnalysisEngine engine = new ContextAnalysisEngine();
    double matching = engine.analyze(spec, salesReport(), salesRules()).businessRule().score();
    double unrelated = engine.analyze(spec, salesReport(), other).businessRule().score();
    assertTrue(unrelated < matching);
  }

  @Test
  @DisplayName("analyzer order does not change the result")
  void orderIndependent() {
    List<ScopeAnalyzer> analyzers =
        new ArrayList<>(
            List.of(
                new ParagraphScopeAnalyzer(),
                new SectionScopeAnalyzer(),
                new DocumentScopeAnalyzer(),
                new BusinessRuleScopeAnalyzer()));
    ContextAnalysisResult forward =
        new ContextAnalysisEngine(analyzers).analyze(spec, salesReport(), salesRules());
    Collections.reverse(analyzers);
    ContextAnalysisResult reversed =
        new ContextAnalysisEngine(analyzers).analyze(spec, salesReport(), salesRules());
    assertEquals(forward, reversed);
  }

  @Test
  @DisplayName("concurrent analysis matches sequential analysis")
  void asyncMatchesSync() throws Exception {
    ContextAnalysisEngine engine = new ContextAnalysisEngine();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      ContextAnalysisResult async =
          engine.analyzeAsync(spec, salesReport(), salesRules(), pool).get();
      assertEquals(engine.analyze(spec, salesReport(), salesRules()), async);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("a failing analyzer is replaced by a neutral score")
  void failingAnalyzer() {
    ScopeAnalyzer broken = mock(ScopeAnalyzer.class);
    when(broken.scope()).thenReturn(ContextScope.PARAGRAPH);
    when(broken.analyze(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

    ContextAnalysisResult r =
        new ContextAnalysisEngine(List.of(broken, new DocumentScopeAnalyzer()))
            .analyze(spec, salesReport(), salesRules());
    assertEquals(ScopeScore.NEUTRAL, r.paragraph().score());
    assertTrue(r.paragraph().rationale().contains("boom"));
    assertFalse(r.section().available());
    assertTrue(r.document().available());
  }
}
