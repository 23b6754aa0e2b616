package com.gentoro.autoreport.context;

/** Scope scores for one placeholder; each score is in [0,1]. */
public record ContextAnalysisResult(
    ScopeScore paragraph, ScopeScore section, ScopeScore document, ScopeScore businessRule) {

  public static ContextAnalysisResult neutral(String rationale) {
    return new ContextAnalysisResult(
        ScopeScore.neutral(ContextScope.PARAGRAPH, rationale),
        ScopeScore.neutral(ContextScope.SECTION, rationale),
        ScopeScore.neutral(ContextScope.DOCUMENT, rationale),
        ScopeScore.neutral(ContextScope.BUSINESS_RULE, rationale));
  }

  public ScopeScore score(ContextScope scope) {
    return switch (scope) {
      case PARAGRAPH -> paragraph;
      case SECTION -> section;
      case DOCUMENT -> document;
      case BUSINESS_RULE -> businessRule;
    };
  }
}
