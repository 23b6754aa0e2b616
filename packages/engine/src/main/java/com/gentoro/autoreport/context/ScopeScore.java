package com.gentoro.autoreport.context;

/**
 * Relevance of one scope to a placeholder.
 *
 * @param score in [0,1]; {@link #NEUTRAL} when the scope is missing
 * @param available false when the neutral score was substituted for a missing scope
 */
public record ScopeScore(ContextScope scope, double score, String rationale, boolean available) {
  public static final double NEUTRAL = 0.5;

  public ScopeScore {
    if (Double.isNaN(score)) {
      score = NEUTRAL;
    }
    score = Math.max(0.0, Math.min(1.0, score));
    rationale = rationale == null ? "" : rationale;
  }

  public static ScopeScore of(ContextScope scope, double score, String rationale) {
    return new ScopeScore(scope, Math.round(score * 10_000d) / 10_000d, rationale, true);
  }

  public static ScopeScore neutral(ContextScope scope, String rationale) {
    return new ScopeScore(scope, NEUTRAL, rationale, false);
  }
}
