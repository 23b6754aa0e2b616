package com.gentoro.autoreport.orchestrator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document-level result. Always produced, even when placeholders fail or the document deadline
 * passes ({@code partial}).
 *
 * @param placeholders in document order
 * @param qualityScore weight-weighted mean resolution confidence, discounted by the failure share
 */
public record ProcessingResult(
    List<ResolvedPlaceholder> placeholders,
    double qualityScore,
    boolean partial,
    PerformanceReport performance) {

  public ProcessingResult {
    placeholders = placeholders == null ? List.of() : List.copyOf(placeholders);
  }

  /** Resolved values keyed by raw token text; later duplicates do not override earlier ones. */
  public Map<String, Object> values() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ResolvedPlaceholder p : placeholders) {
      if (p.succeeded() && !out.containsKey(p.rawText())) {
        out.put(p.rawText(), p.value());
      }
    }
    return out;
  }

  public long count(ResolutionStatus status) {
    return placeholders.stream().filter(p -> p.status() == status).count();
  }

  /**
   * Quality: {@code sum(weight * confidence) / sum(weight)} over placeholders that were not
   * skipped, multiplied by {@code 1 - failed / considered}.
   */
  static double qualityScore(List<ResolvedPlaceholder> placeholders) {
    double weighted = 0.0;
    double weights = 0.0;
    int considered = 0;
    int failed = 0;
    for (ResolvedPlaceholder p : placeholders) {
      if (p.status() == ResolutionStatus.SKIPPED) {
        continue;
      }
      considered++;
      if (p.failed()) {
        failed++;
      }
      weighted += p.weight() * p.confidence();
      weights += p.weight();
    }
    if (considered == 0 || weights <= 0.0) {
      return 0.0;
    }
    double score = (weighted / weights) * (1.0 - (double) failed / considered);
    return Math.round(score * 10_000d) / 10_000d;
  }
}
