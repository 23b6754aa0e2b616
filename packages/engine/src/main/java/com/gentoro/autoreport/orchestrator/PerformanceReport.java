package com.gentoro.autoreport.orchestrator;

import java.util.Locale;
import java.util.Map;

/**
 * Counters for one processed document.
 *
 * @param stageMillis cumulative time per stage; concurrent stages may sum to more than the total
 * @param cacheHitRate share of cache lookups served without a new query session
 */
public record PerformanceReport(
    long totalMillis,
    Map<ProcessingStage, Long> stageMillis,
    int placeholders,
    int succeeded,
    int failed,
    int skipped,
    int parseErrors,
    int timedOut,
    long cacheHits,
    long cacheMisses,
    long cacheCoalesced,
    double cacheHitRate,
    boolean partial) {

  public PerformanceReport {
    stageMillis = stageMillis == null ? Map.of() : Map.copyOf(stageMillis);
  }

  /** Multi-line human readable rendering. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    sb.append("Processed ").append(placeholders).append(" placeholder(s) in ")
        .append(totalMillis).append(" ms").append(partial ? " (partial)" : "").append('\n');
    sb.append("  succeeded=").append(succeeded)
        .append(" failed=").append(failed)
        .append(" skipped=").append(skipped)
        .append(" parseErrors=").append(parseErrors)
        .append(" timedOut=").append(timedOut).append('\n');
    for (ProcessingStage stage : ProcessingStage.values()) {
      sb.append("  ").append(stage.name().toLowerCase(Locale.ROOT)).append(": ")
          .append(stageMillis.getOrDefault(stage, 0L)).append(" ms\n");
    }
    sb.append(
        String.format(
            Locale.ROOT,
            "  cache: hits=%d misses=%d coalesced=%d hitRate=%.2f",
            cacheHits,
            cacheMisses,
            cacheCoalesced,
            cacheHitRate));
    return sb.toString();
  }
}
