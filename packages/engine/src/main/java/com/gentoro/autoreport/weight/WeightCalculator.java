package com.gentoro.autoreport.weight;

import com.gentoro.autoreport.context.ContextAnalysisResult;
import com.gentoro.autoreport.logging.LoggingService;
import com.gentoro.autoreport.semantic.SemanticAnalysis;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Combines the four scope scores and the intent confidence into one weight in [0,1].
 *
 * <p>When dynamic weights are disabled, or no store is supplied, the configured weights are used
 * as-is and the result depends only on the inputs.
 */
public class WeightCalculator {
  private static final Logger log = LoggingService.getLogger(WeightCalculator.class);

  private final WeightConfig config;
  private final WeightLearningStore store;
  private final boolean dynamicWeights;

  public WeightCalculator(WeightConfig config) {
    this(config, null, false);
  }

  public WeightCalculator(WeightConfig config, WeightLearningStore store, boolean dynamicWeights) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = store;
    this.dynamicWeights = dynamicWeights;
  }

  public WeightConfig config() {
    return config;
  }

  public WeightBreakdown calculate(
      SemanticAnalysis semantic, ContextAnalysisResult context, LearningKey key) {
    double[] values = {
      context.paragraph().score(),
      context.section().score(),
      context.document().score(),
      context.businessRule().score(),
      clamp(semantic.intentConfidence())
    };

    WeightConfig effective = config;
    if (dynamicWeights && store != null && key != null) {
      effective = store.adjustedWeights(key, config);
    }
    boolean adjusted = !effective.equals(config);

    double weight = clamp(effective.method().aggregate(values, effective.toArray()));
    if (adjusted) {
      log.debug("Dynamic weights applied for {}: {}", key, effective);
    }
    return new WeightBreakdown(
        values[0], values[1], values[2], values[3], values[4], effective, weight, adjusted);
  }

  private static double clamp(double v) {
    if (Double.isNaN(v)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, v));
  }
}
