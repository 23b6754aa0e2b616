package com.gentoro.autoreport.weight;

import com.gentoro.autoreport.exception.WeightConfigException;

/**
 * Aggregation weights per signal. The five weights must be non-negative and sum to 1.0; anything
 * else fails at construction, which is configuration-load time.
 */
public record WeightConfig(
    double paragraph,
    double section,
    double document,
    double businessRule,
    double semantic,
    AggregationMethod method) {

  public static final double TOLERANCE = 1e-6;

  public WeightConfig {
    method = method == null ? AggregationMethod.WEIGHTED_AVERAGE : method;
    double[] all = {paragraph, section, document, businessRule, semantic};
    double sum = 0.0;
    for (double w : all) {
      if (Double.isNaN(w) || w < 0.0) {
        throw new WeightConfigException("Aggregation weights must be non-negative, got " + w);
      }
      sum += w;
    }
    if (Math.abs(sum - 1.0) > TOLERANCE) {
      throw new WeightConfigException(
          String.format("Aggregation weights must sum to 1.0, got %.6f", sum));
    }
  }

  public static WeightConfig defaults() {
    return new WeightConfig(0.25, 0.25, 0.2, 0.15, 0.15, AggregationMethod.WEIGHTED_AVERAGE);
  }

  public double weight(WeightSignal signal) {
    return switch (signal) {
      case PARAGRAPH -> paragraph;
      case SECTION -> section;
      case DOCUMENT -> document;
      case BUSINESS_RULE -> businessRule;
      case SEMANTIC -> semantic;
    };
  }

  double[] toArray() {
    return new double[] {paragraph, section, document, businessRule, semantic};
  }

  /** Scale to sum 1.0; a zero vector is rejected. */
  static WeightConfig normalized(double[] raw, AggregationMethod method) {
    double sum = 0.0;
    for (double w : raw) {
      sum += w;
    }
    if (sum <= 0.0) {
      throw new WeightConfigException("Cannot normalize an all-zero weight vector");
    }
    return new WeightConfig(
        raw[0] / sum, raw[1] / sum, raw[2] / sum, raw[3] / sum, raw[4] / sum, method);
  }
}
