package com.gentoro.autoreport.weight;

import com.gentoro.autoreport.exception.WeightConfigException;
import java.util.Locale;

/**
 * How signal scores are combined. Only {@link #WEIGHTED_AVERAGE} uses the configured weights; the
 * means run over the positive signals and max pooling takes the strongest one.
 */
public enum AggregationMethod {
  WEIGHTED_AVERAGE {
    @Override
    double aggregate(double[] values, double[] weights) {
      double sum = 0.0;
      double total = 0.0;
      for (int i = 0; i < values.length; i++) {
        sum += values[i] * weights[i];
        total += weights[i];
      }
      return total > 0 ? sum / total : 0.0;
    }
  },
  HARMONIC_MEAN {
    @Override
    double aggregate(double[] values, double[] weights) {
      int n = 0;
      double inverse = 0.0;
      for (double v : values) {
        if (v > 0) {
          n++;
          inverse += 1.0 / v;
        }
      }
      return n == 0 ? 0.0 : n / inverse;
    }
  },
  GEOMETRIC_MEAN {
    @Override
    double aggregate(double[] values, double[] weights) {
      int n = 0;
      double logSum = 0.0;
      for (double v : values) {
        if (v > 0) {
          n++;
          logSum += Math.log(v);
        }
      }
      return n == 0 ? 0.0 : Math.exp(logSum / n);
    }
  },
  MAX_POOLING {
    @Override
    double aggregate(double[] values, double[] weights) {
      double max = 0.0;
      for (double v : values) {
        max = Math.max(max, v);
      }
      return max;
    }
  };

  abstract double aggregate(double[] values, double[] weights);

  public static AggregationMethod fromName(String name) {
    if (name == null || name.isBlank()) {
      return WEIGHTED_AVERAGE;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new WeightConfigException("Unknown aggregation_method: " + name);
    }
  }
}
