package com.gentoro.autoreport.config;

import com.gentoro.autoreport.exception.ConfigurationException;
import com.gentoro.autoreport.weight.AggregationMethod;
import com.gentoro.autoreport.weight.WeightConfig;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable engine options. All keys are read from the {@code autoreport} section of the
 * configuration; missing keys fall back to defaults.
 */
public record EngineSettings(
    boolean enableSemanticAnalysis,
    boolean enableContextAnalysis,
    boolean enableDynamicWeights,
    boolean enableLearning,
    boolean parallelProcessing,
    int maxWorkers,
    Duration placeholderTimeout,
    Duration documentTimeout,
    boolean cacheEnabled,
    int maxRetryAttempts,
    int maxNestingDepth,
    double minIntentConfidence,
    double learningRate,
    WeightConfig weights) {

  public static final String PREFIX = "autoreport";

  public EngineSettings {
    if (maxWorkers < 1) {
      throw new ConfigurationException("max_workers must be >= 1, got " + maxWorkers);
    }
    if (maxRetryAttempts < 1) {
      throw new ConfigurationException(
          "max_retry_attempts must be >= 1, got " + maxRetryAttempts);
    }
    if (maxNestingDepth < 1) {
      throw new ConfigurationException("max_nesting_depth must be >= 1, got " + maxNestingDepth);
    }
    if (placeholderTimeout == null
        || placeholderTimeout.isNegative()
        || placeholderTimeout.isZero()) {
      throw new ConfigurationException("timeout_seconds must be positive");
    }
    if (documentTimeout == null || documentTimeout.isNegative() || documentTimeout.isZero()) {
      throw new ConfigurationException("document_timeout_seconds must be positive");
    }
    if (minIntentConfidence < 0.0 || minIntentConfidence > 1.0) {
      throw new ConfigurationException("min_intent_confidence must be within [0,1]");
    }
    if (learningRate <= 0.0 || learningRate > 1.0) {
      throw new ConfigurationException("learning_rate must be within (0,1]");
    }
    if (weights == null) {
      weights = WeightConfig.defaults();
    }
  }

  public static EngineSettings defaults() {
    return builder().build();
  }

  /** Read settings from {@code autoreport.*} keys, failing fast on invalid values. */
  public static EngineSettings from(Configuration configuration) {
    Builder b = builder();
    if (configuration == null) {
      return b.build();
    }
    Configuration c = configuration.subset(PREFIX);
    try {
      b.enableSemanticAnalysis(c.getBoolean("enable_semantic_analysis", b.enableSemanticAnalysis))
          .enableContextAnalysis(c.getBoolean("enable_context_analysis", b.enableContextAnalysis))
          .enableDynamicWeights(c.getBoolean("enable_dynamic_weights", b.enableDynamicWeights))
          .enableLearning(c.getBoolean("enable_learning", b.enableLearning))
          .parallelProcessing(c.getBoolean("parallel_processing", b.parallelProcessing))
          .maxWorkers(c.getInt("max_workers", b.maxWorkers))
          .placeholderTimeout(
              Duration.ofSeconds(
                  c.getLong("timeout_seconds", b.placeholderTimeout.toSeconds())))
          .documentTimeout(
              Duration.ofSeconds(
                  c.getLong("document_timeout_seconds", b.documentTimeout.toSeconds())))
          .cacheEnabled(c.getBoolean("cache_enabled", b.cacheEnabled))
          .maxRetryAttempts(c.getInt("max_retry_attempts", b.maxRetryAttempts))
          .maxNestingDepth(c.getInt("max_nesting_depth", b.maxNestingDepth))
          .minIntentConfidence(c.getDouble("min_intent_confidence", b.minIntentConfidence))
          .learningRate(c.getDouble("learning_rate", b.learningRate));

      WeightConfig defaults = WeightConfig.defaults();
      Configuration w = c.subset("weights");
      String method = c.getString("aggregation_method", null);
      b.weights(
          new WeightConfig(
              w.getDouble("paragraph", defaults.paragraph()),
              w.getDouble("section", defaults.section()),
              w.getDouble("document", defaults.document()),
              w.getDouble("business_rule", defaults.businessRule()),
              w.getDouble("semantic", defaults.semantic()),
              method == null ? defaults.method() : AggregationMethod.fromName(method)));
    } catch (ConversionException e) {
      throw new ConfigurationException("Invalid autoreport option: " + e.getMessage(), e);
    }
    return b.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .enableSemanticAnalysis(enableSemanticAnalysis)
        .enableContextAnalysis(enableContextAnalysis)
        .enableDynamicWeights(enableDynamicWeights)
        .enableLearning(enableLearning)
        .parallelProcessing(parallelProcessing)
        .maxWorkers(maxWorkers)
        .placeholderTimeout(placeholderTimeout)
        .documentTimeout(documentTimeout)
        .cacheEnabled(cacheEnabled)
        .maxRetryAttempts(maxRetryAttempts)
        .maxNestingDepth(maxNestingDepth)
        .minIntentConfidence(minIntentConfidence)
        .learningRate(learningRate)
        .weights(weights);
  }

  /** Mutable builder seeded with defaults. */
  public static final class Builder {
    private boolean enableSemanticAnalysis = true;
    private boolean enableContextAnalysis = true;
    private boolean enableDynamicWeights = false;
    private boolean enableLearning = false;
    private boolean parallelProcessing = true;
    private int maxWorkers = 4;
    private Duration placeholderTimeout = Duration.ofSeconds(30);
    private Duration documentTimeout = Duration.ofSeconds(300);
    private boolean cacheEnabled = true;
    private int maxRetryAttempts = 3;
    private int maxNestingDepth = 5;
    private double minIntentConfidence = 0.3;
    private double learningRate = 0.2;
    private WeightConfig weights = WeightConfig.defaults();

    private Builder() {}

    public Builder enableSemanticAnalysis(boolean v) {
      this.enableSemanticAnalysis = v;
      return this;
    }

    public Builder enableContextAnalysis(boolean v) {
      this.enableContextAnalysis = v;
      return this;
    }

    public Builder enableDynamicWeights(boolean v) {
      this.enableDynamicWeights = v;
      return this;
    }

    public Builder enableLearning(boolean v) {
      this.enableLearning = v;
      return this;
    }

    public Builder parallelProcessing(boolean v) {
      this.parallelProcessing = v;
      return this;
    }

    public Builder maxWorkers(int v) {
      this.maxWorkers = v;
      return this;
    }

    public Builder placeholderTimeout(Duration v) {
      this.placeholderTimeout = v;
      return this;
    }

    public Builder documentTimeout(Duration v) {
      this.documentTimeout = v;
      return this;
    }

    public Builder cacheEnabled(boolean v) {
      this.cacheEnabled = v;
      return this;
    }

    public Builder maxRetryAttempts(int v) {
      this.maxRetryAttempts = v;
      return this;
    }

    public Builder maxNestingDepth(int v) {
      this.maxNestingDepth = v;
      return this;
    }

    public Builder minIntentConfidence(double v) {
      this.minIntentConfidence = v;
      return this;
    }

    public Builder learningRate(double v) {
      this.learningRate = v;
      return this;
    }

    public Builder weights(WeightConfig v) {
      this.weights = v;
      return this;
    }

    public EngineSettings build() {
      return new EngineSettings(
          enableSemanticAnalysis,
          enableContextAnalysis,
          enableDynamicWeights,
          enableLearning,
          parallelProcessing,
          maxWorkers,
          placeholderTimeout,
          documentTimeout,
          cacheEnabled,
          maxRetryAttempts,
          maxNestingDepth,
          minIntentConfidence,
          learningRate,
          weights);
    }
  }
}
