package com.gentoro.autoreport.weight;

import com.gentoro.autoreport.logging.LoggingService;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Cross-invocation feedback about which signals predicted a successful resolution.
 *
 * <p>Per key, every signal holds an exponentially weighted moving average of its agreement with
 * the outcome: a high score on a success (or a low score on a failure) pulls the average up.
 * Updates for one key are applied atomically through {@link ConcurrentHashMap#compute}; different
 * keys update independently. Each update bumps the key's version and the store's global version.
 *
 * <p>Pass one instance explicitly to every {@link WeightCalculator} that should share learning.
 */
public class WeightLearningStore {
  private static final Logger log = LoggingService.getLogger(WeightLearningStore.class);

  static final double INITIAL = 0.5;

  /** Learned state for one key. */
  public record LearningState(Map<WeightSignal, Double> agreement, long version, long samples) {
    public LearningState {
      agreement = Collections.unmodifiableMap(new EnumMap<>(agreement));
    }

    static LearningState initial() {
      Map<WeightSignal, Double> m = new EnumMap<>(WeightSignal.class);
      for (WeightSignal s : WeightSignal.values()) {
        m.put(s, INITIAL);
      }
      return new LearningState(m, 0, 0);
    }
  }

  private final double learningRate;
  private final ConcurrentHashMap<LearningKey, LearningState> states = new ConcurrentHashMap<>();
  private final AtomicLong version = new AtomicLong();

  public WeightLearningStore(double learningRate) {
    if (learningRate <= 0.0 || learningRate > 1.0) {
      throw new IllegalArgumentException("learningRate must be within (0,1]");
    }
    this.learningRate = learningRate;
  }

  /** Fold one resolution outcome into the averages for {@code key}. */
  public LearningState recordFeedback(
      LearningKey key, WeightBreakdown breakdown, boolean succeeded) {
    LearningState updated =
        states.compute(
            key,
            (k, current) -> {
              LearningState base = current == null ? LearningState.initial() : current;
              Map<WeightSignal, Double> next = new EnumMap<>(WeightSignal.class);
              for (WeightSignal s : WeightSignal.values()) {
                double score = breakdown.score(s);
                double agreement = succeeded ? score : 1.0 - score;
                double prev = base.agreement().getOrDefault(s, INITIAL);
                next.put(s, (1.0 - learningRate) * prev + learningRate * agreement);
              }
              return new LearningState(next, base.version() + 1, base.samples() + 1);
            });
    version.incrementAndGet();
    log.debug(
        "Learning feedback for {} (succeeded={}), version {}",
        key,
        succeeded,
        updated.version());
    return updated;
  }

  /**
   * Weights nudged by learned agreement: {@code base_i * (0.5 + agreement_i)}, renormalized. Keys
   * without feedback return {@code base} unchanged.
   */
  public WeightConfig adjustedWeights(LearningKey key, WeightConfig base) {
    LearningState state = states.get(key);
    if (state == null || state.samples() == 0) {
      return base;
    }
    double[] raw = base.toArray();
    WeightSignal[] signals = WeightSignal.values();
    for (int i = 0; i < signals.length; i++) {
      raw[i] = raw[i] * (0.5 + state.agreement().getOrDefault(signals[i], INITIAL));
    }
    return WeightConfig.normalized(raw, base.method());
  }

  public long version() {
    return version.get();
  }

  /** Point-in-time copy of all learned states. */
  public Map<LearningKey, LearningState> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(states));
  }

  public void reset() {
    states.clear();
    version.incrementAndGet();
  }
}
