package com.gentoro.autoreport.semantic;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores intents from the declared type plus cue words in the name and the surrounding text.
 *
 * <p>The declared type contributes {@value #DECLARED_SCORE}; every cue found in the name adds
 * {@value #NAME_CUE_SCORE} to its intent and every cue in the neighborhood adds {@value
 * #CONTEXT_CUE_SCORE}. Confidence is the best score (capped at 1) multiplied by its share of the
 * total, so conflicting cues lower it.
 */
public class IntentClassifier {
  static final double DECLARED_SCORE = 0.6;
  static final double NAME_CUE_SCORE = 0.2;
  static final double CONTEXT_CUE_SCORE = 0.05;
  private static final double TIE_EPSILON = 1e-9;

  private static final Map<Intent, List<String>> CUES = new EnumMap<>(Intent.class);

  static {
    CUES.put(Intent.STATISTIC, List.of("总", "合计", "总计", "额", "数量", "个数", "total", "sum", "count"));
    CUES.put(Intent.TREND, List.of("趋势", "变化", "走势", "增长", "trend", "growth"));
    CUES.put(
        Intent.EXTREMUM,
        List.of("最高", "最低", "最大", "最小", "最多", "最少", "峰值", "max", "min", "highest", "lowest"));
    CUES.put(Intent.LISTING, List.of("列表", "明细", "排名", "前十", "前五", "清单", "top", "list", "ranking"));
    CUES.put(Intent.CHART, List.of("图", "柱状", "折线", "饼", "chart", "graph"));
    CUES.put(
        Intent.COMPARISON,
        List.of("对比", "同比", "环比", "相比", "比较", "versus", "compare", "yoy", "mom"));
    CUES.put(Intent.FORECAST, List.of("预测", "预计", "预估", "forecast", "predict", "projection"));
    CUES.put(Intent.PERIOD, List.of("周期", "期间", "日期", "时间", "period", "date"));
    CUES.put(Intent.REGION, List.of("区域", "地区", "省", "城市", "region", "area", "city"));
  }

  /** Classification outcome with per-intent scores kept for diagnostics. */
  public record Classification(Intent intent, double confidence, Map<Intent, Double> scores) {}

  public Classification classify(PlaceholderSpec spec, String neighborhood) {
    Map<Intent, Double> scores = new EnumMap<>(Intent.class);
    Intent declared = Intent.fromType(spec.type());
    if (declared != Intent.UNKNOWN) {
      scores.merge(declared, DECLARED_SCORE, Double::sum);
    }

    String name = spec.displayName().toLowerCase(Locale.ROOT);
    String context = neighborhood == null ? "" : neighborhood.toLowerCase(Locale.ROOT);
    for (Map.Entry<Intent, List<String>> e : CUES.entrySet()) {
      for (String cue : e.getValue()) {
        if (name.contains(cue)) {
          scores.merge(e.getKey(), NAME_CUE_SCORE, Double::sum);
        }
        if (!context.isEmpty() && context.contains(cue)) {
          scores.merge(e.getKey(), CONTEXT_CUE_SCORE, Double::sum);
        }
      }
    }

    if (scores.isEmpty()) {
      return new Classification(Intent.UNKNOWN, 0.0, scores);
    }

    Intent best = declared;
    double bestScore = scores.getOrDefault(declared, 0.0);
    double total = 0.0;
    for (Map.Entry<Intent, Double> e : scores.entrySet()) {
      total += e.getValue();
      // the declared type wins ties
      if (e.getValue() > bestScore + TIE_EPSILON) {
        best = e.getKey();
        bestScore = e.getValue();
      }
    }
    double confidence = Math.min(1.0, bestScore) * (bestScore / total);
    return new Classification(best, round(confidence), scores);
  }

  private static double round(double v) {
    return Math.round(v * 10_000d) / 10_000d;
  }
}
