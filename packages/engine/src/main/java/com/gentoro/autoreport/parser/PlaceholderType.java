package com.gentoro.autoreport.parser;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Declared placeholder types. Each type accepts its Chinese label and English aliases. */
public enum PlaceholderType {
  STATISTIC("统计", "statistic", "stat", "statistics"),
  TREND("趋势", "trend"),
  EXTREMUM("极值", "extremum", "extreme"),
  LISTING("列表", "listing", "list"),
  CHART("图表", "chart"),
  COMPARISON("对比", "comparison", "compare"),
  FORECAST("预测", "forecast"),
  PERIOD("周期", "period"),
  REGION("区域", "region");

  private final String label;
  private final List<String> aliases;

  PlaceholderType(String label, String... aliases) {
    this.label = label;
    this.aliases = List.of(aliases);
  }

  /** Canonical label used when re-serializing markup. */
  public String label() {
    return label;
  }

  public List<String> aliases() {
    return aliases;
  }

  public static Optional<PlaceholderType> fromLabel(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String t = text.trim();
    if (t.isEmpty()) {
      return Optional.empty();
    }
    String lower = t.toLowerCase(Locale.ROOT);
    for (PlaceholderType type : values()) {
      if (type.label.equals(t) || type.aliases.contains(lower)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
