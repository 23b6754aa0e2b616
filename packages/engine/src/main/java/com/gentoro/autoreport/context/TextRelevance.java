package com.gentoro.autoreport.context;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Term overlap helpers shared by the scope analyzers. */
final class TextRelevance {
  static final List<String> DATA_CUES =
      List.of(
          "数据", "统计", "同比", "环比", "增长", "下降", "合计", "总计", "占比", "%", "元", "万",
          "金额", "销售", "收入", "利润", "指标", "trend", "total", "growth", "revenue", "sales");

  private TextRelevance() {}

  /**
   * Terms of a short text: lower-cased ASCII words and, for runs of CJK characters, every
   * character bigram (single characters when the run is one long).
   */
  static Set<String> terms(String text) {
    Set<String> out = new LinkedHashSet<>();
    if (text == null) {
      return out;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    StringBuilder ascii = new StringBuilder();
    StringBuilder han = new StringBuilder();
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if (Character.UnicodeScript.of(c) == Character.UnicodeScript.HAN) {
        flushAscii(ascii, out);
        han.append(c);
      } else if (Character.isLetterOrDigit(c)) {
        flushHan(han, out);
        ascii.append(c);
      } else {
        flushAscii(ascii, out);
        flushHan(han, out);
      }
    }
    flushAscii(ascii, out);
    flushHan(han, out);
    return out;
  }

  /** Share of {@code terms} found in {@code text}, 0 when there are no terms. */
  static double overlap(Set<String> terms, String text) {
    if (terms.isEmpty() || text == null || text.isEmpty()) {
      return 0.0;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    long hits = terms.stream().filter(lower::contains).count();
    return (double) hits / terms.size();
  }

  /** Number of data cues in the text, saturating at {@code cap}, scaled to [0,1]. */
  static double cueDensity(String text, int cap) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    long found = DATA_CUES.stream().filter(lower::contains).count();
    return Math.min(cap, found) / (double) cap;
  }

  private static void flushAscii(StringBuilder sb, Set<String> out) {
    if (sb.length() >= 2) {
      out.add(sb.toString());
    }
    sb.setLength(0);
  }

  private static void flushHan(StringBuilder sb, Set<String> out) {
    if (sb.length() == 1) {
      out.add(sb.toString());
    }
    for (int i = 0; i + 1 < sb.length(); i++) {
      out.add(sb.substring(i, i + 2));
    }
    sb.setLength(0);
  }
}
