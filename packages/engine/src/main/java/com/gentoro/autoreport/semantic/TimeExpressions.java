package com.gentoro.autoreport.semantic;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes recognized time expressions into canonical range strings: {@code yyyy-MM}, {@code
 * yyyy}, {@code yyyy-Qn}, {@code yyyy-H1}/{@code yyyy-H2}, or {@code last_<n>_<unit>}.
 */
final class TimeExpressions {
  private static final Pattern ISO_MONTH = Pattern.compile("(\\d{4})-(\\d{1,2})(?:-(\\d{1,2}))?");
  private static final Pattern CN_DATE =
      Pattern.compile("(\\d{4})年(?:(\\d{1,2})月)?(?:(\\d{1,2})日)?");
  private static final Pattern QUARTER = Pattern.compile("(?:(\\d{4})\\s*)?[Qq]([1-4])");
  private static final Pattern CN_QUARTER = Pattern.compile("第([一二三四1-4])季度");
  private static final Pattern RECENT = Pattern.compile("近(\\d+)(天|周|个月|月|年)");

  private TimeExpressions() {}

  static Optional<String> normalize(String expression, LocalDate reference) {
    if (expression == null || expression.isBlank()) {
      return Optional.empty();
    }
    String text = expression.trim();
    Matcher m = ISO_MONTH.matcher(text);
    if (m.matches()) {
      if (m.group(3) != null) {
        return Optional.of(
            String.format(
                Locale.ROOT,
                "%s-%02d-%02d",
                m.group(1),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3))));
      }
      return Optional.of(month(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    }
    m = CN_DATE.matcher(text);
    if (m.matches()) {
      if (m.group(2) == null) {
        return Optional.of(m.group(1));
      }
      return Optional.of(month(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    }
    m = QUARTER.matcher(text);
    if (m.matches()) {
      int year = m.group(1) == null ? reference.getYear() : Integer.parseInt(m.group(1));
      return Optional.of(year + "-Q" + m.group(2));
    }
    m = CN_QUARTER.matcher(text);
    if (m.matches()) {
      return Optional.of(reference.getYear() + "-Q" + quarterDigit(m.group(1)));
    }
    m = RECENT.matcher(text);
    if (m.matches()) {
      String unit =
          switch (m.group(2)) {
            case "天" -> "days";
            case "周" -> "weeks";
            case "年" -> "years";
            default -> "months";
          };
      return Optional.of("last_" + m.group(1) + "_" + unit);
    }

    YearMonth current = YearMonth.from(reference);
    int quarter = (reference.getMonthValue() - 1) / 3 + 1;
    return Optional.ofNullable(
        switch (text.toLowerCase(Locale.ROOT)) {
          case "本月", "this month" -> current.toString();
          case "上月", "last month" -> current.minusMonths(1).toString();
          case "今年", "this year" -> String.valueOf(reference.getYear());
          case "去年", "last year" -> String.valueOf(reference.getYear() - 1);
          case "本季度", "this quarter" -> reference.getYear() + "-Q" + quarter;
          case "上季度", "last quarter" ->
              quarter == 1
                  ? (reference.getYear() - 1) + "-Q4"
                  : reference.getYear() + "-Q" + (quarter - 1);
          case "上半年" -> reference.getYear() + "-H1";
          case "下半年" -> reference.getYear() + "-H2";
          case "本周", "this week" -> "this_week";
          case "上周", "last week" -> "last_week";
          default -> null;
        });
  }

  private static String month(int year, int month) {
    if (month < 1 || month > 12) {
      return String.valueOf(year);
    }
    return YearMonth.of(year, month).toString();
  }

  private static int quarterDigit(String s) {
    return switch (s) {
      case "一" -> 1;
      case "二" -> 2;
      case "三" -> 3;
      case "四" -> 4;
      default -> Integer.parseInt(s);
    };
  }
}
