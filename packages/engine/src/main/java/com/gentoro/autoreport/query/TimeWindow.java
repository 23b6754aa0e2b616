package com.gentoro.autoreport.query;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Half-open date range {@code [start, end)} parsed from a normalized time range parameter. */
record TimeWindow(LocalDate start, LocalDate end) {
  private static final Pattern DAY = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
  private static final Pattern MONTH = Pattern.compile("(\\d{4})-(\\d{2})");
  private static final Pattern YEAR = Pattern.compile("(\\d{4})");
  private static final Pattern QUARTER = Pattern.compile("(\\d{4})-Q([1-4])");
  private static final Pattern HALF = Pattern.compile("(\\d{4})-H([12])");

  static Optional<TimeWindow> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String v = value.trim();
    Matcher m = DAY.matcher(v);
    if (m.matches()) {
      LocalDate d = LocalDate.parse(v);
      return Optional.of(new TimeWindow(d, d.plusDays(1)));
    }
    m = MONTH.matcher(v);
    if (m.matches()) {
      YearMonth ym = YearMonth.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
      return Optional.of(new TimeWindow(ym.atDay(1), ym.plusMonths(1).atDay(1)));
    }
    m = QUARTER.matcher(v);
    if (m.matches()) {
      int q = Integer.parseInt(m.group(2));
      LocalDate start = LocalDate.of(Integer.parseInt(m.group(1)), (q - 1) * 3 + 1, 1);
      return Optional.of(new TimeWindow(start, start.plusMonths(3)));
    }
    m = HALF.matcher(v);
    if (m.matches()) {
      LocalDate start =
          LocalDate.of(Integer.parseInt(m.group(1)), "1".equals(m.group(2)) ? 1 : 7, 1);
      return Optional.of(new TimeWindow(start, start.plusMonths(6)));
    }
    m = YEAR.matcher(v);
    if (m.matches()) {
      LocalDate start = LocalDate.of(Integer.parseInt(m.group(1)), 1, 1);
      return Optional.of(new TimeWindow(start, start.plusYears(1)));
    }
    return Optional.empty();
  }

  /** The window of equal length immediately before this one. */
  TimeWindow previous() {
    long months = ChronoUnit.MONTHS.between(start, end);
    if (months > 0) {
      return new TimeWindow(start.minusMonths(months), start);
    }
    long days = ChronoUnit.DAYS.between(start, end);
    return new TimeWindow(start.minusDays(days), start);
  }

  TimeWindow sameWindowLastYear() {
    return new TimeWindow(start.minusYears(1), end.minusYears(1));
  }

  String predicate(String column) {
    return column + " >= '" + start + "' AND " + column + " < '" + end + "'";
  }
}
