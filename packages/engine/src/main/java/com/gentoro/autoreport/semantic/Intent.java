package com.gentoro.autoreport.semantic;

import com.gentoro.autoreport.parser.PlaceholderType;

/** Business purpose of a placeholder. */
public enum Intent {
  STATISTIC,
  TREND,
  EXTREMUM,
  LISTING,
  CHART,
  COMPARISON,
  FORECAST,
  PERIOD,
  REGION,
  UNKNOWN;

  public static Intent fromType(PlaceholderType type) {
    if (type == null) {
      return UNKNOWN;
    }
    return switch (type) {
      case STATISTIC -> STATISTIC;
      case TREND -> TREND;
      case EXTREMUM -> EXTREMUM;
      case LISTING -> LISTING;
      case CHART -> CHART;
      case COMPARISON -> COMPARISON;
      case FORECAST -> FORECAST;
      case PERIOD -> PERIOD;
      case REGION -> REGION;
    };
  }
}
