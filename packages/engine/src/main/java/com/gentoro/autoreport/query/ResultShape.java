package com.gentoro.autoreport.query;

import com.gentoro.autoreport.semantic.Intent;

/** Expected cardinality of a query result. */
public enum ResultShape {
  /** One row, one column. */
  SCALAR,
  /** Exactly one row. */
  SINGLE_ROW,
  /** Ordered rows with at least a key and a value column. */
  SERIES,
  /** Any number of rows. */
  ROW_SET;

  public static ResultShape forIntent(Intent intent) {
    return switch (intent) {
      case STATISTIC, EXTREMUM, PERIOD, REGION, UNKNOWN -> SCALAR;
      case COMPARISON -> SINGLE_ROW;
      case TREND, CHART, FORECAST -> SERIES;
      case LISTING -> ROW_SET;
    };
  }
}
