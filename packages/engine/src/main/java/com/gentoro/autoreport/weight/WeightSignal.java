package com.gentoro.autoreport.weight;

/** Signals combined into the final weight, in aggregation order. */
public enum WeightSignal {
  PARAGRAPH,
  SECTION,
  DOCUMENT,
  BUSINESS_RULE,
  SEMANTIC
}
