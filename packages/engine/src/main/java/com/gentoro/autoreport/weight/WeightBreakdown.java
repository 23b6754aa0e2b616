package com.gentoro.autoreport.weight;

/**
 * How a placeholder's final weight was computed.
 *
 * @param weights the aggregation weights actually applied
 * @param adjusted true when learned feedback changed the weights from the configured ones
 */
public record WeightBreakdown(
    double paragraph,
    double section,
    double document,
    double businessRule,
    double semanticConfidence,
    WeightConfig weights,
    double finalWeight,
    boolean adjusted) {

  public double score(WeightSignal signal) {
    return switch (signal) {
      case PARAGRAPH -> paragraph;
      case SECTION -> section;
      case DOCUMENT -> document;
      case BUSINESS_RULE -> businessRule;
      case SEMANTIC -> semanticConfidence;
    };
  }
}
