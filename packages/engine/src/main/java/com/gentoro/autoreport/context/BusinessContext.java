package com.gentoro.autoreport.context;

import java.util.List;
import java.util.Map;

/**
 * Caller-supplied business rules for a document.
 *
 * @param constraints free-text rules, e.g. "金额>0" or "exclude cancelled orders"
 * @param keyMetrics metric names the business considers important
 */
public record BusinessContext(
    String businessType,
    String primaryDomain,
    List<String> constraints,
    List<String> keyMetrics,
    Map<String, String> attributes) {

  public BusinessContext {
    constraints = constraints == null ? List.of() : List.copyOf(constraints);
    keyMetrics = keyMetrics == null ? List.of() : List.copyOf(keyMetrics);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static BusinessContext empty() {
    return new BusinessContext(null, null, List.of(), List.of(), Map.of());
  }

  public static BusinessContext ofDomain(String domain) {
    return new BusinessContext(null, domain, List.of(), List.of(), Map.of());
  }

  public boolean isEmpty() {
    return (businessType == null || businessType.isBlank())
        && (primaryDomain == null || primaryDomain.isBlank())
        && constraints.isEmpty()
        && keyMetrics.isEmpty();
  }
}
