package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.Locale;
import java.util.Set;

/** Scores the caller's business rules: key metrics, constraints and primary domain. */
public class BusinessRuleScopeAnalyzer implements ScopeAnalyzer {

  @Override
  public ContextScope scope() {
    return ContextScope.BUSINESS_RULE;
  }

  @Override
  public ScopeScore analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    if (business == null || business.isEmpty()) {
      return ScopeScore.neutral(scope(), "no business rules supplied");
    }
    String name = spec.displayName().toLowerCase(Locale.ROOT);
    Set<String> terms = TextRelevance.terms(name);

    boolean keyMetric =
        business.keyMetrics().stream()
            .map(m -> m.toLowerCase(Locale.ROOT))
            .anyMatch(m -> !m.isBlank() && (name.contains(m) || m.contains(name)));
    long constraintHits =
        business.constraints().stream()
            .filter(c -> TextRelevance.overlap(terms, c) > 0.0)
            .count();
    double constraintShare =
        business.constraints().isEmpty()
            ? 0.0
            : (double) constraintHits / business.constraints().size();
    double domainMatch = 0.0;
    if (business.primaryDomain() != null && !business.primaryDomain().isBlank()) {
      String domain = business.primaryDomain().toLowerCase(Locale.ROOT);
      boolean sameAsDocument = domain.equalsIgnoreCase(String.valueOf(document.domain()));
      domainMatch =
          Math.max(
              sameAsDocument ? 1.0 : 0.0,
              TextRelevance.overlap(TextRelevance.terms(domain), name));
    }

    double score =
        0.35 + (keyMetric ? 0.35 : 0.0) + 0.15 * constraintShare + 0.15 * domainMatch;
    return ScopeScore.of(
        scope(),
        score,
        String.format(
            "key metric %s, constraints matched %d/%d, domain match %.2f",
            keyMetric, constraintHits, business.constraints().size(), domainMatch));
  }
}
