package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.Optional;
import java.util.Set;

/**
 * Scores the enclosing section. The heading weighs more than the body text, and deeper headings
 * (more specific) slightly more than top-level ones.
 */
public class SectionScopeAnalyzer implements ScopeAnalyzer {

  @Override
  public ContextScope scope() {
    return ContextScope.SECTION;
  }

  @Override
  public ScopeScore analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    Optional<PlaceholderLocation> location = document.locate(spec);
    if (location.isEmpty()) {
      return ScopeScore.neutral(scope(), "placeholder is not inside a known section");
    }
    Section section = location.get().section();
    if (section.heading().isBlank() && section.paragraphs().isEmpty()) {
      return ScopeScore.neutral(scope(), "section is empty");
    }

    Set<String> terms = TextRelevance.terms(spec.displayName());
    double headingOverlap = TextRelevance.overlap(terms, section.heading());
    String body = section.fullText();
    if (spec.rawText() != null) {
      body = body.replace(spec.rawText(), " ");
    }
    double bodyOverlap = TextRelevance.overlap(terms, body);
    double specificity = section.level() <= 0 ? 0.0 : Math.min(1.0, section.level() / 3.0);
    double score = 0.3 + 0.35 * headingOverlap + 0.25 * bodyOverlap + 0.1 * specificity;
    return ScopeScore.of(
        scope(),
        score,
        String.format(
            "section '%s' (level %d): heading overlap %.2f, body overlap %.2f",
            section.heading(), section.level(), headingOverlap, bodyOverlap));
  }
}
