package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.Optional;
import java.util.Set;

/** Scores the paragraph that contains the placeholder. */
public class ParagraphScopeAnalyzer implements ScopeAnalyzer {

  @Override
  public ContextScope scope() {
    return ContextScope.PARAGRAPH;
  }

  @Override
  public ScopeScore analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    Optional<PlaceholderLocation> location = document.locate(spec);
    if (location.isEmpty() || location.get().paragraph() == null) {
      return ScopeScore.neutral(scope(), "placeholder is not inside a known paragraph");
    }
    String text = location.get().paragraph().text();
    if (spec.rawText() != null) {
      text = text.replace(spec.rawText(), " ");
    }
    if (text.isBlank()) {
      return ScopeScore.neutral(scope(), "paragraph holds only the placeholder");
    }

    Set<String> terms = TextRelevance.terms(spec.displayName());
    double overlap = TextRelevance.overlap(terms, text);
    double cues = TextRelevance.cueDensity(text, 3);
    double score = 0.3 + 0.4 * overlap + 0.3 * cues;
    return ScopeScore.of(
        scope(),
        score,
        String.format(
            "paragraph %d: term overlap %.2f, data cues %.2f",
            location.get().paragraphIndex(), overlap, cues));
  }
}
