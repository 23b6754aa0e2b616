package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.util.Set;

/** Scores the document as a whole: title, declared domain and document type. */
public class DocumentScopeAnalyzer implements ScopeAnalyzer {

  @Override
  public ContextScope scope() {
    return ContextScope.DOCUMENT;
  }

  @Override
  public ScopeScore analyze(
      PlaceholderSpec spec, DocumentContext document, BusinessContext business) {
    boolean hasDomain = document.domain() != null && !document.domain().isBlank();
    boolean hasTitle = !document.title().isBlank();
    if (!hasDomain && !hasTitle && !document.hasStructure()) {
      return ScopeScore.neutral(scope(), "no document metadata");
    }

    Set<String> terms = TextRelevance.terms(spec.displayName());
    double titleOverlap = hasTitle ? TextRelevance.overlap(terms, document.title()) : 0.0;
    double domainMatch = 0.0;
    if (hasDomain) {
      Set<String> domainTerms = TextRelevance.terms(document.domain());
      domainMatch =
          Math.max(
              TextRelevance.overlap(domainTerms, spec.displayName()),
              TextRelevance.overlap(terms, document.domain()));
    }
    double typed = "generic".equals(document.documentType()) ? 0.0 : 1.0;
    double score = 0.4 + 0.25 * titleOverlap + 0.25 * domainMatch + 0.1 * typed;
    return ScopeScore.of(
        scope(),
        score,
        String.format(
            "document type %s: title overlap %.2f, domain match %.2f",
            document.documentType(), titleOverlap, domainMatch));
  }
}
