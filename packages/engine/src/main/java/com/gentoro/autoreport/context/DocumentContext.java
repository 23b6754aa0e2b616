package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only description of the document being processed: type, domain, language and its
 * section/paragraph structure. Created once per document.
 *
 * @param variables values available to conditional placeholders
 * @param referenceDate date used to resolve relative periods such as "本月"; today when null
 */
public record DocumentContext(
    String documentType,
    String domain,
    String language,
    String title,
    List<Section> sections,
    Map<String, Object> variables,
    LocalDate referenceDate) {

  public DocumentContext {
    documentType = documentType == null ? "generic" : documentType;
    language = language == null ? "zh" : language;
    title = title == null ? "" : title;
    sections = sections == null ? List.of() : List.copyOf(sections);
    // values may legitimately be null, so Map.copyOf is not usable here
    variables =
        variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public static DocumentContext empty() {
    return new DocumentContext(null, null, null, null, List.of(), Map.of(), null);
  }

  public LocalDate effectiveDate() {
    return referenceDate == null ? LocalDate.now() : referenceDate;
  }

  public boolean hasStructure() {
    return !sections.isEmpty();
  }

  /**
   * Locate a placeholder. Positional information is used when available; otherwise the first
   * paragraph containing the raw token text is returned.
   */
  public Optional<PlaceholderLocation> locate(PlaceholderSpec spec) {
    if (spec == null) {
      return Optional.empty();
    }
    for (int s = 0; s < sections.size(); s++) {
      Section section = sections.get(s);
      List<Paragraph> paragraphs = section.paragraphs();
      for (int p = 0; p < paragraphs.size(); p++) {
        if (paragraphs.get(p).covers(spec.offset())) {
          return Optional.of(new PlaceholderLocation(section, s, paragraphs.get(p), p));
        }
      }
    }
    String raw = spec.rawText();
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    for (int s = 0; s < sections.size(); s++) {
      Section section = sections.get(s);
      List<Paragraph> paragraphs = section.paragraphs();
      for (int p = 0; p < paragraphs.size(); p++) {
        if (paragraphs.get(p).text().contains(raw)) {
          return Optional.of(new PlaceholderLocation(section, s, paragraphs.get(p), p));
        }
      }
      if (section.heading().contains(raw)) {
        return Optional.of(new PlaceholderLocation(section, s, null, -1));
      }
    }
    return Optional.empty();
  }

  /** Heading of the nearest section at or before the placeholder, if any. */
  public Optional<String> nearestHeading(PlaceholderSpec spec) {
    Optional<PlaceholderLocation> location = locate(spec);
    if (location.isPresent()) {
      int idx = location.get().sectionIndex();
      for (int s = idx; s >= 0; s--) {
        String heading = sections.get(s).heading();
        if (!heading.isBlank()) {
          return Optional.of(heading);
        }
      }
    }
    return title.isBlank() ? Optional.empty() : Optional.of(title);
  }
}
