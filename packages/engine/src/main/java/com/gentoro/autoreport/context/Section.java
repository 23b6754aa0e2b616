package com.gentoro.autoreport.context;

import java.util.List;

/** A headed section of the template. Level 0 is the implicit preamble before the first heading. */
public record Section(String heading, int level, List<Paragraph> paragraphs, int start, int end) {
  public Section {
    heading = heading == null ? "" : heading;
    paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
  }

  public static Section of(String heading, int level, List<String> paragraphs) {
    return new Section(
        heading, level, paragraphs.stream().map(Paragraph::of).toList(), -1, -1);
  }

  public boolean covers(int offset) {
    return start >= 0 && offset >= start && offset < end;
  }

  /** Heading followed by all paragraph text. */
  public String fullText() {
    StringBuilder sb = new StringBuilder(heading);
    for (Paragraph p : paragraphs) {
      sb.append('\n').append(p.text());
    }
    return sb.toString();
  }
}
