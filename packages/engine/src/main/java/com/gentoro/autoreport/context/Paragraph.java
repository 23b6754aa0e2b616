package com.gentoro.autoreport.context;

/**
 * Paragraph text with its character range in the template. {@code start} is -1 when the paragraph
 * was supplied without position information.
 */
public record Paragraph(String text, int start, int end) {
  public Paragraph {
    text = text == null ? "" : text;
  }

  public static Paragraph of(String text) {
    return new Paragraph(text, -1, -1);
  }

  public boolean hasRange() {
    return start >= 0 && end >= start;
  }

  public boolean covers(int offset) {
    return hasRange() && offset >= start && offset < end;
  }
}
