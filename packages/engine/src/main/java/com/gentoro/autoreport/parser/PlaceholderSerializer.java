package com.gentoro.autoreport.parser;

/**
 * Renders a spec back to canonical markup: canonical type label, full-width separator, trimmed
 * name and parameters in source order.
 */
public final class PlaceholderSerializer {
  public static final String OPEN = "{{";
  public static final String CLOSE = "}}";
  public static final char SEPARATOR = '：';

  private PlaceholderSerializer() {}

  public static String toMarkup(PlaceholderSpec spec) {
    if (spec == null) {
      return "";
    }
    if (spec.type() == null) {
      // stubs are rendered verbatim
      return spec.rawText() == null ? "" : spec.rawText().trim();
    }
    StringBuilder sb = new StringBuilder(OPEN);
    sb.append(spec.type().label()).append(SEPARATOR);
    if (spec.nested() != null) {
      sb.append(toMarkup(spec.nested()));
    } else {
      sb.append(spec.name() == null ? "" : spec.name().trim());
    }
    for (Parameter p : spec.parameters()) {
      sb.append('|').append(p.key().trim()).append('=').append(p.value().markup().trim());
    }
    return sb.append(CLOSE).toString();
  }
}
