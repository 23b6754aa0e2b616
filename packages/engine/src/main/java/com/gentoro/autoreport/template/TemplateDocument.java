package com.gentoro.autoreport.template;

import com.gentoro.autoreport.context.DocumentContext;

/**
 * Template markup together with its document structure.
 *
 * @param text markup handed to the parser; section and paragraph offsets refer to this text
 * @param source where the template was read from, for diagnostics
 */
public record TemplateDocument(String text, DocumentContext context, String source) {
  public TemplateDocument {
    text = text == null ? "" : text;
    context = context == null ? DocumentContext.empty() : context;
  }
}
