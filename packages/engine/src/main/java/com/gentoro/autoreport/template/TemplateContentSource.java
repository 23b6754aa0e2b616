package com.gentoro.autoreport.template;

/** Supplies raw template markup and its section/paragraph boundaries. */
public interface TemplateContentSource {

  /**
   * Load a template by identifier.
   *
   * @throws com.gentoro.autoreport.exception.TemplateException when the template cannot be read
   */
  TemplateDocument load(String templateId);
}
