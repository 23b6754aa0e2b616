package com.gentoro.autoreport.context;

import com.gentoro.autoreport.parser.PlaceholderSpec;

/**
 * Scores one context scope. Implementations are pure functions of their own scope and never read
 * another analyzer's output, so they can run in any order or concurrently.
 */
public interface ScopeAnalyzer {

  ContextScope scope();

  ScopeScore analyze(PlaceholderSpec spec, DocumentContext document, BusinessContext business);
}
