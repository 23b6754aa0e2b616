package com.gentoro.autoreport.parser;

/**
 * Syntactic layer of a placeholder. Ordered from least to most specific; when a token matches
 * several layers the most specific one is reported.
 */
public enum SyntaxKind {
  BASIC,
  PARAMETERIZED,
  CONDITIONAL,
  COMPOSITE
}
