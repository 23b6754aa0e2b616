package com.gentoro.autoreport.semantic;

public enum Provenance {
  /** Written in the placeholder markup. */
  EXPLICIT,
  /** Filled in by inference rules. */
  INFERRED
}
