package com.gentoro.autoreport.orchestrator;

public enum ResolutionStatus {
  SUCCEEDED,
  FAILED,
  /** The placeholder's condition evaluated to false. */
  SKIPPED,
  /** The token could not be parsed; only its raw text and errors are known. */
  PARSE_ERROR
}
