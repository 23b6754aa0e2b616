package com.gentoro.autoreport.query;

/** Execution failures not caused by an unknown identifier. */
public enum ExecutionErrorKind {
  TIMEOUT,
  SYNTAX,
  PERMISSION,
  CONNECTION,
  UNKNOWN
}
