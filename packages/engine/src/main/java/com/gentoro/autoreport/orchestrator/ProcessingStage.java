package com.gentoro.autoreport.orchestrator;

/** Timed stages of document processing. */
public enum ProcessingStage {
  PARSE,
  SCHEMA,
  SEMANTIC,
  CONTEXT,
  WEIGHT,
  QUERY
}
