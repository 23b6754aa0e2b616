package com.gentoro.autoreport.exception;

/** Stable error codes attached to {@link AutoReportException} instances. */
public enum AutoReportErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  WEIGHT_CONFIG_ERROR,
  STATE_ERROR,
  PARSE_ERROR,
  SCHEMA_MISMATCH,
  QUERY_EXECUTION_ERROR,
  SCHEMA_LOOKUP_ERROR,
  TEMPLATE_ERROR,
  ORCHESTRATION_TIMEOUT
}
