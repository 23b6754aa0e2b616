package com.gentoro.autoreport.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable summary of a failure, used in per-placeholder reports. */
public record ErrorDetails(
    String type,
    String message,
    AutoReportErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
