package com.gentoro.autoreport.exception;

import java.time.Duration;

/** A placeholder or document deadline elapsed before processing finished. */
public class OrchestrationTimeoutException extends AutoReportException {
  public OrchestrationTimeoutException(String message, Duration limit) {
    super(AutoReportErrorCode.ORCHESTRATION_TIMEOUT, message);
    withContext("limitMillis", limit == null ? null : limit.toMillis());
  }
}
