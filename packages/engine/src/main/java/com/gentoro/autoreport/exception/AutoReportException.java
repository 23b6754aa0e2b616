package com.gentoro.autoreport.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception for the placeholder engine, carrying a code and optional context. */
public class AutoReportException extends RuntimeException {
  private final AutoReportErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public AutoReportException(AutoReportErrorCode code, String message) {
    super(message);
    this.code = code == null ? AutoReportErrorCode.UNKNOWN : code;
  }

  public AutoReportException(AutoReportErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? AutoReportErrorCode.UNKNOWN : code;
  }

  public AutoReportErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for chaining. */
  public AutoReportException withContext(String key, Object value) {
    if (key != null) {
      context.put(key, value);
    }
    return this;
  }
}
