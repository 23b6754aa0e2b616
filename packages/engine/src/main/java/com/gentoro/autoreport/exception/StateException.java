package com.gentoro.autoreport.exception;

/** A component was used before initialization or after shutdown. */
public class StateException extends AutoReportException {
  public StateException(String message) {
    super(AutoReportErrorCode.STATE_ERROR, message);
  }
}
