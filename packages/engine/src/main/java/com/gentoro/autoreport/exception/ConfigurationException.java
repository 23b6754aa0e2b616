package com.gentoro.autoreport.exception;

/** Invalid or inconsistent configuration detected at load time. */
public class ConfigurationException extends AutoReportException {
  public ConfigurationException(String message) {
    super(AutoReportErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(AutoReportErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  protected ConfigurationException(AutoReportErrorCode code, String message) {
    super(code, message);
  }
}
