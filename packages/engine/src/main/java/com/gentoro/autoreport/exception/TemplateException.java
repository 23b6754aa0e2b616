package com.gentoro.autoreport.exception;

/** Template content could not be read or structured. */
public class TemplateException extends AutoReportException {
  public TemplateException(String message, Throwable cause) {
    super(AutoReportErrorCode.TEMPLATE_ERROR, message, cause);
  }
}
