package com.gentoro.autoreport.exception;

/** Failure raised by a query collaborator that is not tied to a schema identifier. */
public class QueryExecutionException extends AutoReportException {
  public QueryExecutionException(String message) {
    super(AutoReportErrorCode.QUERY_EXECUTION_ERROR, message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(AutoReportErrorCode.QUERY_EXECUTION_ERROR, message, cause);
  }

  public QueryExecutionException(AutoReportErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
