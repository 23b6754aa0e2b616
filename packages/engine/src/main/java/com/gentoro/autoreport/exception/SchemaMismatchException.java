package com.gentoro.autoreport.exception;

/** A query referenced a table or column that the data source does not know. */
public class SchemaMismatchException extends AutoReportException {
  private final String identifier;

  public SchemaMismatchException(String identifier, String message) {
    super(AutoReportErrorCode.SCHEMA_MISMATCH, message);
    this.identifier = identifier;
    withContext("identifier", identifier);
  }

  public String getIdentifier() {
    return identifier;
  }
}
