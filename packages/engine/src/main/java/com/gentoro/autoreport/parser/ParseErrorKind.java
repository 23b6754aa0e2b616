package com.gentoro.autoreport.parser;

public enum ParseErrorKind {
  MALFORMED_DELIMITER,
  UNTERMINATED_NESTING,
  UNKNOWN_TYPE,
  EMPTY_NAME,
  MALFORMED_PARAMETER,
  EMPTY_PARAMETER,
  DUPLICATE_PARAMETER,
  INVALID_CONDITION,
  MAX_DEPTH_EXCEEDED,
  NESTED_ERROR
}
