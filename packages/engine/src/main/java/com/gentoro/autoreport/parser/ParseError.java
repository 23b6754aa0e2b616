package com.gentoro.autoreport.parser;

/**
 * A syntax problem found in a single placeholder.
 *
 * @param offset character offset within the document where the offending token starts
 */
public record ParseError(ParseErrorKind kind, String message, int offset) {
  @Override
  public String toString() {
    return kind + "@" + offset + ": " + message;
  }
}
