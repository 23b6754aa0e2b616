package com.gentoro.autoreport.query;

public enum IdentifierKind {
  TABLE,
  COLUMN,
  UNKNOWN
}
