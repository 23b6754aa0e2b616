package com.gentoro.autoreport.context;

public enum ContextScope {
  PARAGRAPH,
  SECTION,
  DOCUMENT,
  BUSINESS_RULE
}
