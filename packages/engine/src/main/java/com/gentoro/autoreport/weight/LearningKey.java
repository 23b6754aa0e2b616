package com.gentoro.autoreport.weight;

import com.gentoro.autoreport.parser.PlaceholderType;

/** Learning store key: document type plus declared placeholder type ({@code null} for stubs). */
public record LearningKey(String documentType, PlaceholderType placeholderType) {
  public LearningKey {
    documentType = documentType == null ? "generic" : documentType;
  }
}
