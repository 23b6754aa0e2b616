package com.gentoro.autoreport.context;

/** Where a placeholder occurrence sits in the document structure. */
public record PlaceholderLocation(
    Section section, int sectionIndex, Paragraph paragraph, int paragraphIndex) {}
