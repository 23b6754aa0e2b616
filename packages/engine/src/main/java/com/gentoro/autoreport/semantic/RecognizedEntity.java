package com.gentoro.autoreport.semantic;

/**
 * Entity found by pattern rules.
 *
 * @param start offset within the text it was found in
 * @param fromName true when found in the placeholder name, false when found in its neighborhood
 */
public record RecognizedEntity(
    String text, EntityType type, int start, int end, boolean fromName) {}
