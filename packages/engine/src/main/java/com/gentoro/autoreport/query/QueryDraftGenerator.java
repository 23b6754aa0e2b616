package com.gentoro.autoreport.query;

/**
 * Produces query text for a request. Implementations may be wrong; the agent checks every draft
 * and never trusts a generator to avoid identifiers it already saw rejected.
 */
@FunctionalInterface
public interface QueryDraftGenerator {

  String draft(QueryRequest request, SchemaCatalog catalog, DraftFeedback feedback);
}
