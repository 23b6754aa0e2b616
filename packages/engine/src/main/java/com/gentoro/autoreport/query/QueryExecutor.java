package com.gentoro.autoreport.query;

/**
 * Collaborator that runs a query against a data source. Implementations report failures as
 * {@link QueryOutcome} variants instead of throwing, so the agent can pick its next state.
 */
@FunctionalInterface
public interface QueryExecutor {

  QueryOutcome execute(String query, DataSourceDescriptor dataSource);
}
