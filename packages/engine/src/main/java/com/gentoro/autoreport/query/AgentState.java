package com.gentoro.autoreport.query;

public enum AgentState {
  DRAFT,
  EXECUTING,
  VALIDATING,
  CORRECTING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
