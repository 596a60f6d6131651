package com.railmadad.triage.service.triage;

/** Lifecycle of one triage run. DECIDED, ERROR and CANCELLED are terminal. */
public enum TriageState {
  RECEIVED,
  EXTRACTED,
  CLASSIFIED,
  DEDUPED,
  ROUTED,
  DECIDED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this == DECIDED || this == ERROR || this == CANCELLED;
  }

  /** Once routed, the decision is being persisted and can no longer be withdrawn. */
  public boolean isCancellable() {
    return ordinal() < ROUTED.ordinal();
  }
}
