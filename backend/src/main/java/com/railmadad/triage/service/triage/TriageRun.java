package com.railmadad.triage.service.triage;

import java.util.concurrent.CancellationException;

import lombok.Getter;

/** Mutable progress of a single triage; transitions and cancellation are serialized. */
class TriageRun {

  @Getter private final String complaintId;
  private TriageState state = TriageState.RECEIVED;
  private boolean cancelRequested;

  TriageRun(String complaintId) {
    this.complaintId = complaintId;
  }

  synchronized TriageState getState() {
    return state;
  }

  /**
   * @throws CancellationException if cancellation was requested before this transition
   */
  synchronized void advance(TriageState next) {
    if (cancelRequested) {
      state = TriageState.CANCELLED;
      throw new CancellationException("Triage of complaint " + complaintId + " was cancelled");
    }
    state = next;
  }

  synchronized boolean cancel() {
    if (!state.isCancellable()) {
      return false;
    }
    cancelRequested = true;
    return true;
  }

  synchronized void fail() {
    if (!state.isTerminal()) {
      state = TriageState.ERROR;
    }
  }
}
