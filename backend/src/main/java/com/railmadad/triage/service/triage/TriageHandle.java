package com.railmadad.triage.service.triage;

import java.util.concurrent.CompletableFuture;

import com.railmadad.triage.dto.complaint.ComplaintDecision;

/** Handle on an asynchronously submitted triage. */
public class TriageHandle {

  private final TriageRun run;
  private final CompletableFuture<ComplaintDecision> decision;

  TriageHandle(TriageRun run, CompletableFuture<ComplaintDecision> decision) {
    this.run = run;
    this.decision = decision;
  }

  public String getComplaintId() {
    return run.getComplaintId();
  }

  public TriageState getState() {
    return run.getState();
  }

  /**
   * Completes with the decision, or exceptionally with a {@code CancellationException} or a
   * {@code TriageException}.
   */
  public CompletableFuture<ComplaintDecision> decision() {
    return decision;
  }

  /**
   * Requests cancellation. Effective only before the run reaches {@link TriageState#ROUTED}; the
   * run stops at its next stage boundary.
   *
   * @return false if the decision is already being recorded or the run has finished
   */
  public boolean cancel() {
    return run.cancel();
  }
}
