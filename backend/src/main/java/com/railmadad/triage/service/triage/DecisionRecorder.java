package com.railmadad.triage.service.triage;

import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.exception.StorageUnavailableException;

/** Durable sink for triage decisions. */
public interface DecisionRecorder {

  /**
   * @throws StorageUnavailableException if the decision could not be persisted
   */
  void record(ComplaintDecision decision);
}
