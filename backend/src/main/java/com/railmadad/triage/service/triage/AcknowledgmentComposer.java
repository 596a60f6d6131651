package com.railmadad.triage.service.triage;

import org.springframework.stereotype.Component;

import com.railmadad.triage.dto.complaint.ComplaintDecision;

/** Passenger-facing confirmation text for a recorded decision. */
@Component
public class AcknowledgmentComposer {

  public String compose(ComplaintDecision decision) {
    StringBuilder text = new StringBuilder();
    text.append("Complaint ID: ").append(decision.getComplaintId()).append(" received successfully. ");
    text.append("Category: ").append(decision.getCategory());
    text.append(", Urgency: ").append(decision.getUrgencyTier()).append(". ");
    text.append("Forwarded to: ").append(decision.getDepartment()).append(". ");
    text.append("Resolution expected by ").append(decision.getSlaDeadline()).append('.');
    if (!decision.isNewCluster()) {
      text.append(" A similar issue has already been reported ")
          .append(decision.getClusterMemberCount() - 1)
          .append(decision.getClusterMemberCount() == 2 ? " time." : " times.");
    }
    return text.toString();
  }
}
