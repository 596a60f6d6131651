package com.railmadad.triage.service.routing;

import java.time.Instant;

import com.railmadad.triage.dto.complaint.Department;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoutingResult {

  Department department;
  Instant slaDeadline;

  /** Urgency after repetition escalation; equals the classifier urgency when not escalated. */
  double effectiveUrgency;

  boolean escalated;
  String urgencyTier;
}
