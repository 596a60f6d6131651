package com.railmadad.triage.service.routing;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.config.TriageProperties.UrgencyTier;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.Department;
import com.railmadad.triage.exception.UnknownCategoryException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the responsible department and the resolution deadline.
 *
 * <p>The deadline is {@code submittedAt + baseWindow(category) / multiplier(tier)}. A complaint
 * that joins an existing cluster of at least the repetition threshold is lifted to the next
 * tier's threshold first. Higher urgency never yields a later deadline as long as tier multipliers
 * grow with their thresholds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ComplaintRouter {

  private final TriageProperties properties;
  private final UrgencyTierPolicy tierPolicy;

  public RoutingResult route(
      Category category,
      double urgency,
      boolean newCluster,
      int clusterMemberCount,
      Instant submittedAt) {
    TriageProperties.Routing routing = properties.getRouting();

    Department department = routing.getDepartments().get(category);
    if (department == null) {
      throw new UnknownCategoryException(category, "department");
    }
    Duration baseWindow = routing.getBaseWindows().get(category);
    if (baseWindow == null) {
      throw new UnknownCategoryException(category, "base resolution window");
    }

    double effectiveUrgency = urgency;
    boolean escalated = false;
    if (!newCluster && clusterMemberCount >= routing.getRepetitionThreshold()) {
      Optional<UrgencyTier> next = tierPolicy.nextTierAbove(urgency);
      if (next.isPresent()) {
        effectiveUrgency = next.get().getThreshold();
        escalated = true;
        log.info(
            "Recurring {} issue ({} reports), escalating urgency {} -> {}",
            category,
            clusterMemberCount,
            urgency,
            effectiveUrgency);
      }
    }

    UrgencyTier tier = tierPolicy.tierFor(effectiveUrgency);
    if (tier.getMultiplier() <= 0) {
      throw new IllegalStateException(
          "Urgency tier " + tier.getLabel() + " has a non-positive multiplier");
    }
    Duration window = Duration.ofMillis(Math.round(baseWindow.toMillis() / tier.getMultiplier()));

    return RoutingResult.builder()
        .department(department)
        .slaDeadline(submittedAt.plus(window))
        .effectiveUrgency(effectiveUrgency)
        .escalated(escalated)
        .urgencyTier(tier.getLabel())
        .build();
  }
}
