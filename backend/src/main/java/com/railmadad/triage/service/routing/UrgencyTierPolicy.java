package com.railmadad.triage.service.routing;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.config.TriageProperties.UrgencyTier;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

/** Maps urgency scores onto the configured tiers. */
@Component
@RequiredArgsConstructor
public class UrgencyTierPolicy {

  /** Applies below the lowest configured threshold. */
  static final UrgencyTier BASE_TIER = new UrgencyTier("BASE", 0.0, 1.0);

  private final TriageProperties properties;

  /**
   * Rejects tier tables under which a higher urgency could get a later deadline.
   *
   * @throws IllegalStateException if a multiplier is not positive or shrinks as thresholds grow
   */
  @PostConstruct
  public void validate() {
    UrgencyTier previous = null;
    for (UrgencyTier tier : tiers()) {
      if (!(tier.getMultiplier() > 0)) {
        throw new IllegalStateException(
            "Urgency tier " + tier.getLabel() + " must have a positive multiplier");
      }
      if (previous != null && tier.getMultiplier() < previous.getMultiplier()) {
        throw new IllegalStateException(
            String.format(
                "Urgency tier %s (threshold %s) has a smaller multiplier than tier %s (threshold %s)",
                tier.getLabel(),
                tier.getThreshold(),
                previous.getLabel(),
                previous.getThreshold()));
      }
      previous = tier;
    }
  }

  public List<UrgencyTier> tiers() {
    return properties.getRouting().getUrgencyTiers().stream()
        .sorted(Comparator.comparingDouble(UrgencyTier::getThreshold))
        .collect(Collectors.toList());
  }

  /** The highest tier whose threshold the urgency reaches. */
  public UrgencyTier tierFor(double urgency) {
    UrgencyTier applicable = BASE_TIER;
    for (UrgencyTier tier : tiers()) {
      if (urgency >= tier.getThreshold()) {
        applicable = tier;
      }
    }
    return applicable;
  }

  /** The first tier with a threshold above the urgency, if any. */
  public Optional<UrgencyTier> nextTierAbove(double urgency) {
    return tiers().stream().filter(tier -> tier.getThreshold() > urgency).findFirst();
  }
}
