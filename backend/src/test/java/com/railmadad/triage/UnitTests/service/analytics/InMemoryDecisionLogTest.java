package com.railmadad.triage.service.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.ComplaintDecision;

@DisplayName("InMemoryDecisionLog Tests")
class InMemoryDecisionLogTest {

  private TriageProperties properties;
  private InMemoryDecisionLog decisionLog;

  @BeforeEach
  void setUp() {
    properties = new TriageProperties();
    decisionLog = new InMemoryDecisionLog(properties);
  }

  private static ComplaintDecision decision(String id) {
    return ComplaintDecision.builder().complaintId(id).build();
  }

  @Test
  void shouldKeepDecisionsInArrivalOrder() {
    decisionLog.record(decision("a"));
    decisionLog.record(decision("b"));

    assertThat(decisionLog.snapshot())
        .extracting(ComplaintDecision::getComplaintId)
        .containsExactly("a", "b");
  }

  @Test
  void shouldEvictOldestBeyondCapacity() {
    properties.getAnalytics().setMaxDecisions(2);

    decisionLog.record(decision("a"));
    decisionLog.record(decision("b"));
    decisionLog.record(decision("c"));

    assertThat(decisionLog.size()).isEqualTo(2);
    assertThat(decisionLog.snapshot())
        .extracting(ComplaintDecision::getComplaintId)
        .containsExactly("b", "c");
  }

  @Test
  void shouldReturnDetachedSnapshot() {
    decisionLog.record(decision("a"));

    decisionLog.snapshot().clear();

    assertThat(decisionLog.size()).isEqualTo(1);
  }
}
