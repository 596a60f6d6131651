package com.railmadad.triage.service.triage;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.dto.complaint.Department;
import com.railmadad.triage.fixtures.TriageTestFixtures;

@DisplayName("AcknowledgmentComposer Tests")
class AcknowledgmentComposerTest {

  private final AcknowledgmentComposer composer = new AcknowledgmentComposer();

  private ComplaintDecision.ComplaintDecisionBuilder decision() {
    return ComplaintDecision.builder()
        .complaintId("c-42")
        .category(Category.MAINTENANCE)
        .urgencyTier("LOW")
        .department(Department.MAINTENANCE)
        .slaDeadline(TriageTestFixtures.NOW.plus(Duration.ofHours(12)))
        .newCluster(true)
        .clusterMemberCount(1);
  }

  @Test
  void shouldSummarizeRoutingForNewIssue() {
    String text = composer.compose(decision().build());

    assertThat(text)
        .isEqualTo(
            "Complaint ID: c-42 received successfully. Category: MAINTENANCE, Urgency: LOW. "
                + "Forwarded to: MAINTENANCE. Resolution expected by 2026-03-01T22:00:00Z.");
  }

  @Test
  void shouldMentionEarlierReportsForDuplicates() {
    assertThat(composer.compose(decision().newCluster(false).clusterMemberCount(2).build()))
        .endsWith("A similar issue has already been reported 1 time.");
    assertThat(composer.compose(decision().newCluster(false).clusterMemberCount(4).build()))
        .endsWith("A similar issue has already been reported 3 times.");
  }
}
