package com.railmadad.triage.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.railmadad.triage.dto.analytics.CategoryTrend;
import com.railmadad.triage.dto.analytics.DepartmentStats;
import com.railmadad.triage.dto.analytics.UrgencyBucket;
import com.railmadad.triage.dto.cluster.Cluster;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.service.analytics.ComplaintAnalyticsService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Tag(name = "Complaint Analytics", description = "Read-only trends over triage decisions")
public class AnalyticsController {

  private static final int MAX_LIMIT = 500;

  private final ComplaintAnalyticsService analyticsService;

  @GetMapping("/categories")
  @Operation(summary = "Complaint volume per category")
  public ResponseEntity<List<CategoryTrend>> categoryTrends() {
    return ResponseEntity.ok(analyticsService.categoryTrends());
  }

  @GetMapping("/departments")
  @Operation(summary = "Workload, high-urgency share and negative-sentiment share per department")
  public ResponseEntity<List<DepartmentStats>> departmentStats() {
    return ResponseEntity.ok(analyticsService.departmentStats());
  }

  @GetMapping("/urgency")
  @Operation(summary = "Decisions per urgency tier")
  public ResponseEntity<List<UrgencyBucket>> urgencyDistribution() {
    return ResponseEntity.ok(analyticsService.urgencyDistribution());
  }

  @GetMapping("/recurring")
  @Operation(summary = "Recurring issues", description = "Clusters with at least min_members reports")
  public ResponseEntity<List<Cluster>> recurringIssues(
      @Parameter(description = "Minimum number of reports")
          @RequestParam(name = "min_members", defaultValue = "2")
          int minMembers) {
    if (minMembers < 1) {
      throw new IllegalArgumentException("min_members must be at least 1");
    }
    return ResponseEntity.ok(analyticsService.recurringIssues(minMembers));
  }

  @GetMapping("/decisions")
  @Operation(summary = "Most recent triage decisions")
  public ResponseEntity<List<ComplaintDecision>> recentDecisions(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    log.debug("[ANALYTICS-CONTROLLER] Fetching {} recent decisions", limit);
    return ResponseEntity.ok(analyticsService.recentDecisions(limit));
  }
}
