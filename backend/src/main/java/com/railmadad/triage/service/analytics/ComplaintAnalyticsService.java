package com.railmadad.triage.service.analytics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties.UrgencyTier;
import com.railmadad.triage.dto.analytics.CategoryTrend;
import com.railmadad.triage.dto.analytics.DepartmentStats;
import com.railmadad.triage.dto.analytics.UrgencyBucket;
import com.railmadad.triage.dto.cluster.Cluster;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.dto.complaint.Department;
import com.railmadad.triage.dto.complaint.Sentiment;
import com.railmadad.triage.service.clustering.ClusterStore;
import com.railmadad.triage.service.routing.UrgencyTierPolicy;

import lombok.RequiredArgsConstructor;

/** Read-only aggregates over recorded decisions and cluster history. */
@Service
@RequiredArgsConstructor
public class ComplaintAnalyticsService {

  private final InMemoryDecisionLog decisionLog;
  private final ClusterStore clusterStore;
  private final UrgencyTierPolicy tierPolicy;

  /** Count and share per category, most frequent first. */
  public List<CategoryTrend> categoryTrends() {
    List<ComplaintDecision> decisions = decisionLog.snapshot();
    Map<Category, Long> counts =
        decisions.stream()
            .collect(
                Collectors.groupingBy(
                    ComplaintDecision::getCategory,
                    () -> new EnumMap<>(Category.class),
                    Collectors.counting()));

    return counts.entrySet().stream()
        .map(
            entry ->
                CategoryTrend.builder()
                    .category(entry.getKey())
                    .count(entry.getValue())
                    .percentage(percentage(entry.getValue(), decisions.size()))
                    .build())
        .sorted(Comparator.comparingLong(CategoryTrend::getCount).reversed())
        .collect(Collectors.toList());
  }

  public List<DepartmentStats> departmentStats() {
    double highThreshold = topTierThreshold();
    Map<Department, List<ComplaintDecision>> byDepartment =
        decisionLog.snapshot().stream()
            .collect(
                Collectors.groupingBy(
                    ComplaintDecision::getDepartment,
                    () -> new EnumMap<>(Department.class),
                    Collectors.toList()));

    List<DepartmentStats> stats = new ArrayList<>();
    for (Map.Entry<Department, List<ComplaintDecision>> entry : byDepartment.entrySet()) {
      List<ComplaintDecision> decisions = entry.getValue();
      stats.add(
          DepartmentStats.builder()
              .department(entry.getKey())
              .total(decisions.size())
              .highUrgencyPercentage(
                  percentage(count(decisions, d -> d.getUrgency() >= highThreshold), decisions.size()))
              .negativeSentimentPercentage(
                  percentage(
                      count(decisions, d -> d.getSentiment() == Sentiment.NEGATIVE),
                      decisions.size()))
              .build());
    }
    return stats;
  }

  /** Decisions per urgency tier, highest tier first; empty tiers are included. */
  public List<UrgencyBucket> urgencyDistribution() {
    List<ComplaintDecision> decisions = decisionLog.snapshot();
    List<UrgencyTier> tiers = new ArrayList<>(tierPolicy.tiers());
    Map<String, Long> counts = new LinkedHashMap<>();
    for (int i = tiers.size() - 1; i >= 0; i--) {
      counts.put(tiers.get(i).getLabel(), 0L);
    }
    for (ComplaintDecision decision : decisions) {
      counts.merge(tierPolicy.tierFor(decision.getUrgency()).getLabel(), 1L, Long::sum);
    }

    return counts.entrySet().stream()
        .map(
            entry ->
                UrgencyBucket.builder()
                    .tier(entry.getKey())
                    .count(entry.getValue())
                    .percentage(percentage(entry.getValue(), decisions.size()))
                    .build())
        .collect(Collectors.toList());
  }

  /** Clusters, active or aged out, with at least {@code minMembers} members, largest first. */
  public List<Cluster> recurringIssues(int minMembers) {
    return clusterStore.findAll().stream()
        .filter(cluster -> cluster.getMemberCount() >= minMembers)
        .sorted(
            Comparator.comparingInt(Cluster::getMemberCount)
                .reversed()
                .thenComparing(Cluster::getLastSeen, Comparator.reverseOrder()))
        .collect(Collectors.toList());
  }

  /** Most recent decisions first. */
  public List<ComplaintDecision> recentDecisions(int limit) {
    List<ComplaintDecision> decisions = decisionLog.snapshot();
    List<ComplaintDecision> recent = new ArrayList<>();
    for (int i = decisions.size() - 1; i >= 0 && recent.size() < limit; i--) {
      recent.add(decisions.get(i));
    }
    return recent;
  }

  private double topTierThreshold() {
    List<UrgencyTier> tiers = tierPolicy.tiers();
    return tiers.isEmpty() ? 1.0 : tiers.get(tiers.size() - 1).getThreshold();
  }

  private static long count(List<ComplaintDecision> decisions, Predicate<ComplaintDecision> test) {
    return decisions.stream().filter(test).count();
  }

  private static double percentage(long part, long total) {
    if (total == 0) {
      return 0.0;
    }
    return Math.round(part * 10000.0 / total) / 100.0;
  }
}
