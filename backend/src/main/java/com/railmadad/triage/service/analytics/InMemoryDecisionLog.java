package com.railmadad.triage.service.analytics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.springframework.stereotype.Repository;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.service.triage.DecisionRecorder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Bounded in-process decision log; the oldest decisions are evicted first. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InMemoryDecisionLog implements DecisionRecorder {

  private final TriageProperties properties;
  private final Deque<ComplaintDecision> decisions = new ArrayDeque<>();

  @Override
  public synchronized void record(ComplaintDecision decision) {
    decisions.addLast(decision);
    int max = Math.max(1, properties.getAnalytics().getMaxDecisions());
    while (decisions.size() > max) {
      ComplaintDecision evicted = decisions.removeFirst();
      log.trace("Evicted decision {} from log", evicted.getComplaintId());
    }
  }

  /** Decisions in arrival order. */
  public synchronized List<ComplaintDecision> snapshot() {
    return new ArrayList<>(decisions);
  }

  public synchronized int size() {
    return decisions.size();
  }
}
