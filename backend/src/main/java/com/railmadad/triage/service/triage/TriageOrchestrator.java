package com.railmadad.triage.service.triage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.cluster.DedupOutcome;
import com.railmadad.triage.dto.complaint.ClassificationResult;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.dto.complaint.ComplaintInput;
import com.railmadad.triage.dto.complaint.Degradation;
import com.railmadad.triage.dto.complaint.FeatureBundle;
import com.railmadad.triage.exception.ModelUnavailableException;
import com.railmadad.triage.exception.TriageException;
import com.railmadad.triage.service.classification.ComplaintClassifier;
import com.railmadad.triage.service.classification.SentimentAnalyzer;
import com.railmadad.triage.service.clustering.ComplaintDeduplicator;
import com.railmadad.triage.service.clustering.FeatureVectorizer;
import com.railmadad.triage.service.extraction.FeatureExtractor;
import com.railmadad.triage.service.routing.ComplaintRouter;
import com.railmadad.triage.service.routing.RoutingResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs one complaint through extraction, classification, deduplication and routing, then records
 * the decision.
 *
 * <p>Classification keeps a reserved slice of the latency budget and OCR only gets what is left
 * before that slice. When classification overruns or the model is unavailable the run continues
 * with the fallback classification (category OTHER, configured fallback urgency) and the decision
 * is marked degraded. Only a failure to record the
 * decision, or a routing configuration gap, fails the run.
 */
@Slf4j
@Service
public class TriageOrchestrator {

  static final String MDC_COMPLAINT_ID = "complaintId";

  private final FeatureExtractor featureExtractor;
  private final ComplaintClassifier classifier;
  private final FeatureVectorizer vectorizer;
  private final ComplaintDeduplicator deduplicator;
  private final ComplaintRouter router;
  private final SentimentAnalyzer sentimentAnalyzer;
  private final DecisionRecorder decisionRecorder;
  private final TriageProperties properties;
  private final Clock clock;
  private final AsyncTaskExecutor classifierExecutor;
  private final AsyncTaskExecutor triageExecutor;

  public TriageOrchestrator(
      FeatureExtractor featureExtractor,
      ComplaintClassifier classifier,
      FeatureVectorizer vectorizer,
      ComplaintDeduplicator deduplicator,
      ComplaintRouter router,
      SentimentAnalyzer sentimentAnalyzer,
      DecisionRecorder decisionRecorder,
      TriageProperties properties,
      Clock clock,
      @Qualifier("classifierExecutor") AsyncTaskExecutor classifierExecutor,
      @Qualifier("triageExecutor") AsyncTaskExecutor triageExecutor) {
    this.featureExtractor = featureExtractor;
    this.classifier = classifier;
    this.vectorizer = vectorizer;
    this.deduplicator = deduplicator;
    this.router = router;
    this.sentimentAnalyzer = sentimentAnalyzer;
    this.decisionRecorder = decisionRecorder;
    this.properties = properties;
    this.clock = clock;
    this.classifierExecutor = classifierExecutor;
    this.triageExecutor = triageExecutor;
  }

  public ComplaintDecision triage(ComplaintInput input) {
    return triage(input, properties.getDefaultBudget());
  }

  /**
   * Triages synchronously on the calling thread.
   *
   * @throws TriageException if the decision could not be produced or recorded
   */
  public ComplaintDecision triage(ComplaintInput input, Duration budget) {
    return execute(input, budget, new TriageRun(input.getComplaintId()));
  }

  public TriageHandle submit(ComplaintInput input) {
    return submit(input, properties.getDefaultBudget());
  }

  /** Triages on the triage executor; the handle allows cancellation until routing completes. */
  public TriageHandle submit(ComplaintInput input, Duration budget) {
    TriageRun run = new TriageRun(input.getComplaintId());
    CompletableFuture<ComplaintDecision> decision;
    try {
      decision = CompletableFuture.supplyAsync(() -> execute(input, budget, run), triageExecutor);
    } catch (RejectedExecutionException e) {
      run.fail();
      decision = CompletableFuture.failedFuture(e);
    }
    return new TriageHandle(run, decision);
  }

  private ComplaintDecision execute(ComplaintInput input, Duration budget, TriageRun run) {
    long startNanos = System.nanoTime();
    long deadlineNanos = startNanos + budget.toNanos();
    String complaintId = input.getComplaintId();
    MDC.put(MDC_COMPLAINT_ID, complaintId);
    try {
      Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

      // OCR must leave the classifier its slice of the budget
      Duration ocrLimit =
          budget
              .minus(properties.getClassification().getTimeout())
              .minusNanos(System.nanoTime() - startNanos);
      FeatureBundle bundle = featureExtractor.extract(input, ocrLimit);
      if (bundle.isDegraded()) {
        degradations.add(Degradation.OCR_FAILED);
      }
      run.advance(TriageState.EXTRACTED);

      ClassificationResult classification =
          classifyWithinBudget(bundle, Duration.ofNanos(deadlineNanos - System.nanoTime()));
      if (classification.isFallback()) {
        degradations.add(Degradation.CLASSIFIER_FALLBACK);
      }
      run.advance(TriageState.CLASSIFIED);

      DedupOutcome dedup =
          deduplicator.matchOrCreate(
              classification.getCategory(),
              bundle.getLocationToken(),
              vectorizer.vectorize(bundle),
              complaintId,
              input.getSubmittedAt());
      if (dedup.isDegraded()) {
        degradations.add(Degradation.DEDUP_UNAVAILABLE);
      }
      run.advance(TriageState.DEDUPED);

      RoutingResult routing =
          router.route(
              classification.getCategory(),
              classification.getUrgency(),
              dedup.isNewCluster(),
              dedup.memberCount(),
              input.getSubmittedAt());
      run.advance(TriageState.ROUTED);

      Instant decidedAt = clock.instant();
      ComplaintDecision decision =
          ComplaintDecision.builder()
              .complaintId(complaintId)
              .category(classification.getCategory())
              .urgency(routing.getEffectiveUrgency())
              .urgencyTier(routing.getUrgencyTier())
              .department(routing.getDepartment())
              .slaDeadline(routing.getSlaDeadline())
              .duplicateOf(dedup.isNewCluster() ? null : dedup.clusterId())
              .clusterId(dedup.clusterId())
              .newCluster(dedup.isNewCluster())
              .clusterMemberCount(dedup.memberCount())
              .confidence(classification.getConfidence())
              .rawUrgency(classification.getUrgency())
              .urgencyEscalated(routing.isEscalated())
              .sentiment(sentimentAnalyzer.analyze(bundle.combinedText()))
              .modelId(classification.getModelId())
              .degradations(degradations)
              .submittedAt(input.getSubmittedAt())
              .decidedAt(decidedAt)
              .processingTimeMs(
                  TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
              .build();

      decisionRecorder.record(decision);
      run.advance(TriageState.DECIDED);

      log.info(
          "Triaged complaint {}: category={}, urgency={}, department={}, deadline={}, cluster={}, took={}ms{}",
          complaintId,
          decision.getCategory(),
          String.format("%.2f", decision.getUrgency()),
          decision.getDepartment(),
          decision.getSlaDeadline(),
          decision.getClusterId(),
          decision.getProcessingTimeMs(),
          degradations.isEmpty() ? "" : ", degraded=" + degradations);
      return decision;

    } catch (CancellationException e) {
      log.info("Triage of complaint {} cancelled in state {}", complaintId, run.getState());
      throw e;
    } catch (TriageException e) {
      run.fail();
      log.error("Triage of complaint {} failed: {}", complaintId, e.getMessage(), e);
      throw e;
    } catch (RuntimeException e) {
      run.fail();
      log.error("Unexpected error triaging complaint {}", complaintId, e);
      throw e;
    } finally {
      MDC.remove(MDC_COMPLAINT_ID);
    }
  }

  private ClassificationResult classifyWithinBudget(FeatureBundle bundle, Duration remaining) {
    Duration slice = properties.getClassification().getTimeout();
    if (remaining.compareTo(slice) < 0) {
      slice = remaining;
    }
    if (slice.isNegative() || slice.isZero()) {
      return fallback("latency budget exhausted before classification", null);
    }

    Future<ClassificationResult> future;
    try {
      future = classifierExecutor.submit(() -> classifier.classify(bundle));
    } catch (RejectedExecutionException e) {
      return fallback("classifier executor saturated", e);
    }

    try {
      return future.get(slice.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return fallback("classifier exceeded " + slice.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof ModelUnavailableException) {
        return fallback(cause.getMessage(), cause);
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Classifier failed", cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while classifying");
    }
  }

  private ClassificationResult fallback(String reason, Throwable cause) {
    if (!properties.getClassification().isFallbackEnabled()) {
      throw new ModelUnavailableException("Classification unavailable: " + reason, cause);
    }
    log.warn("Using fallback classification: {}", reason);
    return classifier.fallback();
  }
}
