package com.railmadad.triage.service.triage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.dto.complaint.ComplaintDecision;
import com.railmadad.triage.dto.complaint.ComplaintInput;
import com.railmadad.triage.dto.complaint.Degradation;
import com.railmadad.triage.dto.complaint.Department;
import com.railmadad.triage.exception.ModelUnavailableException;
import com.railmadad.triage.exception.StorageUnavailableException;
import com.railmadad.triage.fixtures.TriageTestFixtures;
import com.railmadad.triage.service.analytics.InMemoryDecisionLog;
import com.railmadad.triage.service.classification.ComplaintClassifier;
import com.railmadad.triage.service.classification.ComplaintModel;
import com.railmadad.triage.service.classification.KeywordComplaintModel;
import com.railmadad.triage.service.classification.SentimentAnalyzer;
import com.railmadad.triage.service.classification.UrgencyScorer;
import com.railmadad.triage.service.clustering.ClusterStore;
import com.railmadad.triage.service.clustering.ComplaintDeduplicator;
import com.railmadad.triage.service.clustering.FeatureVectorizer;
import com.railmadad.triage.service.clustering.InMemoryClusterStore;
import com.railmadad.triage.service.extraction.FeatureExtractor;
import com.railmadad.triage.service.extraction.LocationNormalizer;
import com.railmadad.triage.service.extraction.OcrService;
import com.railmadad.triage.service.extraction.TextNormalizer;
import com.railmadad.triage.service.routing.ComplaintRouter;
import com.railmadad.triage.service.routing.UrgencyTierPolicy;

@ExtendWith(MockitoExtension.class)
@DisplayName("TriageOrchestrator Tests")
class TriageOrchestratorTest {

  private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x01};

  @Mock private OcrService ocrService;

  private TriageProperties properties;
  private InMemoryDecisionLog decisionLog;
  private ThreadPoolTaskExecutor ocrExecutor;
  private ThreadPoolTaskExecutor classifierExecutor;
  private ThreadPoolTaskExecutor triageExecutor;
  private TriageOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    properties = new TriageProperties();
    decisionLog = new InMemoryDecisionLog(properties);
    ocrExecutor = TriageTestFixtures.executor("ocr-test-");
    classifierExecutor = TriageTestFixtures.executor("classifier-test-");
    triageExecutor = TriageTestFixtures.executor("triage-test-");
    lenient().when(ocrService.getProviderName()).thenReturn("mock");
    orchestrator =
        orchestrator(new KeywordComplaintModel(), new InMemoryClusterStore(), decisionLog);
  }

  @AfterEach
  void tearDown() {
    ocrExecutor.shutdown();
    classifierExecutor.shutdown();
    triageExecutor.shutdown();
  }

  private TriageOrchestrator orchestrator(
      ComplaintModel model, ClusterStore store, DecisionRecorder recorder) {
    TextNormalizer textNormalizer = new TextNormalizer();
    UrgencyTierPolicy tierPolicy = new UrgencyTierPolicy(properties);
    return new TriageOrchestrator(
        new FeatureExtractor(
            ocrService, textNormalizer, new LocationNormalizer(properties), properties, ocrExecutor),
        new ComplaintClassifier(
            model, new UrgencyScorer(properties, TriageTestFixtures.fixedClock()), properties),
        new FeatureVectorizer(textNormalizer, properties),
        new ComplaintDeduplicator(store, properties, TriageTestFixtures.fixedClock()),
        new ComplaintRouter(properties, tierPolicy),
        new SentimentAnalyzer(),
        recorder,
        properties,
        TriageTestFixtures.fixedClock(),
        classifierExecutor,
        triageExecutor);
  }

  @Nested
  @DisplayName("Routing decisions")
  class RoutingDecisions {

    @Test
    void shouldRouteFirstMaintenanceComplaint() {
      // Given
      ComplaintInput input =
          TriageTestFixtures.complaint("Seat broken, smells bad", "Coach-B12");

      // When
      ComplaintDecision decision = orchestrator.triage(input);

      // Then
      assertThat(decision.getComplaintId()).isEqualTo(input.getComplaintId());
      assertThat(decision.getCategory()).isEqualTo(Category.MAINTENANCE);
      assertThat(decision.getDepartment()).isEqualTo(Department.MAINTENANCE);
      assertThat(decision.getUrgency()).isEqualTo(0.3, within(1e-9));
      assertThat(decision.getUrgencyTier()).isEqualTo("LOW");
      assertThat(decision.isNewCluster()).isTrue();
      assertThat(decision.getDuplicateOf()).isNull();
      assertThat(decision.getClusterId()).isNotNull();
      assertThat(decision.getSlaDeadline())
          .isEqualTo(TriageTestFixtures.NOW.plus(Duration.ofHours(12)));
      assertThat(decision.getModelId()).isEqualTo("keyword-v1");
      assertThat(decision.isDegraded()).isFalse();
      assertThat(decision.getDecidedAt()).isEqualTo(TriageTestFixtures.NOW);
      assertThat(decisionLog.snapshot()).containsExactly(decision);
    }

    @Test
    void shouldMarkRepeatAsDuplicateAndEscalate() {
      // Given
      ComplaintDecision first =
          orchestrator.triage(TriageTestFixtures.complaint("Seat broken, smells bad", "Coach-B12"));

      // When
      ComplaintDecision second =
          orchestrator.triage(TriageTestFixtures.complaint("Seat broken, smells bad", "Coach-B12"));

      // Then
      assertThat(second.isNewCluster()).isFalse();
      assertThat(second.getDuplicateOf()).isEqualTo(first.getClusterId());
      assertThat(second.getClusterMemberCount()).isEqualTo(2);
      assertThat(second.isUrgencyEscalated()).isTrue();
      assertThat(second.getRawUrgency()).isEqualTo(0.3, within(1e-9));
      assertThat(second.getUrgency()).isEqualTo(0.5);
      assertThat(second.getUrgencyTier()).isEqualTo("MEDIUM");
      assertThat(second.getSlaDeadline())
          .isEqualTo(TriageTestFixtures.NOW.plus(Duration.ofHours(6)));
    }

    @Test
    void shouldFastTrackSafetyComplaint() {
      ComplaintDecision decision =
          orchestrator.triage(TriageTestFixtures.complaint("Fire smell in pantry car", "Pantry Car"));

      assertThat(decision.getCategory()).isEqualTo(Category.SAFETY);
      assertThat(decision.getDepartment()).isEqualTo(Department.SAFETY);
      assertThat(decision.getUrgency()).isEqualTo(0.9, within(1e-9));
      assertThat(decision.getUrgencyTier()).isEqualTo("HIGH");
      assertThat(decision.getSlaDeadline())
          .isEqualTo(TriageTestFixtures.NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void shouldRouteEmptyComplaintToGeneralAdministration() {
      ComplaintDecision decision =
          orchestrator.triage(TriageTestFixtures.complaint("", null));

      assertThat(decision.getCategory()).isEqualTo(Category.OTHER);
      assertThat(decision.getUrgency()).isEqualTo(0.5);
      assertThat(decision.getDepartment()).isEqualTo(Department.GENERAL_ADMINISTRATION);
      assertThat(decision.getSlaDeadline())
          .isEqualTo(TriageTestFixtures.NOW.plus(Duration.ofHours(24)));
      assertThat(decision.isDegraded()).isFalse();
    }

    @Test
    void shouldClearComplaintIdFromMdcAfterRun() {
      orchestrator.triage(TriageTestFixtures.complaint("fan not working", "Coach-A1"));

      assertThat(MDC.get(TriageOrchestrator.MDC_COMPLAINT_ID)).isNull();
    }
  }

  @Nested
  @DisplayName("Degraded runs")
  class DegradedRuns {

    @Test
    void shouldContinueTextOnlyWhenOcrTimesOut() throws Exception {
      // Given
      properties.getOcr().setTimeout(Duration.ofMillis(100));
      when(ocrService.extractText(any()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(2_000);
                return "late";
              });
      ComplaintInput input =
          ComplaintInput.builder()
              .text("toilet dirty")
              .imageBytes(IMAGE)
              .reporterLocation("Coach-S4")
              .submittedAt(TriageTestFixtures.NOW)
              .build();

      // When
      ComplaintDecision decision = orchestrator.triage(input, Duration.ofSeconds(5));

      // Then
      assertThat(decision.getDegradations()).containsExactly(Degradation.OCR_FAILED);
      assertThat(decision.getCategory()).isEqualTo(Category.CLEANLINESS);
    }

    @Test
    void shouldStillClassifySafetyWhenOcrHangsUnderDefaultBudget() throws Exception {
      // Given
      when(ocrService.extractText(any()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return "late";
              });
      ComplaintInput input =
          ComplaintInput.builder()
              .text("Fire smell in pantry car")
              .imageBytes(IMAGE)
              .reporterLocation("Pantry Car")
              .submittedAt(TriageTestFixtures.NOW)
              .build();

      // When
      ComplaintDecision decision = orchestrator.triage(input);

      // Then
      assertThat(decision.getCategory()).isEqualTo(Category.SAFETY);
      assertThat(decision.getDepartment()).isEqualTo(Department.SAFETY);
      assertThat(decision.getModelId()).isEqualTo("keyword-v1");
      assertThat(decision.getDegradations()).containsExactly(Degradation.OCR_FAILED);
      assertThat(decision.getProcessingTimeMs())
          .isLessThan(properties.getDefaultBudget().toMillis());
    }

    @Test
    void shouldFallBackWhenClassifierTimesOut() {
      // Given
      properties.getClassification().setTimeout(Duration.ofMillis(100));
      TriageOrchestrator slow =
          orchestrator(new SlowModel(Duration.ofSeconds(2)), new InMemoryClusterStore(), decisionLog);

      // When
      ComplaintDecision decision =
          slow.triage(TriageTestFixtures.complaint("seat broken", "Coach-B12"));

      // Then
      assertThat(decision.getCategory()).isEqualTo(Category.OTHER);
      assertThat(decision.getUrgency()).isEqualTo(0.5);
      assertThat(decision.getModelId()).isEqualTo(ComplaintClassifier.FALLBACK_MODEL_ID);
      assertThat(decision.getDegradations()).containsExactly(Degradation.CLASSIFIER_FALLBACK);
      assertThat(decisionLog.size()).isEqualTo(1);
    }

    @Test
    void shouldFallBackWhenModelIsUnavailable() {
      // Given
      ComplaintModel model = mock(ComplaintModel.class);
      when(model.predict(any())).thenThrow(new ModelUnavailableException("no credentials"));

      // When
      ComplaintDecision decision =
          orchestrator(model, new InMemoryClusterStore(), decisionLog)
              .triage(TriageTestFixtures.complaint("seat broken", "Coach-B12"));

      // Then
      assertThat(decision.getDegradations()).contains(Degradation.CLASSIFIER_FALLBACK);
    }

    @Test
    void shouldFallBackWithoutCallingModelWhenBudgetIsSpent() {
      ComplaintModel model = mock(ComplaintModel.class);

      ComplaintDecision decision =
          orchestrator(model, new InMemoryClusterStore(), decisionLog)
              .triage(TriageTestFixtures.complaint("seat broken", "Coach-B12"), Duration.ZERO);

      assertThat(decision.getDegradations()).contains(Degradation.CLASSIFIER_FALLBACK);
      verify(model, never()).predict(any());
    }

    @Test
    void shouldTreatComplaintAsNewWhenClusterStoreFails() {
      // Given
      ClusterStore store = mock(ClusterStore.class);
      when(store.findActive(any())).thenThrow(new StorageUnavailableException("down"));

      // When
      ComplaintDecision decision =
          orchestrator(new KeywordComplaintModel(), store, decisionLog)
              .triage(TriageTestFixtures.complaint("seat broken", "Coach-B12"));

      // Then
      assertThat(decision.getDegradations()).containsExactly(Degradation.DEDUP_UNAVAILABLE);
      assertThat(decision.isNewCluster()).isTrue();
      assertThat(decision.getClusterId()).isNull();
      assertThat(decision.getClusterMemberCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Fatal failures")
  class FatalFailures {

    @Test
    void shouldRefuseWhenFallbackIsDisabled() {
      // Given
      properties.getClassification().setTimeout(Duration.ofMillis(100));
      properties.getClassification().setFallbackEnabled(false);
      TriageOrchestrator slow =
          orchestrator(new SlowModel(Duration.ofSeconds(2)), new InMemoryClusterStore(), decisionLog);

      // When / Then
      assertThatThrownBy(() -> slow.triage(TriageTestFixtures.complaint("seat broken", "B12")))
          .isInstanceOf(ModelUnavailableException.class);
      assertThat(decisionLog.size()).isZero();
    }

    @Test
    void shouldPropagateRecorderFailure() {
      // Given
      DecisionRecorder recorder = mock(DecisionRecorder.class);
      doThrow(new StorageUnavailableException("decision log down")).when(recorder).record(any());
      TriageOrchestrator failing =
          orchestrator(new KeywordComplaintModel(), new InMemoryClusterStore(), recorder);

      // When / Then
      assertThatThrownBy(() -> failing.triage(TriageTestFixtures.complaint("seat broken", "B12")))
          .isInstanceOf(StorageUnavailableException.class)
          .hasMessageContaining("decision log down");
    }
  }

  @Nested
  @DisplayName("Asynchronous submission")
  class AsynchronousSubmission {

    @Test
    void shouldCompleteSubmittedTriage() throws Exception {
      // Given
      TriageHandle handle =
          orchestrator.submit(TriageTestFixtures.complaint("fan not working", "Coach-A1"));

      // When
      ComplaintDecision decision = handle.decision().get(5, TimeUnit.SECONDS);

      // Then
      assertThat(decision.getComplaintId()).isEqualTo(handle.getComplaintId());
      assertThat(handle.getState()).isEqualTo(TriageState.DECIDED);
      assertThat(handle.cancel()).isFalse();
    }

    @Test
    void shouldStopAtNextStageWhenCancelledBeforeRouting() throws Exception {
      // Given
      properties.getClassification().setTimeout(Duration.ofSeconds(5));
      CountDownLatch entered = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      ComplaintModel blocking =
          new ComplaintModel() {
            @Override
            public Map<Category, Double> predict(String text) {
              entered.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return Map.of(Category.MAINTENANCE, 1.0);
            }

            @Override
            public String getModelId() {
              return "blocking";
            }
          };
      TriageOrchestrator gated =
          orchestrator(blocking, new InMemoryClusterStore(), decisionLog);

      // When
      TriageHandle handle =
          gated.submit(TriageTestFixtures.complaint("seat broken", "Coach-B12"), Duration.ofSeconds(5));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      boolean cancelled = handle.cancel();
      release.countDown();

      // Then
      assertThat(cancelled).isTrue();
      assertThatThrownBy(() -> handle.decision().get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(CancellationException.class);
      assertThat(handle.getState()).isEqualTo(TriageState.CANCELLED);
      assertThat(decisionLog.size()).isZero();
    }
  }

  /** Model that answers only after a delay, or not at all when interrupted. */
  private static class SlowModel implements ComplaintModel {

    private final Duration delay;

    SlowModel(Duration delay) {
      this.delay = delay;
    }

    @Override
    public Map<Category, Double> predict(String text) {
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return Map.of(Category.MAINTENANCE, 1.0);
    }

    @Override
    public String getModelId() {
      return "slow";
    }
  }
}
