package com.railmadad.triage.service.extraction;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import com.railmadad.triage.config.TriageProperties;
import com.railmadad.triage.dto.complaint.ComplaintInput;
import com.railmadad.triage.dto.complaint.FeatureBundle;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives a {@link FeatureBundle} from a complaint. Pure apart from the OCR call, which runs on
 * its own executor under a timeout; OCR trouble marks the bundle degraded instead of failing.
 */
@Slf4j
@Service
public class FeatureExtractor {

  private final OcrService ocrService;
  private final TextNormalizer textNormalizer;
  private final LocationNormalizer locationNormalizer;
  private final TriageProperties properties;
  private final AsyncTaskExecutor ocrExecutor;

  public FeatureExtractor(
      OcrService ocrService,
      TextNormalizer textNormalizer,
      LocationNormalizer locationNormalizer,
      TriageProperties properties,
      @Qualifier("ocrExecutor") AsyncTaskExecutor ocrExecutor) {
    this.ocrService = ocrService;
    this.textNormalizer = textNormalizer;
    this.locationNormalizer = locationNormalizer;
    this.properties = properties;
    this.ocrExecutor = ocrExecutor;
  }

  public FeatureBundle extract(ComplaintInput input) {
    return extract(input, properties.getOcr().getTimeout());
  }

  /**
   * @param ocrLimit upper bound for the OCR call on top of the configured OCR timeout; zero or
   *     negative skips OCR and marks the bundle degraded
   */
  public FeatureBundle extract(ComplaintInput input, Duration ocrLimit) {
    String ocrText = "";
    boolean degraded = false;

    if (input.hasImage()) {
      Duration timeout = properties.getOcr().getTimeout();
      if (ocrLimit.compareTo(timeout) < 0) {
        timeout = ocrLimit;
      }
      try {
        ocrText = textNormalizer.normalize(runOcr(input.getImageBytes(), timeout));
      } catch (OcrException e) {
        degraded = true;
        log.warn(
            "OCR failed for complaint {} via {}: {}",
            input.getComplaintId(),
            ocrService.getProviderName(),
            e.getMessage());
      }
    }

    FeatureBundle bundle =
        FeatureBundle.builder()
            .normalizedText(textNormalizer.normalize(input.getText()))
            .ocrText(ocrText)
            .hasMedia(input.hasImage() || input.hasVideo())
            .locationToken(locationNormalizer.normalize(input.getReporterLocation()))
            .degraded(degraded)
            .submittedAt(input.getSubmittedAt())
            .build();

    log.debug(
        "Extracted features for complaint {}: location={}, media={}, degraded={}",
        input.getComplaintId(),
        bundle.getLocationToken(),
        bundle.hasMedia(),
        degraded);
    return bundle;
  }

  private String runOcr(byte[] image, Duration timeout) throws OcrException {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new OcrException("No latency budget left for OCR");
    }
    Future<String> future;
    try {
      future = ocrExecutor.submit(() -> ocrService.extractText(image));
    } catch (RejectedExecutionException e) {
      throw new OcrException("OCR executor saturated", e);
    }

    try {
      String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return text == null ? "" : text;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new OcrException("OCR timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof OcrException) {
        throw (OcrException) cause;
      }
      throw new OcrException("OCR failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new OcrException("Interrupted while waiting for OCR", e);
    }
  }
}
