package com.railmadad.triage.service.extraction;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/** Used when no OCR provider is configured; images only count as media evidence. */
@Slf4j
@Service
@ConditionalOnProperty(name = "triage.ocr.provider", havingValue = "none", matchIfMissing = true)
public class DisabledOcrService implements OcrService {

  @Override
  public String extractText(byte[] imageBytes) {
    log.debug("OCR disabled, ignoring {} image bytes", imageBytes == null ? 0 : imageBytes.length);
    return "";
  }

  @Override
  public String getProviderName() {
    return "none";
  }
}
