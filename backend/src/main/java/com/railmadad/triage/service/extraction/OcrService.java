package com.railmadad.triage.service.extraction;

/** Extracts printed text from a complaint photo. */
public interface OcrService {

  /**
   * @param imageBytes encoded image (JPEG or PNG)
   * @return the recognised text, possibly empty
   * @throws OcrException if the image could not be processed
   */
  String extractText(byte[] imageBytes) throws OcrException;

  String getProviderName();
}
