package com.railmadad.triage.service.extraction;

/** OCR could not produce text. Never escapes feature extraction. */
public class OcrException extends Exception {

  public OcrException(String message) {
    super(message);
  }

  public OcrException(String message, Throwable cause) {
    super(message, cause);
  }
}
