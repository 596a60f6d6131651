package com.railmadad.triage.exception;

/** The category model cannot be reached or is not configured. */
public class ModelUnavailableException extends TriageException {

  public ModelUnavailableException(String message) {
    super(message);
  }

  public ModelUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
