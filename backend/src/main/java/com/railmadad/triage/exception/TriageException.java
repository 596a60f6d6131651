package com.railmadad.triage.exception;

/**
 * Fatal triage failure. The complaint is refused rather than routed; the caller is expected to ask
 * the user to retry.
 */
public abstract class TriageException extends RuntimeException {

  protected TriageException(String message) {
    super(message);
  }

  protected TriageException(String message, Throwable cause) {
    super(message, cause);
  }
}
