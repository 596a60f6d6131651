package com.railmadad.triage.exception;

/** A backing store could not be reached. */
public class StorageUnavailableException extends TriageException {

  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
