package com.railmadad.triage.dto.chat;

/** Intents in detection priority order: the first matching intent wins. */
public enum ChatIntent {
  EMERGENCY,
  COMPLAINT,
  STATUS,
  GREETING,
  THANKS,
  GENERAL;

  public boolean isComplaint() {
    return this == EMERGENCY || this == COMPLAINT;
  }
}
