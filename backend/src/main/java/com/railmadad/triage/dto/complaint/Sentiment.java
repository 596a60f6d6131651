package com.railmadad.triage.dto.complaint;

public enum Sentiment {
  POSITIVE,
  NEGATIVE,
  NEUTRAL
}
