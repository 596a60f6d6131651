package com.railmadad.triage.dto.complaint;

/** Department categories a complaint can be classified into. */
public enum Category {
  CLEANLINESS,
  MAINTENANCE,
  SAFETY,
  STAFF,
  OTHER
}
