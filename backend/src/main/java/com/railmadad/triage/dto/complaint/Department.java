package com.railmadad.triage.dto.complaint;

/** Operational units that resolve complaints. */
public enum Department {
  HOUSEKEEPING,
  MAINTENANCE,
  SAFETY,
  SERVICE_QUALITY,
  GENERAL_ADMINISTRATION
}
