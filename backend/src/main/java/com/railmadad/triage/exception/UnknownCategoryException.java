package com.railmadad.triage.exception;

import com.railmadad.triage.dto.complaint.Category;

import lombok.Getter;

/** Routing configuration has no entry for a category. */
@Getter
public class UnknownCategoryException extends TriageException {

  private final Category category;

  public UnknownCategoryException(Category category, String what) {
    super(String.format("No %s configured for category %s", what, category));
    this.category = category;
  }
}
