package com.railmadad.triage.service.classification;

import java.util.Map;

import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.exception.ModelUnavailableException;

/** A category model: maps normalized complaint text to a probability per category. */
public interface ComplaintModel {

  /**
   * @param text normalized free text and OCR text
   * @return probabilities summing to 1; categories absent from the map have probability 0
   * @throws ModelUnavailableException if the model cannot be reached or answers unusably
   */
  Map<Category, Double> predict(String text);

  String getModelId();
}
