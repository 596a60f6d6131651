package com.railmadad.triage.service.classification;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.exception.ModelUnavailableException;
import com.railmadad.triage.service.aws.LLMService;
import com.railmadad.triage.service.aws.LLMServiceSelector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Category model backed by a hosted LLM. The model is asked for a JSON object of category
 * probabilities; the answer is renormalized. Any provider or parsing failure surfaces as
 * {@link ModelUnavailableException} so the orchestrator can fall back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "triage.classification.model", havingValue = "llm")
public class LlmComplaintModel implements ComplaintModel {

  private final LLMServiceSelector llmServiceSelector;
  private final ObjectMapper objectMapper;

  @Override
  public Map<Category, Double> predict(String text) {
    LLMService llmService;
    try {
      llmService = llmServiceSelector.getLLMService();
    } catch (IllegalStateException e) {
      throw new ModelUnavailableException("No LLM provider configured", e);
    }

    String response;
    try {
      response = llmService.complete(buildPrompt(text));
    } catch (Exception e) {
      throw new ModelUnavailableException("LLM classification failed: " + e.getMessage(), e);
    }
    return parseDistribution(response);
  }

  @Override
  public String getModelId() {
    try {
      return "llm:" + llmServiceSelector.getLLMService().getCurrentModelId();
    } catch (IllegalStateException e) {
      return "llm:unconfigured";
    }
  }

  String buildPrompt(String text) {
    StringBuilder prompt = new StringBuilder();
    prompt.append("You triage passenger complaints for a railway.\n");
    prompt.append("Classify the complaint into these categories: ");
    Category[] categories = Category.values();
    for (int i = 0; i < categories.length; i++) {
      prompt.append(categories[i].name());
      prompt.append(i < categories.length - 1 ? ", " : ".\n");
    }
    prompt.append("Answer with a single JSON object mapping each category to a probability ");
    prompt.append("between 0 and 1, probabilities summing to 1, and nothing else.\n\n");
    prompt.append("Complaint: ").append(text);
    return prompt.toString();
  }

  Map<Category, Double> parseDistribution(String response) {
    if (response == null) {
      throw new ModelUnavailableException("LLM returned no content");
    }
    int start = response.indexOf('{');
    int end = response.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new ModelUnavailableException("LLM response contains no JSON object");
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(response.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw new ModelUnavailableException("LLM response is not valid JSON", e);
    }

    Map<Category, Double> scores = new EnumMap<>(Category.class);
    double total = 0.0;
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      Category category;
      try {
        category = Category.valueOf(field.getKey().trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        log.debug("Ignoring unknown category '{}' in LLM response", field.getKey());
        continue;
      }
      double score = field.getValue().asDouble(0.0);
      if (score > 0 && Double.isFinite(score)) {
        scores.merge(category, score, Double::sum);
        total += score;
      }
    }

    if (total <= 0.0) {
      throw new ModelUnavailableException("LLM response has no usable probabilities");
    }
    Map<Category, Double> distribution = new EnumMap<>(Category.class);
    for (Map.Entry<Category, Double> score : scores.entrySet()) {
      distribution.put(score.getKey(), score.getValue() / total);
    }
    return distribution;
  }
}
