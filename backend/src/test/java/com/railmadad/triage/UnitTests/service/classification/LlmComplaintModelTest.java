package com.railmadad.triage.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.railmadad.triage.dto.complaint.Category;
import com.railmadad.triage.exception.ModelUnavailableException;
import com.railmadad.triage.service.aws.LLMService;
import com.railmadad.triage.service.aws.LLMServiceSelector;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmComplaintModel Tests")
class LlmComplaintModelTest {

  @Mock private LLMServiceSelector selector;
  @Mock private LLMService llmService;

  private LlmComplaintModel model;

  @BeforeEach
  void setUp() {
    model = new LlmComplaintModel(selector, new ObjectMapper());
  }

  @Test
  void shouldParseAndNormalizeDistribution() throws Exception {
    // Given
    when(selector.getLLMService()).thenReturn(llmService);
    when(llmService.complete(contains("Complaint: seat broken")))
        .thenReturn("Sure! {\"MAINTENANCE\": 0.6, \"cleanliness\": 0.2, \"FOOD\": 0.5}");

    // When
    Map<Category, Double> distribution = model.predict("seat broken");

    // Then
    assertThat(distribution).containsOnlyKeys(Category.MAINTENANCE, Category.CLEANLINESS);
    assertThat(distribution.get(Category.MAINTENANCE)).isCloseTo(0.75, within(1e-9));
    assertThat(distribution.get(Category.CLEANLINESS)).isCloseTo(0.25, within(1e-9));
  }

  @Test
  void shouldListEveryCategoryInPrompt() {
    String prompt = model.buildPrompt("fan not working");

    for (Category category : Category.values()) {
      assertThat(prompt).contains(category.name());
    }
    assertThat(prompt).endsWith("Complaint: fan not working");
  }

  @Test
  void shouldReportUnavailableWhenNoProviderConfigured() {
    when(selector.getLLMService()).thenThrow(new IllegalStateException("No LLM service"));

    assertThatThrownBy(() -> model.predict("seat broken"))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessageContaining("No LLM provider configured");
  }

  @Test
  void shouldReportUnavailableWhenProviderCallFails() throws Exception {
    when(selector.getLLMService()).thenReturn(llmService);
    when(llmService.complete(anyString())).thenThrow(new RuntimeException("connection reset"));

    assertThatThrownBy(() -> model.predict("seat broken"))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessageContaining("connection reset");
  }

  @Test
  void shouldReportUnavailableForUnusableAnswers() {
    assertThatThrownBy(() -> model.parseDistribution("I cannot classify this"))
        .isInstanceOf(ModelUnavailableException.class);
    assertThatThrownBy(() -> model.parseDistribution("{\"SAFETY\": }"))
        .isInstanceOf(ModelUnavailableException.class);
    assertThatThrownBy(() -> model.parseDistribution("{\"SAFETY\": 0, \"STAFF\": -1}"))
        .isInstanceOf(ModelUnavailableException.class);
  }

  @Test
  void shouldPrefixProviderModelId() {
    when(selector.getLLMService()).thenReturn(llmService);
    when(llmService.getCurrentModelId()).thenReturn("gpt-4o-mini");

    assertThat(model.getModelId()).isEqualTo("llm:gpt-4o-mini");
  }
}
